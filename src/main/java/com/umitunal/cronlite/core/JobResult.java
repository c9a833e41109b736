package com.umitunal.cronlite.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result returned by a job handler.
 */
public final class JobResult {
    private final boolean success;
    private final String message;
    private final Map<String, Object> output;

    private JobResult(boolean success, String message, Map<String, Object> output) {
        this.success = success;
        this.message = message;
        this.output = output == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(output));
    }

    public boolean isSuccess() { return success; }
    public String getMessage() { return message; }
    public Map<String, Object> getOutput() { return output; }

    public static JobResult success() {
        return new JobResult(true, null, null);
    }

    public static JobResult success(String message) {
        return new JobResult(true, message, null);
    }

    public static JobResult success(String message, Map<String, Object> output) {
        return new JobResult(true, message, output);
    }

    public static JobResult failure(String message) {
        return new JobResult(false, message, null);
    }

    @Override
    public String toString() {
        return "JobResult{success=" + success + ", message='" + message + "', output=" + output + '}';
    }
}
