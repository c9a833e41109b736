package com.umitunal.cronlite.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Opaque work description handed to a handler. The engine reads only {@link #getKind()}
 * to pick the handler; parameters are interpreted by the handler alone.
 */
public final class JobPayload {
    private final String kind;
    private final Map<String, Object> params;

    @JsonCreator
    public JobPayload(@JsonProperty("kind") String kind,
                      @JsonProperty("params") Map<String, Object> params) {
        if (kind == null || kind.trim().isEmpty()) {
            throw new IllegalArgumentException("Payload kind must not be empty");
        }
        this.kind = kind;
        this.params = params == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static JobPayload of(String kind) {
        return new JobPayload(kind, null);
    }

    public static JobPayload of(String kind, Map<String, Object> params) {
        return new JobPayload(kind, params);
    }

    public String getKind() {
        return kind;
    }

    public Map<String, Object> getParams() {
        return params;
    }

    /**
     * Convenience accessor for string parameters.
     */
    public String getString(String key) {
        Object value = params.get(key);
        return value == null ? null : value.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobPayload)) return false;
        JobPayload that = (JobPayload) o;
        return kind.equals(that.kind) && params.equals(that.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, params);
    }

    @Override
    public String toString() {
        return "JobPayload{kind='" + kind + "', params=" + params + '}';
    }
}
