package com.umitunal.cronlite.worker;

import com.umitunal.cronlite.core.JobResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Built-in handler for kind {@code log}: writes the {@code message} parameter to the log.
 * Handy for checking that a deployment fires jobs at all.
 */
public class LogJobHandler implements JobHandler {
    private static final Logger log = LoggerFactory.getLogger(LogJobHandler.class);

    public static final String KIND = "log";

    @Override
    public JobResult handle(ExecutionContext context) {
        String message = context.getPayload().getString("message");
        log.info("Job {} (attempt {}): {}", context.getJobId(), context.getAttemptNumber(),
                message == null ? "<no message>" : message);
        return JobResult.success(message, Map.of("jobId", context.getJobId()));
    }
}
