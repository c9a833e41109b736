package com.umitunal.cronlite.delivery;

import com.umitunal.cronlite.core.Job;
import com.umitunal.cronlite.core.JobResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Announces results on the application log. Used when no other channel is configured.
 */
public class LoggingDeliveryChannel implements DeliveryChannel {
    private static final Logger log = LoggerFactory.getLogger(LoggingDeliveryChannel.class);

    @Override
    public void deliver(String target, Job job, JobResult result) {
        log.info("[{}] job {} ({}): {} {}", target == null ? "default" : target,
                job.getId(), job.getName(), result.getMessage() == null ? "done" : result.getMessage(),
                result.getOutput().isEmpty() ? "" : result.getOutput());
    }
}
