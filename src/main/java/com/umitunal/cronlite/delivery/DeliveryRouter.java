package com.umitunal.cronlite.delivery;

import com.umitunal.cronlite.core.Delivery;
import com.umitunal.cronlite.core.Job;
import com.umitunal.cronlite.core.JobResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends the result of a successful run wherever the job asked for it.
 */
public class DeliveryRouter {
    private static final Logger log = LoggerFactory.getLogger(DeliveryRouter.class);

    private final DeliveryChannel channel;

    public DeliveryRouter() {
        this(new LoggingDeliveryChannel());
    }

    public DeliveryRouter(DeliveryChannel channel) {
        this.channel = channel;
    }

    /**
     * @throws DeliveryException if a required announcement failed
     */
    public DeliveryStatus route(Job job, JobResult result) {
        Delivery delivery = job.getDelivery();
        if (delivery == null || delivery.getMode() == Delivery.Mode.SILENT) {
            return DeliveryStatus.SKIPPED;
        }

        try {
            channel.deliver(delivery.getTarget(), job, result);
            return DeliveryStatus.DELIVERED;
        } catch (Exception e) {
            if (delivery.isBestEffort()) {
                log.warn("Best-effort delivery of job {} to '{}' failed: {}",
                        job.getId(), delivery.getTarget(), e.toString());
                return DeliveryStatus.FAILED_IGNORED;
            }
            throw new DeliveryException("delivery failed: " + e.getMessage(), e);
        }
    }
}
