package com.umitunal.cronlite.delivery;

public enum DeliveryStatus {
    /** Silent job or no delivery configured. */
    SKIPPED,
    DELIVERED,
    /** Best-effort delivery failed; the run stays successful. */
    FAILED_IGNORED
}
