package com.umitunal.cronlite.delivery;

import com.umitunal.cronlite.core.CronliteException;

/**
 * A required (not best-effort) delivery failed; the run counts as failed.
 */
public class DeliveryException extends CronliteException {

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
