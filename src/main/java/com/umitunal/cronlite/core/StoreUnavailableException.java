package com.umitunal.cronlite.core;

/**
 * Infrastructure failure of the job store. Retryable; callers decide how often.
 */
public class StoreUnavailableException extends CronliteException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
