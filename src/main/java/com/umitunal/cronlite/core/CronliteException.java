package com.umitunal.cronlite.core;

/**
 * Base class for all errors raised by the scheduling engine.
 */
public class CronliteException extends RuntimeException {

    public CronliteException(String message) {
        super(message);
    }

    public CronliteException(String message, Throwable cause) {
        super(message, cause);
    }
}
