package com.umitunal.cronlite.core;

public class InvalidScheduleException extends CronliteException {

    public InvalidScheduleException(String message) {
        super(message);
    }

    public InvalidScheduleException(String message, Throwable cause) {
        super(message, cause);
    }
}
