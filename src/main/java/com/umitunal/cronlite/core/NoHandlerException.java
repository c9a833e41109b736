package com.umitunal.cronlite.core;

/**
 * No handler is registered for a payload kind. A configuration error, never retried.
 */
public class NoHandlerException extends CronliteException {
    private final String kind;

    public NoHandlerException(String kind) {
        super("No handler registered for job kind: " + kind);
        this.kind = kind;
    }

    public String getKind() {
        return kind;
    }
}
