package com.umitunal.cronlite.core;

public class DuplicateJobException extends CronliteException {

    public DuplicateJobException(String jobId) {
        super("Job already exists: " + jobId);
    }
}
