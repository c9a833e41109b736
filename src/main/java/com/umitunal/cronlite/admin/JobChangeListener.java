package com.umitunal.cronlite.admin;

import com.umitunal.cronlite.model.JobRecord;

/**
 * Notified after an administrative change has been stored.
 */
public interface JobChangeListener {

    void jobChanged(JobRecord job);

    void jobDeleted(String jobId);
}
