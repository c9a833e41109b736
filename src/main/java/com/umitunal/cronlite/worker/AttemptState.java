package com.umitunal.cronlite.worker;

/**
 * Progress of a single attempt inside the runner.
 */
enum AttemptState {
    CLAIMED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    TIMED_OUT
}
