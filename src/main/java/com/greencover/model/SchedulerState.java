package com.greencover.model;

/**
 * Batch scheduler states. COMPLETED and ABORTED_ON_TIMEOUT are transient:
 * the scheduler returns to IDLE right after reporting them.
 */
public enum SchedulerState {
    IDLE,
    RUNNING,
    COMPLETED,
    ABORTED_ON_TIMEOUT
}
