package com.greencover.model;

public enum BatchRunStatus {
    COMPLETED,
    ABORTED_ON_TIMEOUT,
    /** Another run was active when this one was requested */
    REJECTED
}
