package com.greencover.model;

public enum BatchTrigger {
    SCHEDULED,
    MANUAL
}
