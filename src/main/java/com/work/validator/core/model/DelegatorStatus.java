package com.work.validator.core.model;

public enum DelegatorStatus {
    PENDING_ADDED,
    ACTIVE,
    PENDING_REMOVED,
    COMPLETED
}
