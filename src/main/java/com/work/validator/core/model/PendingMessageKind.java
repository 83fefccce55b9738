package com.work.validator.core.model;

public enum PendingMessageKind {
    REGISTER_VALIDATOR,
    VALIDATOR_WEIGHT
}
