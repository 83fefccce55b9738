package com.work.validator.core.event;

import com.work.validator.core.model.Bytes32;

public class CompletedValidatorRemoval extends ValidatorManagerEvent {

    private final Bytes32 validationId;

    public CompletedValidatorRemoval(Bytes32 validationId) {
        this.validationId = validationId;
    }

    public Bytes32 getValidationId() {
        return validationId;
    }

    @Override
    public String toString() {
        return "CompletedValidatorRemoval{" +
                "validationId=" + validationId +
                '}';
    }
}
