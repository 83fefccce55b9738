package com.work.validator.core.event;

import com.work.validator.core.model.Bytes32;

public class CompletedValidatorRegistration extends ValidatorManagerEvent {

    private final Bytes32 validationId;
    private final long weight;

    public CompletedValidatorRegistration(Bytes32 validationId, long weight) {
        this.validationId = validationId;
        this.weight = weight;
    }

    public Bytes32 getValidationId() {
        return validationId;
    }

    public long getWeight() {
        return weight;
    }

    @Override
    public String toString() {
        return "CompletedValidatorRegistration{" +
                "validationId=" + validationId +
                ", weight=" + weight +
                '}';
    }
}
