package com.work.validator.core.event;

import com.work.validator.core.model.Bytes32;

public class CompletedValidatorWeightUpdate extends ValidatorManagerEvent {

    private final Bytes32 validationId;
    private final long nonce;
    private final long weight;

    public CompletedValidatorWeightUpdate(Bytes32 validationId, long nonce, long weight) {
        this.validationId = validationId;
        this.nonce = nonce;
        this.weight = weight;
    }

    public Bytes32 getValidationId() {
        return validationId;
    }

    public long getNonce() {
        return nonce;
    }

    public long getWeight() {
        return weight;
    }

    @Override
    public String toString() {
        return "CompletedValidatorWeightUpdate{" +
                "validationId=" + validationId +
                ", nonce=" + nonce +
                ", weight=" + weight +
                '}';
    }
}
