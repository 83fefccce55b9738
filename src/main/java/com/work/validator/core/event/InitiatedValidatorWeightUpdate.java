package com.work.validator.core.event;

import com.work.validator.core.model.Bytes32;

public class InitiatedValidatorWeightUpdate extends ValidatorManagerEvent {

    private final Bytes32 validationId;
    private final long nonce;
    private final Bytes32 weightUpdateMessageId;
    private final long weight;

    public InitiatedValidatorWeightUpdate(Bytes32 validationId, long nonce, Bytes32 weightUpdateMessageId, long weight) {
        this.validationId = validationId;
        this.nonce = nonce;
        this.weightUpdateMessageId = weightUpdateMessageId;
        this.weight = weight;
    }

    public Bytes32 getValidationId() {
        return validationId;
    }

    public long getNonce() {
        return nonce;
    }

    public Bytes32 getWeightUpdateMessageId() {
        return weightUpdateMessageId;
    }

    public long getWeight() {
        return weight;
    }

    @Override
    public String toString() {
        return "InitiatedValidatorWeightUpdate{" +
                "validationId=" + validationId +
                ", nonce=" + nonce +
                ", weightUpdateMessageId=" + weightUpdateMessageId +
                ", weight=" + weight +
                '}';
    }
}
