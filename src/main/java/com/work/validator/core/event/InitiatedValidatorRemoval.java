package com.work.validator.core.event;

import com.work.validator.core.model.Bytes32;

public class InitiatedValidatorRemoval extends ValidatorManagerEvent {

    private final Bytes32 validationId;
    private final Bytes32 validatorWeightMessageId;
    private final long weight;
    private final long endTime;

    public InitiatedValidatorRemoval(Bytes32 validationId, Bytes32 validatorWeightMessageId, long weight, long endTime) {
        this.validationId = validationId;
        this.validatorWeightMessageId = validatorWeightMessageId;
        this.weight = weight;
        this.endTime = endTime;
    }

    public Bytes32 getValidationId() {
        return validationId;
    }

    public Bytes32 getValidatorWeightMessageId() {
        return validatorWeightMessageId;
    }

    public long getWeight() {
        return weight;
    }

    public long getEndTime() {
        return endTime;
    }

    @Override
    public String toString() {
        return "InitiatedValidatorRemoval{" +
                "validationId=" + validationId +
                ", validatorWeightMessageId=" + validatorWeightMessageId +
                ", weight=" + weight +
                ", endTime=" + endTime +
                '}';
    }
}
