package com.work.validator.core.event;

import com.work.validator.core.model.Bytes32;

public class CompletedDelegatorRegistration extends ValidatorManagerEvent {

    private final Bytes32 delegationId;
    private final Bytes32 validationId;
    private final long startTime;

    public CompletedDelegatorRegistration(Bytes32 delegationId, Bytes32 validationId, long startTime) {
        this.delegationId = delegationId;
        this.validationId = validationId;
        this.startTime = startTime;
    }

    public Bytes32 getDelegationId() {
        return delegationId;
    }

    public Bytes32 getValidationId() {
        return validationId;
    }

    public long getStartTime() {
        return startTime;
    }

    @Override
    public String toString() {
        return "CompletedDelegatorRegistration{" +
                "delegationId=" + delegationId +
                ", validationId=" + validationId +
                ", startTime=" + startTime +
                '}';
    }
}
