package com.work.validator.core.event;

import com.work.validator.core.model.Bytes32;

public class InitiatedDelegatorRemoval extends ValidatorManagerEvent {

    private final Bytes32 delegationId;
    private final Bytes32 validationId;

    public InitiatedDelegatorRemoval(Bytes32 delegationId, Bytes32 validationId) {
        this.delegationId = delegationId;
        this.validationId = validationId;
    }

    public Bytes32 getDelegationId() {
        return delegationId;
    }

    public Bytes32 getValidationId() {
        return validationId;
    }

    @Override
    public String toString() {
        return "InitiatedDelegatorRemoval{" +
                "delegationId=" + delegationId +
                ", validationId=" + validationId +
                '}';
    }
}
