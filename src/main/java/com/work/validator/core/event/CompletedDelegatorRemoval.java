package com.work.validator.core.event;

import com.work.validator.core.model.Bytes32;

import java.math.BigInteger;

/**
 * rewards 为实际发放给委托者的奖励，fees 为计入验证者的委托手续费。
 */
public class CompletedDelegatorRemoval extends ValidatorManagerEvent {

    private final Bytes32 delegationId;
    private final Bytes32 validationId;
    private final BigInteger rewards;
    private final BigInteger fees;

    public CompletedDelegatorRemoval(Bytes32 delegationId, Bytes32 validationId, BigInteger rewards, BigInteger fees) {
        this.delegationId = delegationId;
        this.validationId = validationId;
        this.rewards = rewards;
        this.fees = fees;
    }

    public Bytes32 getDelegationId() {
        return delegationId;
    }

    public Bytes32 getValidationId() {
        return validationId;
    }

    public BigInteger getRewards() {
        return rewards;
    }

    public BigInteger getFees() {
        return fees;
    }

    @Override
    public String toString() {
        return "CompletedDelegatorRemoval{" +
                "delegationId=" + delegationId +
                ", validationId=" + validationId +
                ", rewards=" + rewards +
                ", fees=" + fees +
                '}';
    }
}
