package com.work.validator.core.model;

import java.math.BigInteger;
import java.util.Objects;

/**
 * 一笔委托，以 delegationId = keccak256(validationId ‖ startingNonce) 为键。
 * <p>pendingReward 在发起移除时计算并冻结，完成移除时扣除手续费后发放。</p>
 */
public class Delegator {

    private final Bytes32 delegationId;
    private final String owner;
    private final Bytes32 validationId;
    private final long weight;
    private final long startingNonce;
    private DelegatorStatus status;
    private long startTime;
    private long endTime;
    private long endingNonce;
    private String rewardRecipient;
    private BigInteger pendingReward;

    public Delegator(Bytes32 delegationId,
                     DelegatorStatus status,
                     String owner,
                     Bytes32 validationId,
                     long weight,
                     long startTime,
                     long endTime,
                     long startingNonce,
                     long endingNonce,
                     String rewardRecipient,
                     BigInteger pendingReward) {
        if (delegationId == null) {
            throw new IllegalArgumentException("delegationId 不能为null");
        }
        if (validationId == null) {
            throw new IllegalArgumentException("validationId 不能为null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status 不能为null");
        }
        if (owner == null || owner.isEmpty()) {
            throw new IllegalArgumentException("owner 不能为空");
        }
        this.delegationId = delegationId;
        this.status = status;
        this.owner = owner;
        this.validationId = validationId;
        this.weight = weight;
        this.startTime = startTime;
        this.endTime = endTime;
        this.startingNonce = startingNonce;
        this.endingNonce = endingNonce;
        this.rewardRecipient = rewardRecipient;
        this.pendingReward = pendingReward == null ? BigInteger.ZERO : pendingReward;
    }

    public Delegator copy() {
        return new Delegator(delegationId, status, owner, validationId, weight, startTime, endTime,
                startingNonce, endingNonce, rewardRecipient, pendingReward);
    }

    public Bytes32 getDelegationId() {
        return delegationId;
    }

    public DelegatorStatus getStatus() {
        return status;
    }

    public void setStatus(DelegatorStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("status 不能为null");
        }
        this.status = status;
    }

    public String getOwner() {
        return owner;
    }

    public Bytes32 getValidationId() {
        return validationId;
    }

    public long getWeight() {
        return weight;
    }

    public long getStartTime() {
        return startTime;
    }

    public void setStartTime(long startTime) {
        this.startTime = startTime;
    }

    public long getEndTime() {
        return endTime;
    }

    public void setEndTime(long endTime) {
        this.endTime = endTime;
    }

    public long getStartingNonce() {
        return startingNonce;
    }

    public long getEndingNonce() {
        return endingNonce;
    }

    public void setEndingNonce(long endingNonce) {
        this.endingNonce = endingNonce;
    }

    public String getRewardRecipient() {
        return rewardRecipient;
    }

    public void setRewardRecipient(String rewardRecipient) {
        this.rewardRecipient = rewardRecipient;
    }

    public BigInteger getPendingReward() {
        return pendingReward;
    }

    public void setPendingReward(BigInteger pendingReward) {
        this.pendingReward = pendingReward == null ? BigInteger.ZERO : pendingReward;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return delegationId.equals(((Delegator) o).delegationId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(delegationId);
    }

    @Override
    public String toString() {
        return "Delegator{" +
                "delegationId=" + delegationId +
                ", status=" + status +
                ", owner='" + owner + '\'' +
                ", validationId=" + validationId +
                ", weight=" + weight +
                ", startingNonce=" + startingNonce +
                ", endingNonce=" + endingNonce +
                '}';
    }
}
