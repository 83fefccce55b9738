package com.work.validator.core.model;

import java.math.BigInteger;

/**
 * 质押验证者的附加信息。redeemableRewards 同时累积验证者自身奖励与委托手续费。
 */
public class PoSValidatorInfo {

    private final Bytes32 validationId;
    private final String owner;
    private final int delegationFeeBips;
    private final long minStakeDuration;
    private long uptimeSeconds;
    private String rewardRecipient;
    private BigInteger redeemableRewards;

    public PoSValidatorInfo(Bytes32 validationId,
                            String owner,
                            int delegationFeeBips,
                            long minStakeDuration,
                            long uptimeSeconds,
                            String rewardRecipient,
                            BigInteger redeemableRewards) {
        if (validationId == null) {
            throw new IllegalArgumentException("validationId 不能为null");
        }
        if (owner == null || owner.isEmpty()) {
            throw new IllegalArgumentException("owner 不能为空");
        }
        this.validationId = validationId;
        this.owner = owner;
        this.delegationFeeBips = delegationFeeBips;
        this.minStakeDuration = minStakeDuration;
        this.uptimeSeconds = uptimeSeconds;
        this.rewardRecipient = rewardRecipient;
        this.redeemableRewards = redeemableRewards == null ? BigInteger.ZERO : redeemableRewards;
    }

    public PoSValidatorInfo copy() {
        return new PoSValidatorInfo(validationId, owner, delegationFeeBips, minStakeDuration, uptimeSeconds,
                rewardRecipient, redeemableRewards);
    }

    public Bytes32 getValidationId() {
        return validationId;
    }

    public String getOwner() {
        return owner;
    }

    public int getDelegationFeeBips() {
        return delegationFeeBips;
    }

    public long getMinStakeDuration() {
        return minStakeDuration;
    }

    public long getUptimeSeconds() {
        return uptimeSeconds;
    }

    public void setUptimeSeconds(long uptimeSeconds) {
        this.uptimeSeconds = uptimeSeconds;
    }

    public String getRewardRecipient() {
        return rewardRecipient;
    }

    public void setRewardRecipient(String rewardRecipient) {
        this.rewardRecipient = rewardRecipient;
    }

    public BigInteger getRedeemableRewards() {
        return redeemableRewards;
    }

    public void setRedeemableRewards(BigInteger redeemableRewards) {
        this.redeemableRewards = redeemableRewards == null ? BigInteger.ZERO : redeemableRewards;
    }
}
