package com.work.validator.core.staking;

import com.work.validator.core.model.ValidatorRegistrationRequest;

import java.math.BigInteger;

/**
 * 质押验证者注册入参。registration 中的 weight 会被忽略，以 stakeAmount 换算出的权重为准。
 */
public final class StakingValidatorRequest {

    private final ValidatorRegistrationRequest registration;
    private final int delegationFeeBips;
    private final long minStakeDuration;
    private final BigInteger stakeAmount;
    private final String rewardRecipient;

    public StakingValidatorRequest(ValidatorRegistrationRequest registration,
                                   int delegationFeeBips,
                                   long minStakeDuration,
                                   BigInteger stakeAmount,
                                   String rewardRecipient) {
        if (registration == null) {
            throw new IllegalArgumentException("registration 不能为null");
        }
        if (stakeAmount == null) {
            throw new IllegalArgumentException("stakeAmount 不能为null");
        }
        this.registration = registration;
        this.delegationFeeBips = delegationFeeBips;
        this.minStakeDuration = minStakeDuration;
        this.stakeAmount = stakeAmount;
        this.rewardRecipient = rewardRecipient;
    }

    public ValidatorRegistrationRequest getRegistration() {
        return registration;
    }

    public int getDelegationFeeBips() {
        return delegationFeeBips;
    }

    public long getMinStakeDuration() {
        return minStakeDuration;
    }

    public BigInteger getStakeAmount() {
        return stakeAmount;
    }

    public String getRewardRecipient() {
        return rewardRecipient;
    }
}
