package com.work.validator.host.web.dto;

import javax.validation.constraints.NotNull;
import java.math.BigInteger;

public class StakingValidatorRequestDto extends RegisterValidatorRequest {

    private int delegationFeeBips;

    private long minStakeDuration;

    @NotNull(message = "stakeAmount 不能为空")
    private BigInteger stakeAmount;

    private String rewardRecipient;

    public int getDelegationFeeBips() {
        return delegationFeeBips;
    }

    public void setDelegationFeeBips(int delegationFeeBips) {
        this.delegationFeeBips = delegationFeeBips;
    }

    public long getMinStakeDuration() {
        return minStakeDuration;
    }

    public void setMinStakeDuration(long minStakeDuration) {
        this.minStakeDuration = minStakeDuration;
    }

    public BigInteger getStakeAmount() {
        return stakeAmount;
    }

    public void setStakeAmount(BigInteger stakeAmount) {
        this.stakeAmount = stakeAmount;
    }

    public String getRewardRecipient() {
        return rewardRecipient;
    }

    public void setRewardRecipient(String rewardRecipient) {
        this.rewardRecipient = rewardRecipient;
    }
}
