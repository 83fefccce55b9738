package com.work.validator.core.config;

import com.work.validator.core.model.Bytes32;

import java.math.BigInteger;
import java.time.Duration;

/**
 * 质押管理器配置。金额单位为资产最小单位（wei）。
 */
public class StakingManagerSettings {

    private final BigInteger minimumStakeAmount;
    private final BigInteger maximumStakeAmount;
    private final Duration minimumStakeDuration;
    private final int minimumDelegationFeeBips;
    private final int maximumStakeMultiplier;
    private final BigInteger weightToValueFactor;
    private final Bytes32 uptimeBlockchainId;

    public StakingManagerSettings(BigInteger minimumStakeAmount,
                                  BigInteger maximumStakeAmount,
                                  Duration minimumStakeDuration,
                                  int minimumDelegationFeeBips,
                                  int maximumStakeMultiplier,
                                  BigInteger weightToValueFactor,
                                  Bytes32 uptimeBlockchainId) {
        this.minimumStakeAmount = minimumStakeAmount;
        this.maximumStakeAmount = maximumStakeAmount;
        this.minimumStakeDuration = minimumStakeDuration;
        this.minimumDelegationFeeBips = minimumDelegationFeeBips;
        this.maximumStakeMultiplier = maximumStakeMultiplier;
        this.weightToValueFactor = weightToValueFactor;
        this.uptimeBlockchainId = uptimeBlockchainId;
    }

    public BigInteger getMinimumStakeAmount() {
        return minimumStakeAmount;
    }

    public BigInteger getMaximumStakeAmount() {
        return maximumStakeAmount;
    }

    public Duration getMinimumStakeDuration() {
        return minimumStakeDuration;
    }

    public long getMinimumStakeDurationSeconds() {
        return minimumStakeDuration.getSeconds();
    }

    public int getMinimumDelegationFeeBips() {
        return minimumDelegationFeeBips;
    }

    public int getMaximumStakeMultiplier() {
        return maximumStakeMultiplier;
    }

    public BigInteger getWeightToValueFactor() {
        return weightToValueFactor;
    }

    public Bytes32 getUptimeBlockchainId() {
        return uptimeBlockchainId;
    }
}
