package com.work.validator.host.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import java.math.BigInteger;
import java.time.Duration;

/**
 * 质押配置项，前缀 staking。金额单位为资产最小单位。
 */
@Validated
@ConfigurationProperties(prefix = "staking")
public class StakingProperties {

    /**
     * 质押资产：native / erc20。
     */
    @NotBlank
    private String asset = "native";

    /**
     * asset=erc20 时的代币地址。
     */
    private String tokenAddress;

    @NotNull
    private BigInteger minimumStakeAmount = new BigInteger("20000000000000000000");

    @NotNull
    private BigInteger maximumStakeAmount = new BigInteger("10000000000000000000000000");

    @NotNull
    private Duration minimumStakeDuration = Duration.ofDays(1);

    private int minimumDelegationFeeBips = 1;

    private int maximumStakeMultiplier = 4;

    /**
     * 1 单位权重对应的质押额。
     */
    @NotNull
    private BigInteger weightToValueFactor = new BigInteger("1000000000000");

    /**
     * 在线时长证明的来源链（即本 L1 的 blockchainID）。
     */
    @NotBlank
    private String uptimeBlockchainId;

    /**
     * ExampleRewardCalculator 的年化基点。
     */
    private long rewardBasisPoints = 10;

    public String getAsset() {
        return asset;
    }

    public void setAsset(String asset) {
        this.asset = asset;
    }

    public String getTokenAddress() {
        return tokenAddress;
    }

    public void setTokenAddress(String tokenAddress) {
        this.tokenAddress = tokenAddress;
    }

    public BigInteger getMinimumStakeAmount() {
        return minimumStakeAmount;
    }

    public void setMinimumStakeAmount(BigInteger minimumStakeAmount) {
        this.minimumStakeAmount = minimumStakeAmount;
    }

    public BigInteger getMaximumStakeAmount() {
        return maximumStakeAmount;
    }

    public void setMaximumStakeAmount(BigInteger maximumStakeAmount) {
        this.maximumStakeAmount = maximumStakeAmount;
    }

    public Duration getMinimumStakeDuration() {
        return minimumStakeDuration;
    }

    public void setMinimumStakeDuration(Duration minimumStakeDuration) {
        this.minimumStakeDuration = minimumStakeDuration;
    }

    public int getMinimumDelegationFeeBips() {
        return minimumDelegationFeeBips;
    }

    public void setMinimumDelegationFeeBips(int minimumDelegationFeeBips) {
        this.minimumDelegationFeeBips = minimumDelegationFeeBips;
    }

    public int getMaximumStakeMultiplier() {
        return maximumStakeMultiplier;
    }

    public void setMaximumStakeMultiplier(int maximumStakeMultiplier) {
        this.maximumStakeMultiplier = maximumStakeMultiplier;
    }

    public BigInteger getWeightToValueFactor() {
        return weightToValueFactor;
    }

    public void setWeightToValueFactor(BigInteger weightToValueFactor) {
        this.weightToValueFactor = weightToValueFactor;
    }

    public String getUptimeBlockchainId() {
        return uptimeBlockchainId;
    }

    public void setUptimeBlockchainId(String uptimeBlockchainId) {
        this.uptimeBlockchainId = uptimeBlockchainId;
    }

    public long getRewardBasisPoints() {
        return rewardBasisPoints;
    }

    public void setRewardBasisPoints(long rewardBasisPoints) {
        this.rewardBasisPoints = rewardBasisPoints;
    }
}
