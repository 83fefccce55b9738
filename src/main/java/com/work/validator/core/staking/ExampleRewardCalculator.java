package com.work.validator.core.staking;

import java.math.BigInteger;

/**
 * 按年化基点线性计息：在线时长低于验证者任期的 80% 时无奖励。
 */
public class ExampleRewardCalculator implements RewardCalculator {

    public static final long SECONDS_IN_YEAR = 31_536_000L;
    public static final int UPTIME_REWARDS_THRESHOLD_PERCENTAGE = 80;
    public static final long DEFAULT_REWARD_BASIS_POINTS = 10;

    private static final BigInteger BIPS_CONVERSION_FACTOR = BigInteger.valueOf(10_000);

    private final long rewardBasisPoints;

    public ExampleRewardCalculator() {
        this(DEFAULT_REWARD_BASIS_POINTS);
    }

    public ExampleRewardCalculator(long rewardBasisPoints) {
        if (rewardBasisPoints < 0) {
            throw new IllegalArgumentException("rewardBasisPoints 不能为负数");
        }
        this.rewardBasisPoints = rewardBasisPoints;
    }

    @Override
    public BigInteger calculateReward(BigInteger stakeAmount,
                                      long validatorStartTime,
                                      long stakingStartTime,
                                      long stakingEndTime,
                                      long uptimeSeconds) {
        if (stakingEndTime <= stakingStartTime) {
            return BigInteger.ZERO;
        }
        // uptime / (end - validatorStart) < 80%，移项避免整数除法截断
        BigInteger uptime = BigInteger.valueOf(uptimeSeconds).multiply(BigInteger.valueOf(100));
        BigInteger required = BigInteger.valueOf(stakingEndTime - validatorStartTime)
                .multiply(BigInteger.valueOf(UPTIME_REWARDS_THRESHOLD_PERCENTAGE));
        if (uptime.compareTo(required) < 0) {
            return BigInteger.ZERO;
        }
        return stakeAmount
                .multiply(BigInteger.valueOf(rewardBasisPoints))
                .multiply(BigInteger.valueOf(stakingEndTime - stakingStartTime))
                .divide(BigInteger.valueOf(SECONDS_IN_YEAR))
                .divide(BIPS_CONVERSION_FACTOR);
    }

    public long getRewardBasisPoints() {
        return rewardBasisPoints;
    }
}
