package com.work.validator.core.staking;

import java.math.BigInteger;

/**
 * 奖励计算函数，必须无副作用。时间单位为 epoch 秒。
 */
public interface RewardCalculator {

    BigInteger calculateReward(BigInteger stakeAmount,
                               long validatorStartTime,
                               long stakingStartTime,
                               long stakingEndTime,
                               long uptimeSeconds);
}
