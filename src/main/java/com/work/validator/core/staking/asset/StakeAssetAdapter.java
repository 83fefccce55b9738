package com.work.validator.core.staking.asset;

import java.math.BigInteger;

/**
 * 质押资产策略：锁定、解锁与奖励发放。
 * <p>所有调用都发生在账本事务内，且是该操作最后一个可能失败的步骤：抛出异常即回滚整个操作。
 * lock 失败（余额或授权不足）抛出 InvalidInputException。</p>
 */
public interface StakeAssetAdapter {

    /**
     * 从 from 处锁定 value，返回实际锁定的数量。
     */
    BigInteger lock(String from, BigInteger value);

    void unlock(String to, BigInteger value);

    void reward(String to, BigInteger amount);

    /**
     * 结算：把 stake 解锁给 owner，并向 rewardRecipient 发放 reward。任一部分失败时不得留下另一部分的效果。
     */
    default void settle(String owner, BigInteger stake, String rewardRecipient, BigInteger reward) {
        unlock(owner, stake);
        reward(rewardRecipient, reward);
    }

    BigInteger balanceOf(String account);

    String assetName();
}
