package com.work.validator.core.churn;

import com.work.validator.core.exception.ChurnExceededException;
import com.work.validator.core.model.ChurnPeriod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 滑动窗口式的 churn 限流器：限制单个周期内验证者总权重的变化比例。
 *
 * 约定：
 * 1. 所有方法都在副本上计算并返回下一个周期，不修改入参；调用方在其它前置条件全部满足后再持久化
 * 2. 调用方需在账本单写者边界内调用，周期状态由仓储保存
 * 3. 权重增减都计入 churn（取绝对值）
 */
public class ChurnTracker {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChurnTracker.class);

    private final long churnPeriodSeconds;
    private final int maximumChurnPercentage;

    public ChurnTracker(long churnPeriodSeconds, int maximumChurnPercentage) {
        this.churnPeriodSeconds = churnPeriodSeconds;
        this.maximumChurnPercentage = maximumChurnPercentage;
    }

    /**
     * 初始验证者集合写入后的周期状态：只记录总权重，不开启窗口。
     */
    public ChurnPeriod initial(long totalWeight) {
        requireRecoverable(totalWeight);
        return new ChurnPeriod(0, 0, totalWeight, 0);
    }

    /**
     * 校验一次 oldWeight -> newWeight 的权重变更并返回更新后的周期。
     *
     * @throws ChurnExceededException MaxChurnRateExceeded 或 InvalidTotalWeight
     */
    public ChurnPeriod checkAndUpdate(ChurnPeriod current, long newWeight, long oldWeight, long now) {
        ChurnPeriod next = current.copy();
        long delta = Math.abs(newWeight - oldWeight);

        if (next.getStartTime() == 0 || now >= next.getStartTime() + churnPeriodSeconds) {
            next.setChurnAmount(delta);
            next.setStartTime(now);
            next.setInitialWeight(next.getTotalWeight());
        } else {
            next.setChurnAmount(Math.addExact(next.getChurnAmount(), delta));
        }

        // 等价于 churnAmount / initialWeight > maximumChurnPercentage / 100，移项避免整数除法截断
        long allowed = Math.multiplyExact((long) maximumChurnPercentage, next.getInitialWeight());
        long used = Math.multiplyExact(next.getChurnAmount(), 100L);
        if (used > allowed) {
            throw new ChurnExceededException(ChurnExceededException.MAX_CHURN_RATE_EXCEEDED, next.getChurnAmount(),
                    "churn " + next.getChurnAmount() + " exceeds " + maximumChurnPercentage + "% of "
                            + next.getInitialWeight());
        }

        long totalWeight = next.getTotalWeight() + newWeight - oldWeight;
        requireRecoverable(totalWeight);
        next.setTotalWeight(totalWeight);

        LOGGER.debug("[churn] {} -> {}, period={}", oldWeight, newWeight, next);
        return next;
    }

    /**
     * 调整总权重但不计入 churn：用于注册失效时撤回从未生效的权重。
     *
     * @throws ChurnExceededException InvalidTotalWeight，调整后的总权重已无法再做任何变更
     */
    public ChurnPeriod adjustTotalWeight(ChurnPeriod current, long delta) {
        ChurnPeriod next = current.copy();
        long totalWeight = Math.addExact(next.getTotalWeight(), delta);
        requireRecoverable(totalWeight);
        next.setTotalWeight(totalWeight);
        return next;
    }

    /**
     * 当前窗口内剩余可用的 churn 额度（窗口已过期时按新窗口计算）。
     */
    public long remainingChurn(ChurnPeriod current, long now) {
        boolean rolled = current.getStartTime() == 0 || now >= current.getStartTime() + churnPeriodSeconds;
        long initialWeight = rolled ? current.getTotalWeight() : current.getInitialWeight();
        long used = rolled ? 0 : current.getChurnAmount();
        return Math.max(0, initialWeight * maximumChurnPercentage / 100 - used);
    }

    public long getChurnPeriodSeconds() {
        return churnPeriodSeconds;
    }

    public int getMaximumChurnPercentage() {
        return maximumChurnPercentage;
    }

    // 总权重过低时任何一次变更都会超出 churn 限制，集合将无法再调整
    private void requireRecoverable(long totalWeight) {
        if (Math.multiplyExact(totalWeight, (long) maximumChurnPercentage) < 100) {
            throw new ChurnExceededException(ChurnExceededException.INVALID_TOTAL_WEIGHT, totalWeight,
                    "total weight " + totalWeight + " too low for " + maximumChurnPercentage + "% churn");
        }
    }
}
