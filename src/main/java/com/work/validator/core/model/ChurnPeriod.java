package com.work.validator.core.model;

/**
 * 当前 churn 统计窗口。startTime 为 0 表示尚未开始任何窗口。
 */
public class ChurnPeriod {

    private long startTime;
    private long initialWeight;
    private long totalWeight;
    private long churnAmount;

    public ChurnPeriod(long startTime, long initialWeight, long totalWeight, long churnAmount) {
        this.startTime = startTime;
        this.initialWeight = initialWeight;
        this.totalWeight = totalWeight;
        this.churnAmount = churnAmount;
    }

    public static ChurnPeriod empty() {
        return new ChurnPeriod(0, 0, 0, 0);
    }

    public ChurnPeriod copy() {
        return new ChurnPeriod(startTime, initialWeight, totalWeight, churnAmount);
    }

    public long getStartTime() {
        return startTime;
    }

    public void setStartTime(long startTime) {
        this.startTime = startTime;
    }

    public long getInitialWeight() {
        return initialWeight;
    }

    public void setInitialWeight(long initialWeight) {
        this.initialWeight = initialWeight;
    }

    public long getTotalWeight() {
        return totalWeight;
    }

    public void setTotalWeight(long totalWeight) {
        this.totalWeight = totalWeight;
    }

    public long getChurnAmount() {
        return churnAmount;
    }

    public void setChurnAmount(long churnAmount) {
        this.churnAmount = churnAmount;
    }

    @Override
    public String toString() {
        return "ChurnPeriod{" +
                "startTime=" + startTime +
                ", initialWeight=" + initialWeight +
                ", totalWeight=" + totalWeight +
                ", churnAmount=" + churnAmount +
                '}';
    }
}
