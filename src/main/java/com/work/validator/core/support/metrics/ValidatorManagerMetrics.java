package com.work.validator.core.support.metrics;

/**
 * 指标埋点接口（不强依赖 Micrometer）。
 * 默认实现为 no-op，接入方可自行实现并注册为 Spring Bean。
 */
public interface ValidatorManagerMetrics {

    /**
     * 验证者或委托者状态迁移。
     *
     * @param subject validator / delegator
     * @param status  迁移后的状态
     */
    default void transition(String subject, String status) {
    }

    /**
     * churn 限流拒绝。
     */
    default void churnRejected(String errorName) {
    }

    /**
     * 待发消息重发结果：resent / skipped / failed。
     */
    default void resend(String kind, String result) {
    }
}
