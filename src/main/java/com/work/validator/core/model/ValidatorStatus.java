package com.work.validator.core.model;

/**
 * 验证周期状态。code 与链上 uint8 编码一致。
 */
public enum ValidatorStatus {
    UNKNOWN(0),
    PENDING_ADDED(1),
    ACTIVE(2),
    PENDING_REMOVED(3),
    COMPLETED(4),
    INVALIDATED(5);

    private final int code;

    ValidatorStatus(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * 终态：节点 ID 已释放，不再接受任何变更。
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == INVALIDATED;
    }
}
