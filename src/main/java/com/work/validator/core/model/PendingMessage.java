package com.work.validator.core.model;

/**
 * 最近一次发出的出站消息原文，供幂等重发。对应的完成操作会将其清除。
 */
public final class PendingMessage {

    private final Bytes32 validationId;
    private final PendingMessageKind kind;
    private final byte[] payload;
    private final long createdAt;

    public PendingMessage(Bytes32 validationId, PendingMessageKind kind, byte[] payload, long createdAt) {
        if (validationId == null || kind == null || payload == null) {
            throw new IllegalArgumentException("validationId / kind / payload 不能为null");
        }
        this.validationId = validationId;
        this.kind = kind;
        this.payload = payload.clone();
        this.createdAt = createdAt;
    }

    public Bytes32 getValidationId() {
        return validationId;
    }

    public PendingMessageKind getKind() {
        return kind;
    }

    public byte[] getPayload() {
        return payload.clone();
    }

    public long getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "PendingMessage{validationId=" + validationId + ", kind=" + kind + ", createdAt=" + createdAt + '}';
    }
}
