package com.work.validator.core.model;

/**
 * 一次权重变更：发起时携带 messageId，完成时 messageId 为 null。
 */
public final class WeightUpdate {

    private final Bytes32 validationId;
    private final long nonce;
    private final long weight;
    private final Bytes32 messageId;

    public WeightUpdate(Bytes32 validationId, long nonce, long weight, Bytes32 messageId) {
        this.validationId = validationId;
        this.nonce = nonce;
        this.weight = weight;
        this.messageId = messageId;
    }

    public Bytes32 getValidationId() {
        return validationId;
    }

    public long getNonce() {
        return nonce;
    }

    public long getWeight() {
        return weight;
    }

    public Bytes32 getMessageId() {
        return messageId;
    }

    @Override
    public String toString() {
        return "WeightUpdate{validationId=" + validationId + ", nonce=" + nonce + ", weight=" + weight
                + ", messageId=" + messageId + '}';
    }
}
