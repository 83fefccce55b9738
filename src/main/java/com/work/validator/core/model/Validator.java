package com.work.validator.core.model;

import java.util.Objects;

/**
 * 一条验证周期记录，以 validationId 为键。
 *
 * 注意：
 * 1. validationId、nodeId、startingWeight 创建后不可修改
 * 2. weight 为本地已生效（可能尚未被 P-Chain 确认）的权重，包含其委托者权重
 * 3. sentNonce 只增不减；receivedNonce 不超过 sentNonce 且只增不减
 * 4. 仓储读写均返回副本，修改后需显式保存
 */
public class Validator {

    private final Bytes32 validationId;
    private final NodeId nodeId;
    private final long startingWeight;
    private ValidatorStatus status;
    private long sentNonce;
    private long receivedNonce;
    private long weight;
    private long startTime;
    private long endTime;

    public Validator(Bytes32 validationId,
                     ValidatorStatus status,
                     NodeId nodeId,
                     long startingWeight,
                     long sentNonce,
                     long receivedNonce,
                     long weight,
                     long startTime,
                     long endTime) {
        if (validationId == null) {
            throw new IllegalArgumentException("validationId 不能为null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status 不能为null");
        }
        if (nodeId == null) {
            throw new IllegalArgumentException("nodeId 不能为null");
        }
        if (receivedNonce > sentNonce) {
            throw new IllegalArgumentException("receivedNonce 不能大于 sentNonce");
        }
        this.validationId = validationId;
        this.status = status;
        this.nodeId = nodeId;
        this.startingWeight = startingWeight;
        this.sentNonce = sentNonce;
        this.receivedNonce = receivedNonce;
        this.weight = weight;
        this.startTime = startTime;
        this.endTime = endTime;
    }

    public Validator copy() {
        return new Validator(validationId, status, nodeId, startingWeight, sentNonce, receivedNonce,
                weight, startTime, endTime);
    }

    public Bytes32 getValidationId() {
        return validationId;
    }

    public ValidatorStatus getStatus() {
        return status;
    }

    public void setStatus(ValidatorStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("status 不能为null");
        }
        this.status = status;
    }

    public NodeId getNodeId() {
        return nodeId;
    }

    public long getStartingWeight() {
        return startingWeight;
    }

    public long getSentNonce() {
        return sentNonce;
    }

    /**
     * 分配下一个 nonce 并返回。
     */
    public long nextNonce() {
        sentNonce = sentNonce + 1;
        return sentNonce;
    }

    public long getReceivedNonce() {
        return receivedNonce;
    }

    /**
     * 记录 P-Chain 已确认的 nonce，较旧的确认不会回退已记录值。
     */
    public void acknowledgeNonce(long nonce) {
        if (nonce > sentNonce) {
            throw new IllegalArgumentException("nonce 不能大于 sentNonce");
        }
        if (nonce > receivedNonce) {
            receivedNonce = nonce;
        }
    }

    public long getWeight() {
        return weight;
    }

    public void setWeight(long weight) {
        this.weight = weight;
    }

    public long getStartTime() {
        return startTime;
    }

    public void setStartTime(long startTime) {
        this.startTime = startTime;
    }

    public long getEndTime() {
        return endTime;
    }

    public void setEndTime(long endTime) {
        this.endTime = endTime;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Validator that = (Validator) o;
        return validationId.equals(that.validationId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(validationId);
    }

    @Override
    public String toString() {
        return "Validator{" +
                "validationId=" + validationId +
                ", status=" + status +
                ", nodeId=" + nodeId +
                ", startingWeight=" + startingWeight +
                ", sentNonce=" + sentNonce +
                ", receivedNonce=" + receivedNonce +
                ", weight=" + weight +
                ", startTime=" + startTime +
                ", endTime=" + endTime +
                '}';
    }
}
