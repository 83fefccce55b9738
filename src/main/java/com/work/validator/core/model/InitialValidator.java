package com.work.validator.core.model;

public final class InitialValidator {

    private final NodeId nodeId;
    private final byte[] blsPublicKey;
    private final long weight;

    public InitialValidator(NodeId nodeId, byte[] blsPublicKey, long weight) {
        if (nodeId == null) {
            throw new IllegalArgumentException("nodeId 不能为null");
        }
        if (blsPublicKey == null) {
            throw new IllegalArgumentException("blsPublicKey 不能为null");
        }
        this.nodeId = nodeId;
        this.blsPublicKey = blsPublicKey.clone();
        this.weight = weight;
    }

    public NodeId getNodeId() {
        return nodeId;
    }

    public byte[] getBlsPublicKey() {
        return blsPublicKey.clone();
    }

    public long getWeight() {
        return weight;
    }
}
