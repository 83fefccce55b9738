package com.work.validator.core.model;

/**
 * 发起验证者注册的入参。字段合法性由引擎校验并以对应错误名报告。
 */
public final class ValidatorRegistrationRequest {

    private final NodeId nodeId;
    private final byte[] blsPublicKey;
    private final long registrationExpiry;
    private final PChainOwner remainingBalanceOwner;
    private final PChainOwner disableOwner;
    private final long weight;

    public ValidatorRegistrationRequest(NodeId nodeId,
                                        byte[] blsPublicKey,
                                        long registrationExpiry,
                                        PChainOwner remainingBalanceOwner,
                                        PChainOwner disableOwner,
                                        long weight) {
        if (nodeId == null || blsPublicKey == null) {
            throw new IllegalArgumentException("nodeId / blsPublicKey 不能为null");
        }
        this.nodeId = nodeId;
        this.blsPublicKey = blsPublicKey.clone();
        this.registrationExpiry = registrationExpiry;
        this.remainingBalanceOwner = remainingBalanceOwner == null ? PChainOwner.none() : remainingBalanceOwner;
        this.disableOwner = disableOwner == null ? PChainOwner.none() : disableOwner;
        this.weight = weight;
    }

    /**
     * 以新权重复制，质押路径在由质押额换算出权重后使用。
     */
    public ValidatorRegistrationRequest withWeight(long newWeight) {
        return new ValidatorRegistrationRequest(nodeId, blsPublicKey, registrationExpiry, remainingBalanceOwner,
                disableOwner, newWeight);
    }

    public NodeId getNodeId() {
        return nodeId;
    }

    public byte[] getBlsPublicKey() {
        return blsPublicKey.clone();
    }

    public long getRegistrationExpiry() {
        return registrationExpiry;
    }

    public PChainOwner getRemainingBalanceOwner() {
        return remainingBalanceOwner;
    }

    public PChainOwner getDisableOwner() {
        return disableOwner;
    }

    public long getWeight() {
        return weight;
    }
}
