package com.work.validator.core.message;

import com.work.validator.core.model.Bytes32;
import com.work.validator.core.model.NodeId;
import com.work.validator.core.model.PChainOwner;

/**
 * 请求 P-Chain 登记新验证者的消息体。其编码的 sha256 即该验证周期的 validationID。
 */
public final class RegisterL1ValidatorMessage {

    private final Bytes32 subnetId;
    private final NodeId nodeId;
    private final byte[] blsPublicKey;
    private final long registrationExpiry;
    private final PChainOwner remainingBalanceOwner;
    private final PChainOwner disableOwner;
    private final long weight;

    public RegisterL1ValidatorMessage(Bytes32 subnetId,
                                      NodeId nodeId,
                                      byte[] blsPublicKey,
                                      long registrationExpiry,
                                      PChainOwner remainingBalanceOwner,
                                      PChainOwner disableOwner,
                                      long weight) {
        this.subnetId = subnetId;
        this.nodeId = nodeId;
        this.blsPublicKey = blsPublicKey.clone();
        this.registrationExpiry = registrationExpiry;
        this.remainingBalanceOwner = remainingBalanceOwner;
        this.disableOwner = disableOwner;
        this.weight = weight;
    }

    public Bytes32 getSubnetId() {
        return subnetId;
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
