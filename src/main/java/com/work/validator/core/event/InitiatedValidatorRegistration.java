package com.work.validator.core.event;

import com.work.validator.core.model.Bytes32;
import com.work.validator.core.model.NodeId;

/**
 * 发起注册：registrationMessageId 对应的出站消息需由中继提交到 P-Chain。
 */
public class InitiatedValidatorRegistration extends ValidatorManagerEvent {

    private final Bytes32 validationId;
    private final NodeId nodeId;
    private final Bytes32 registrationMessageId;
    private final long registrationExpiry;
    private final long weight;

    public InitiatedValidatorRegistration(Bytes32 validationId, NodeId nodeId, Bytes32 registrationMessageId, long registrationExpiry, long weight) {
        this.validationId = validationId;
        this.nodeId = nodeId;
        this.registrationMessageId = registrationMessageId;
        this.registrationExpiry = registrationExpiry;
        this.weight = weight;
    }

    public Bytes32 getValidationId() {
        return validationId;
    }

    public NodeId getNodeId() {
        return nodeId;
    }

    public Bytes32 getRegistrationMessageId() {
        return registrationMessageId;
    }

    public long getRegistrationExpiry() {
        return registrationExpiry;
    }

    public long getWeight() {
        return weight;
    }

    @Override
    public String toString() {
        return "InitiatedValidatorRegistration{" +
                "validationId=" + validationId +
                ", nodeId=" + nodeId +
                ", registrationMessageId=" + registrationMessageId +
                ", registrationExpiry=" + registrationExpiry +
                ", weight=" + weight +
                '}';
    }
}
