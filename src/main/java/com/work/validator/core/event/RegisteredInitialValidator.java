package com.work.validator.core.event;

import com.work.validator.core.model.Bytes32;
import com.work.validator.core.model.NodeId;

public class RegisteredInitialValidator extends ValidatorManagerEvent {

    private final Bytes32 validationId;
    private final NodeId nodeId;
    private final long weight;

    public RegisteredInitialValidator(Bytes32 validationId, NodeId nodeId, long weight) {
        this.validationId = validationId;
        this.nodeId = nodeId;
        this.weight = weight;
    }

    public Bytes32 getValidationId() {
        return validationId;
    }

    public NodeId getNodeId() {
        return nodeId;
    }

    public long getWeight() {
        return weight;
    }

    @Override
    public String toString() {
        return "RegisteredInitialValidator{" +
                "validationId=" + validationId +
                ", nodeId=" + nodeId +
                ", weight=" + weight +
                '}';
    }
}
