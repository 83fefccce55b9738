package com.work.validator.core.message;

import com.work.validator.core.model.Bytes32;

public final class L1ValidatorWeightMessage {

    private final Bytes32 validationId;
    private final long nonce;
    private final long weight;

    public L1ValidatorWeightMessage(Bytes32 validationId, long nonce, long weight) {
        this.validationId = validationId;
        this.nonce = nonce;
        this.weight = weight;
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
}
