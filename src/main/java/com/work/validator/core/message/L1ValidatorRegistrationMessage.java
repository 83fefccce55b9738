package com.work.validator.core.message;

import com.work.validator.core.model.Bytes32;

/**
 * P-Chain 对注册状态的证明：valid=true 表示已登记，valid=false 表示已移除或永远不会登记。
 */
public final class L1ValidatorRegistrationMessage {

    private final Bytes32 validationId;
    private final boolean valid;

    public L1ValidatorRegistrationMessage(Bytes32 validationId, boolean valid) {
        this.validationId = validationId;
        this.valid = valid;
    }

    public Bytes32 getValidationId() {
        return validationId;
    }

    public boolean isValid() {
        return valid;
    }
}
