package com.work.validator.core.event;

import com.work.validator.core.model.Bytes32;

public class ValidatorRewardRecipientChanged extends ValidatorManagerEvent {

    private final Bytes32 validationId;
    private final String recipient;
    private final String oldRecipient;

    public ValidatorRewardRecipientChanged(Bytes32 validationId, String recipient, String oldRecipient) {
        this.validationId = validationId;
        this.recipient = recipient;
        this.oldRecipient = oldRecipient;
    }

    public Bytes32 getValidationId() {
        return validationId;
    }

    public String getRecipient() {
        return recipient;
    }

    public String getOldRecipient() {
        return oldRecipient;
    }

    @Override
    public String toString() {
        return "ValidatorRewardRecipientChanged{" +
                "validationId=" + validationId +
                ", recipient=" + recipient +
                ", oldRecipient=" + oldRecipient +
                '}';
    }
}
