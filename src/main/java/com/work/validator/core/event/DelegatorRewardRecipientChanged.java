package com.work.validator.core.event;

import com.work.validator.core.model.Bytes32;

public class DelegatorRewardRecipientChanged extends ValidatorManagerEvent {

    private final Bytes32 delegationId;
    private final String recipient;
    private final String oldRecipient;

    public DelegatorRewardRecipientChanged(Bytes32 delegationId, String recipient, String oldRecipient) {
        this.delegationId = delegationId;
        this.recipient = recipient;
        this.oldRecipient = oldRecipient;
    }

    public Bytes32 getDelegationId() {
        return delegationId;
    }

    public String getRecipient() {
        return recipient;
    }

    public String getOldRecipient() {
        return oldRecipient;
    }

    @Override
    public String toString() {
        return "DelegatorRewardRecipientChanged{" +
                "delegationId=" + delegationId +
                ", recipient=" + recipient +
                ", oldRecipient=" + oldRecipient +
                '}';
    }
}
