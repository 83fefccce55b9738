package com.work.validator.core.event;

import com.work.validator.core.model.Bytes32;

public class InitiatedDelegatorRegistration extends ValidatorManagerEvent {

    private final Bytes32 delegationId;
    private final Bytes32 validationId;
    private final String delegatorAddress;
    private final long nonce;
    private final long validatorWeight;
    private final long delegatorWeight;
    private final Bytes32 setWeightMessageId;
    private final String rewardRecipient;

    public InitiatedDelegatorRegistration(Bytes32 delegationId, Bytes32 validationId, String delegatorAddress, long nonce, long validatorWeight, long delegatorWeight, Bytes32 setWeightMessageId, String rewardRecipient) {
        this.delegationId = delegationId;
        this.validationId = validationId;
        this.delegatorAddress = delegatorAddress;
        this.nonce = nonce;
        this.validatorWeight = validatorWeight;
        this.delegatorWeight = delegatorWeight;
        this.setWeightMessageId = setWeightMessageId;
        this.rewardRecipient = rewardRecipient;
    }

    public Bytes32 getDelegationId() {
        return delegationId;
    }

    public Bytes32 getValidationId() {
        return validationId;
    }

    public String getDelegatorAddress() {
        return delegatorAddress;
    }

    public long getNonce() {
        return nonce;
    }

    public long getValidatorWeight() {
        return validatorWeight;
    }

    public long getDelegatorWeight() {
        return delegatorWeight;
    }

    public Bytes32 getSetWeightMessageId() {
        return setWeightMessageId;
    }

    public String getRewardRecipient() {
        return rewardRecipient;
    }

    @Override
    public String toString() {
        return "InitiatedDelegatorRegistration{" +
                "delegationId=" + delegationId +
                ", validationId=" + validationId +
                ", delegatorAddress=" + delegatorAddress +
                ", nonce=" + nonce +
                ", validatorWeight=" + validatorWeight +
                ", delegatorWeight=" + delegatorWeight +
                ", setWeightMessageId=" + setWeightMessageId +
                ", rewardRecipient=" + rewardRecipient +
                '}';
    }
}
