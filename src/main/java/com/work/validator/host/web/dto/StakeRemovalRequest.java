package com.work.validator.host.web.dto;

import javax.validation.constraints.Min;

/**
 * PoS 验证者 / 委托者移除。includeUptimeProof=true 时 messageIndex 指向 ValidationUptimeMessage。
 */
public class StakeRemovalRequest {

    private boolean includeUptimeProof;

    @Min(value = 0, message = "messageIndex 不能为负")
    private int messageIndex;

    private String rewardRecipient;

    private boolean force;

    public boolean isIncludeUptimeProof() {
        return includeUptimeProof;
    }

    public void setIncludeUptimeProof(boolean includeUptimeProof) {
        this.includeUptimeProof = includeUptimeProof;
    }

    public int getMessageIndex() {
        return messageIndex;
    }

    public void setMessageIndex(int messageIndex) {
        this.messageIndex = messageIndex;
    }

    public String getRewardRecipient() {
        return rewardRecipient;
    }

    public void setRewardRecipient(String rewardRecipient) {
        this.rewardRecipient = rewardRecipient;
    }

    public boolean isForce() {
        return force;
    }

    public void setForce(boolean force) {
        this.force = force;
    }
}
