package com.work.validator.host.web.dto;

import javax.validation.constraints.NotBlank;

public class RewardRecipientRequest {

    @NotBlank(message = "rewardRecipient 不能为空")
    private String rewardRecipient;

    public String getRewardRecipient() {
        return rewardRecipient;
    }

    public void setRewardRecipient(String rewardRecipient) {
        this.rewardRecipient = rewardRecipient;
    }
}
