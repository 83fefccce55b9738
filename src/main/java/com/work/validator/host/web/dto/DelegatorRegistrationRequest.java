package com.work.validator.host.web.dto;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import java.math.BigInteger;

public class DelegatorRegistrationRequest {

    @NotBlank(message = "validationId 不能为空")
    private String validationId;

    @NotNull(message = "stakeAmount 不能为空")
    private BigInteger stakeAmount;

    private String rewardRecipient;

    public String getValidationId() {
        return validationId;
    }

    public void setValidationId(String validationId) {
        this.validationId = validationId;
    }

    public BigInteger getStakeAmount() {
        return stakeAmount;
    }

    public void setStakeAmount(BigInteger stakeAmount) {
        this.stakeAmount = stakeAmount;
    }

    public String getRewardRecipient() {
        return rewardRecipient;
    }

    public void setRewardRecipient(String rewardRecipient) {
        this.rewardRecipient = rewardRecipient;
    }
}
