package com.work.validator.host.persistence.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

import java.math.BigDecimal;

@TableName("pos_validator")
public class PosValidatorEntity {

    @TableId(type = IdType.INPUT)
    private String validationId;

    private String owner;

    private Integer delegationFeeBips;

    private Long minStakeDuration;

    private Long uptimeSeconds;

    private String rewardRecipient;

    /**
     * NUMERIC(78,0)，足以容纳 uint256。
     */
    private BigDecimal redeemableRewards;

    public String getValidationId() {
        return validationId;
    }

    public void setValidationId(String validationId) {
        this.validationId = validationId;
    }

    public String getOwner() {
        return owner;
    }

    public void setOwner(String owner) {
        this.owner = owner;
    }

    public Integer getDelegationFeeBips() {
        return delegationFeeBips;
    }

    public void setDelegationFeeBips(Integer delegationFeeBips) {
        this.delegationFeeBips = delegationFeeBips;
    }

    public Long getMinStakeDuration() {
        return minStakeDuration;
    }

    public void setMinStakeDuration(Long minStakeDuration) {
        this.minStakeDuration = minStakeDuration;
    }

    public Long getUptimeSeconds() {
        return uptimeSeconds;
    }

    public void setUptimeSeconds(Long uptimeSeconds) {
        this.uptimeSeconds = uptimeSeconds;
    }

    public String getRewardRecipient() {
        return rewardRecipient;
    }

    public void setRewardRecipient(String rewardRecipient) {
        this.rewardRecipient = rewardRecipient;
    }

    public BigDecimal getRedeemableRewards() {
        return redeemableRewards;
    }

    public void setRedeemableRewards(BigDecimal redeemableRewards) {
        this.redeemableRewards = redeemableRewards;
    }
}
