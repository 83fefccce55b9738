package com.work.validator.host.persistence.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

import java.math.BigDecimal;

@TableName("delegator")
public class DelegatorEntity {

    @TableId(type = IdType.INPUT)
    private String delegationId;

    private String status;

    private String owner;

    private String validationId;

    private Long weight;

    private Long startTime;

    private Long endTime;

    private Long startingNonce;

    private Long endingNonce;

    private String rewardRecipient;

    private BigDecimal pendingReward;

    public String getDelegationId() {
        return delegationId;
    }

    public void setDelegationId(String delegationId) {
        this.delegationId = delegationId;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getOwner() {
        return owner;
    }

    public void setOwner(String owner) {
        this.owner = owner;
    }

    public String getValidationId() {
        return validationId;
    }

    public void setValidationId(String validationId) {
        this.validationId = validationId;
    }

    public Long getWeight() {
        return weight;
    }

    public void setWeight(Long weight) {
        this.weight = weight;
    }

    public Long getStartTime() {
        return startTime;
    }

    public void setStartTime(Long startTime) {
        this.startTime = startTime;
    }

    public Long getEndTime() {
        return endTime;
    }

    public void setEndTime(Long endTime) {
        this.endTime = endTime;
    }

    public Long getStartingNonce() {
        return startingNonce;
    }

    public void setStartingNonce(Long startingNonce) {
        this.startingNonce = startingNonce;
    }

    public Long getEndingNonce() {
        return endingNonce;
    }

    public void setEndingNonce(Long endingNonce) {
        this.endingNonce = endingNonce;
    }

    public String getRewardRecipient() {
        return rewardRecipient;
    }

    public void setRewardRecipient(String rewardRecipient) {
        this.rewardRecipient = rewardRecipient;
    }

    public BigDecimal getPendingReward() {
        return pendingReward;
    }

    public void setPendingReward(BigDecimal pendingReward) {
        this.pendingReward = pendingReward;
    }
}
