package com.work.validator.host.persistence.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;

@TableName("validator")
public class ValidatorEntity {

    @TableId(type = IdType.INPUT)
    private String validationId;

    private String status;

    private String nodeId;

    private Long startingWeight;

    private Long sentNonce;

    private Long receivedNonce;

    private Long weight;

    private Long startTime;

    private Long endTime;

    public String getValidationId() {
        return validationId;
    }

    public void setValidationId(String validationId) {
        this.validationId = validationId;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getNodeId() {
        return nodeId;
    }

    public void setNodeId(String nodeId) {
        this.nodeId = nodeId;
    }

    public Long getStartingWeight() {
        return startingWeight;
    }

    public void setStartingWeight(Long startingWeight) {
        this.startingWeight = startingWeight;
    }

    public Long getSentNonce() {
        return sentNonce;
    }

    public void setSentNonce(Long sentNonce) {
        this.sentNonce = sentNonce;
    }

    public Long getReceivedNonce() {
        return receivedNonce;
    }

    public void setReceivedNonce(Long receivedNonce) {
        this.receivedNonce = receivedNonce;
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
}
