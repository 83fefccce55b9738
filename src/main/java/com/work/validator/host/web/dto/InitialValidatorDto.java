package com.work.validator.host.web.dto;

import javax.validation.constraints.NotBlank;

public class InitialValidatorDto {

    @NotBlank(message = "nodeId 不能为空")
    private String nodeId;

    @NotBlank(message = "blsPublicKey 不能为空")
    private String blsPublicKey;

    private long weight;

    public String getNodeId() {
        return nodeId;
    }

    public void setNodeId(String nodeId) {
        this.nodeId = nodeId;
    }

    public String getBlsPublicKey() {
        return blsPublicKey;
    }

    public void setBlsPublicKey(String blsPublicKey) {
        this.blsPublicKey = blsPublicKey;
    }

    public long getWeight() {
        return weight;
    }

    public void setWeight(long weight) {
        this.weight = weight;
    }
}
