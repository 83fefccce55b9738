package com.work.validator.host.web.dto;

import javax.validation.Valid;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;

/**
 * 发起验证者注册。PoA 模式下 weight 直接生效；PoS 模式下由 {@link StakingValidatorRequestDto} 按质押额换算。
 */
public class RegisterValidatorRequest {

    @NotBlank(message = "nodeId 不能为空")
    private String nodeId;

    @NotBlank(message = "blsPublicKey 不能为空")
    private String blsPublicKey;

    private long registrationExpiry;

    @Valid
    @NotNull(message = "remainingBalanceOwner 不能为空")
    private PChainOwnerDto remainingBalanceOwner;

    @Valid
    @NotNull(message = "disableOwner 不能为空")
    private PChainOwnerDto disableOwner;

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

    public long getRegistrationExpiry() {
        return registrationExpiry;
    }

    public void setRegistrationExpiry(long registrationExpiry) {
        this.registrationExpiry = registrationExpiry;
    }

    public PChainOwnerDto getRemainingBalanceOwner() {
        return remainingBalanceOwner;
    }

    public void setRemainingBalanceOwner(PChainOwnerDto remainingBalanceOwner) {
        this.remainingBalanceOwner = remainingBalanceOwner;
    }

    public PChainOwnerDto getDisableOwner() {
        return disableOwner;
    }

    public void setDisableOwner(PChainOwnerDto disableOwner) {
        this.disableOwner = disableOwner;
    }

    public long getWeight() {
        return weight;
    }

    public void setWeight(long weight) {
        this.weight = weight;
    }
}
