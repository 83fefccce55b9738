package com.work.validator.host.web.dto;

import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotEmpty;
import java.util.ArrayList;
import java.util.List;

/**
 * 初始验证者集合：P-Chain 转换数据 + 携带 SubnetToL1ConversionMessage 的 Warp 消息下标。
 */
public class InitializeValidatorSetRequest {

    @NotBlank(message = "subnetId 不能为空")
    private String subnetId;

    @NotBlank(message = "validatorManagerBlockchainId 不能为空")
    private String validatorManagerBlockchainId;

    @NotBlank(message = "validatorManagerAddress 不能为空")
    private String validatorManagerAddress;

    @Valid
    @NotEmpty(message = "initialValidators 不能为空")
    private List<InitialValidatorDto> initialValidators = new ArrayList<>();

    @Min(value = 0, message = "messageIndex 不能为负")
    private int messageIndex;

    public String getSubnetId() {
        return subnetId;
    }

    public void setSubnetId(String subnetId) {
        this.subnetId = subnetId;
    }

    public String getValidatorManagerBlockchainId() {
        return validatorManagerBlockchainId;
    }

    public void setValidatorManagerBlockchainId(String validatorManagerBlockchainId) {
        this.validatorManagerBlockchainId = validatorManagerBlockchainId;
    }

    public String getValidatorManagerAddress() {
        return validatorManagerAddress;
    }

    public void setValidatorManagerAddress(String validatorManagerAddress) {
        this.validatorManagerAddress = validatorManagerAddress;
    }

    public List<InitialValidatorDto> getInitialValidators() {
        return initialValidators;
    }

    public void setInitialValidators(List<InitialValidatorDto> initialValidators) {
        this.initialValidators = initialValidators;
    }

    public int getMessageIndex() {
        return messageIndex;
    }

    public void setMessageIndex(int messageIndex) {
        this.messageIndex = messageIndex;
    }
}
