package com.work.validator.core.manager;

import com.work.validator.core.model.Bytes32;
import com.work.validator.core.model.ConversionData;
import com.work.validator.core.model.NodeId;
import com.work.validator.core.model.Validator;
import com.work.validator.core.model.ValidatorRegistrationRequest;
import com.work.validator.core.model.WeightUpdate;

import java.util.Optional;

/**
 * 验证者生命周期协议：本地发起 -> 中继提交 P-Chain -> 凭 P-Chain 签名消息完成。
 * <p>所有 complete 操作只接受来自 P-Chain（sourceChainId 与发送方均为零）的已验证消息。</p>
 */
public interface ValidatorLifecycle {

    void initializeValidatorSet(ConversionData conversionData, int messageIndex);

    Bytes32 initiateValidatorRegistration(ValidatorRegistrationRequest request);

    Bytes32 completeValidatorRegistration(int messageIndex);

    WeightUpdate initiateValidatorRemoval(Bytes32 validationId);

    Bytes32 completeValidatorRemoval(int messageIndex);

    WeightUpdate initiateValidatorWeightUpdate(Bytes32 validationId, long newWeight);

    WeightUpdate completeValidatorWeightUpdate(int messageIndex);

    byte[] resendRegisterValidatorMessage(Bytes32 validationId);

    byte[] resendEndValidatorMessage(Bytes32 validationId);

    byte[] resendValidatorWeightUpdate(Bytes32 validationId);

    Optional<Validator> getValidator(Bytes32 validationId);

    Optional<Bytes32> registeredValidators(NodeId nodeId);

    long l1TotalWeight();

    Bytes32 subnetId();
}
