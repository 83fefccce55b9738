package com.work.validator.core.message;

import com.work.validator.core.model.Bytes32;
import com.work.validator.core.model.ConversionData;

/**
 * P-Chain 消息编解码。
 * <p>解码失败（编码版本、消息类型、长度不符）统一抛出 InvalidWarpMessageException。</p>
 */
public interface ValidatorMessageCodec {

    /**
     * conversionID = sha256(pack(conversionData))。
     */
    Bytes32 conversionId(ConversionData conversionData);

    byte[] packConversionData(ConversionData conversionData);

    /**
     * 初始验证者的 validationID = sha256(subnetID ‖ uint32 index)。
     */
    Bytes32 initialValidationId(Bytes32 subnetId, int index);

    /**
     * 注册验证者的 validationID = sha256(RegisterL1ValidatorMessage 编码)。
     */
    Bytes32 registrationValidationId(byte[] registerMessage);

    byte[] packSubnetToL1ConversionMessage(Bytes32 conversionId);

    Bytes32 unpackSubnetToL1ConversionMessage(byte[] payload);

    byte[] packRegisterL1ValidatorMessage(RegisterL1ValidatorMessage message);

    RegisterL1ValidatorMessage unpackRegisterL1ValidatorMessage(byte[] payload);

    byte[] packL1ValidatorRegistrationMessage(L1ValidatorRegistrationMessage message);

    L1ValidatorRegistrationMessage unpackL1ValidatorRegistrationMessage(byte[] payload);

    byte[] packL1ValidatorWeightMessage(L1ValidatorWeightMessage message);

    L1ValidatorWeightMessage unpackL1ValidatorWeightMessage(byte[] payload);

    byte[] packValidationUptimeMessage(ValidationUptimeMessage message);

    ValidationUptimeMessage unpackValidationUptimeMessage(byte[] payload);
}
