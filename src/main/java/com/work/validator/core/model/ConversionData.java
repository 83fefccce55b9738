package com.work.validator.core.model;

import java.util.List;

/**
 * 子网转换为 L1 时在 P-Chain 上登记的数据，其哈希即 conversionID。
 */
public final class ConversionData {

    private final Bytes32 subnetId;
    private final Bytes32 validatorManagerBlockchainId;
    private final String validatorManagerAddress;
    private final List<InitialValidator> initialValidators;

    public ConversionData(Bytes32 subnetId,
                          Bytes32 validatorManagerBlockchainId,
                          String validatorManagerAddress,
                          List<InitialValidator> initialValidators) {
        if (subnetId == null || validatorManagerBlockchainId == null) {
            throw new IllegalArgumentException("subnetId / validatorManagerBlockchainId 不能为null");
        }
        if (validatorManagerAddress == null || validatorManagerAddress.isEmpty()) {
            throw new IllegalArgumentException("validatorManagerAddress 不能为空");
        }
        if (initialValidators == null) {
            throw new IllegalArgumentException("initialValidators 不能为null");
        }
        this.subnetId = subnetId;
        this.validatorManagerBlockchainId = validatorManagerBlockchainId;
        this.validatorManagerAddress = validatorManagerAddress;
        this.initialValidators = List.copyOf(initialValidators);
    }

    public Bytes32 getSubnetId() {
        return subnetId;
    }

    public Bytes32 getValidatorManagerBlockchainId() {
        return validatorManagerBlockchainId;
    }

    public String getValidatorManagerAddress() {
        return validatorManagerAddress;
    }

    public List<InitialValidator> getInitialValidators() {
        return initialValidators;
    }
}
