package com.work.validator.core.config;

import com.work.validator.core.model.Bytes32;

import java.time.Duration;

/**
 * 纯引擎侧的配置定义，不依赖任意框架。宿主应用只需在装配时将读取到的配置注入即可。
 * <p>取值范围（如 maximumChurnPercentage）由 ValidatorManager 构造时校验并以合约错误名报告。</p>
 */
public class ValidatorManagerSettings {

    private final Bytes32 subnetId;
    private final Bytes32 blockchainId;
    private final String managerAddress;
    private final String admin;
    private final Duration churnPeriod;
    private final int maximumChurnPercentage;

    public ValidatorManagerSettings(Bytes32 subnetId,
                                    Bytes32 blockchainId,
                                    String managerAddress,
                                    String admin,
                                    Duration churnPeriod,
                                    int maximumChurnPercentage) {
        this.subnetId = subnetId;
        this.blockchainId = blockchainId;
        this.managerAddress = managerAddress;
        this.admin = admin;
        this.churnPeriod = churnPeriod;
        this.maximumChurnPercentage = maximumChurnPercentage;
    }

    public Bytes32 getSubnetId() {
        return subnetId;
    }

    public Bytes32 getBlockchainId() {
        return blockchainId;
    }

    public String getManagerAddress() {
        return managerAddress;
    }

    public String getAdmin() {
        return admin;
    }

    public Duration getChurnPeriod() {
        return churnPeriod;
    }

    public long getChurnPeriodSeconds() {
        return churnPeriod.getSeconds();
    }

    public int getMaximumChurnPercentage() {
        return maximumChurnPercentage;
    }
}
