package com.work.validator.host.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import javax.validation.Valid;
import javax.validation.constraints.Max;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import java.time.Duration;

/**
 * 验证者管理器配置项，前缀 validator-manager。
 */
@Validated
@ConfigurationProperties(prefix = "validator-manager")
public class ValidatorManagerProperties {

    /**
     * L1 对应的 subnetID（32 字节十六进制）。
     */
    @NotBlank
    private String subnetId;

    /**
     * 本管理器所在链的 blockchainID，需与转换数据中的一致。
     */
    @NotBlank
    private String blockchainId;

    /**
     * 本管理器的地址，需与转换数据中的一致。
     */
    @NotBlank
    private String managerAddress;

    /**
     * PoA 管理员地址。
     */
    @NotBlank
    private String admin;

    /**
     * churn 统计窗口长度。
     */
    @NotNull
    private Duration churnPeriod = Duration.ofHours(1);

    /**
     * 单个窗口内允许的最大权重变化百分比，取值 1~20。
     */
    @Min(1)
    @Max(20)
    private int maximumChurnPercentage = 20;

    /**
     * 账本存储：memory / postgres。
     */
    @NotBlank
    private String store = "memory";

    @Valid
    private Resend resend = new Resend();

    public String getSubnetId() {
        return subnetId;
    }

    public void setSubnetId(String subnetId) {
        this.subnetId = subnetId;
    }

    public String getBlockchainId() {
        return blockchainId;
    }

    public void setBlockchainId(String blockchainId) {
        this.blockchainId = blockchainId;
    }

    public String getManagerAddress() {
        return managerAddress;
    }

    public void setManagerAddress(String managerAddress) {
        this.managerAddress = managerAddress;
    }

    public String getAdmin() {
        return admin;
    }

    public void setAdmin(String admin) {
        this.admin = admin;
    }

    public Duration getChurnPeriod() {
        return churnPeriod;
    }

    public void setChurnPeriod(Duration churnPeriod) {
        this.churnPeriod = churnPeriod;
    }

    public int getMaximumChurnPercentage() {
        return maximumChurnPercentage;
    }

    public void setMaximumChurnPercentage(int maximumChurnPercentage) {
        this.maximumChurnPercentage = maximumChurnPercentage;
    }

    public String getStore() {
        return store;
    }

    public void setStore(String store) {
        this.store = store;
    }

    public Resend getResend() {
        return resend;
    }

    public void setResend(Resend resend) {
        this.resend = resend;
    }

    /**
     * 待确认消息的定时重发。
     */
    public static class Resend {

        private boolean enabled = false;

        /**
         * 扫描周期。
         */
        private Duration scanInterval = Duration.ofSeconds(30);

        /**
         * 消息发出后至少经过该时长才会被重发。
         */
        private Duration minAge = Duration.ofMinutes(1);

        /**
         * 同一条消息两次重发的最小间隔。
         */
        private Duration interval = Duration.ofMinutes(5);

        @Min(1)
        private int batchSize = 100;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getScanInterval() {
            return scanInterval;
        }

        public void setScanInterval(Duration scanInterval) {
            this.scanInterval = scanInterval;
        }

        public Duration getMinAge() {
            return minAge;
        }

        public void setMinAge(Duration minAge) {
            this.minAge = minAge;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }
}
