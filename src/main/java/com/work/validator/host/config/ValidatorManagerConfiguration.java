package com.work.validator.host.config;

import com.fasterxml.jackson.databind.Module;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import com.work.validator.core.config.StakingManagerSettings;
import com.work.validator.core.config.ValidatorManagerSettings;
import com.work.validator.core.event.InMemoryValidatorEventLog;
import com.work.validator.core.manager.PoAValidatorManager;
import com.work.validator.core.manager.ValidatorManager;
import com.work.validator.core.message.ValidatorMessageCodec;
import com.work.validator.core.message.ValidatorMessages;
import com.work.validator.core.model.Bytes32;
import com.work.validator.core.model.NodeId;
import com.work.validator.core.repository.LedgerTransactionManager;
import com.work.validator.core.repository.StakingLedgerRepository;
import com.work.validator.core.repository.ValidatorLedgerRepository;
import com.work.validator.core.staking.ExampleRewardCalculator;
import com.work.validator.core.staking.RewardCalculator;
import com.work.validator.core.staking.StakingManager;
import com.work.validator.core.staking.asset.ERC20TokenAssetAdapter;
import com.work.validator.core.staking.asset.NativeTokenAssetAdapter;
import com.work.validator.core.staking.asset.StakeAssetAdapter;
import com.work.validator.core.support.metrics.NoopValidatorManagerMetrics;
import com.work.validator.core.support.metrics.ValidatorManagerMetrics;
import com.work.validator.core.warp.InMemoryWarpMessenger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 将配置转换为引擎所需的纯 Java 对象，并装配引擎组件。账本实现由
 * {@link MemoryLedgerConfiguration} 或 PersistenceConfiguration 按 validator-manager.store 提供。
 */
@Configuration
@EnableConfigurationProperties({ValidatorManagerProperties.class, StakingProperties.class})
public class ValidatorManagerConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(ValidatorManagerConfiguration.class);

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(ValidatorManagerMetrics.class)
    public ValidatorManagerMetrics validatorManagerMetrics() {
        return new NoopValidatorManagerMetrics();
    }

    @Bean
    public ValidatorMessageCodec validatorMessageCodec() {
        return new ValidatorMessages();
    }

    @Bean
    public InMemoryWarpMessenger warpMessenger() {
        return new InMemoryWarpMessenger();
    }

    @Bean
    public InMemoryValidatorEventLog validatorEventLog() {
        return new InMemoryValidatorEventLog();
    }

    /**
     * 32 字节标识与节点 ID 统一序列化为 0x 十六进制字符串。
     */
    @Bean
    public Module validatorIdentifierModule() {
        SimpleModule module = new SimpleModule("validator-identifiers");
        module.addSerializer(Bytes32.class, ToStringSerializer.instance);
        module.addSerializer(NodeId.class, ToStringSerializer.instance);
        return module;
    }

    @Bean
    public ValidatorManagerSettings validatorManagerSettings(ValidatorManagerProperties props) {
        return new ValidatorManagerSettings(
                Bytes32.fromHex(props.getSubnetId()),
                Bytes32.fromHex(props.getBlockchainId()),
                props.getManagerAddress(),
                props.getAdmin(),
                props.getChurnPeriod(),
                props.getMaximumChurnPercentage());
    }

    @Bean
    public StakingManagerSettings stakingManagerSettings(StakingProperties props) {
        return new StakingManagerSettings(
                props.getMinimumStakeAmount(),
                props.getMaximumStakeAmount(),
                props.getMinimumStakeDuration(),
                props.getMinimumDelegationFeeBips(),
                props.getMaximumStakeMultiplier(),
                props.getWeightToValueFactor(),
                Bytes32.fromHex(props.getUptimeBlockchainId()));
    }

    @Bean
    public ValidatorManager validatorManager(ValidatorManagerSettings settings,
                                             ValidatorLedgerRepository repository,
                                             LedgerTransactionManager txManager,
                                             ValidatorMessageCodec codec,
                                             InMemoryWarpMessenger warpMessenger,
                                             InMemoryValidatorEventLog eventLog,
                                             Clock clock,
                                             ValidatorManagerMetrics metrics) {
        LOGGER.info("validator manager for subnet {}, churn {}% per {}", settings.getSubnetId(),
                settings.getMaximumChurnPercentage(), settings.getChurnPeriod());
        return new ValidatorManager(settings, repository, txManager, codec, warpMessenger, eventLog, clock, metrics);
    }

    @Bean
    public PoAValidatorManager poaValidatorManager(ValidatorManager validatorManager,
                                                   LedgerTransactionManager txManager) {
        return new PoAValidatorManager(validatorManager, txManager);
    }

    @Bean
    @ConditionalOnMissingBean(RewardCalculator.class)
    public RewardCalculator rewardCalculator(StakingProperties props) {
        return new ExampleRewardCalculator(props.getRewardBasisPoints());
    }

    @Bean
    @ConditionalOnMissingBean(StakeAssetAdapter.class)
    public StakeAssetAdapter stakeAssetAdapter(StakingProperties props) {
        if ("erc20".equalsIgnoreCase(props.getAsset())) {
            return new ERC20TokenAssetAdapter(props.getTokenAddress());
        }
        if (!"native".equalsIgnoreCase(props.getAsset())) {
            throw new IllegalStateException("unsupported staking.asset: " + props.getAsset());
        }
        return new NativeTokenAssetAdapter();
    }

    @Bean
    public StakingManager stakingManager(ValidatorManager validatorManager,
                                         StakingManagerSettings settings,
                                         StakingLedgerRepository repository,
                                         LedgerTransactionManager txManager,
                                         StakeAssetAdapter stakeAssetAdapter,
                                         RewardCalculator rewardCalculator,
                                         InMemoryWarpMessenger warpMessenger,
                                         ValidatorMessageCodec codec,
                                         InMemoryValidatorEventLog eventLog,
                                         Clock clock) {
        return new StakingManager(validatorManager, settings, repository, txManager, stakeAssetAdapter,
                rewardCalculator, warpMessenger, codec, eventLog, clock);
    }
}
