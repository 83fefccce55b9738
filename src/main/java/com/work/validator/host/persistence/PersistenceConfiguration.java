package com.work.validator.host.persistence;

import com.work.validator.host.persistence.mapper.ChurnPeriodMapper;
import com.work.validator.host.persistence.mapper.DelegatorMapper;
import com.work.validator.host.persistence.mapper.ManagerStateMapper;
import com.work.validator.host.persistence.mapper.PendingMessageMapper;
import com.work.validator.host.persistence.mapper.PosValidatorMapper;
import com.work.validator.host.persistence.mapper.RegisteredNodeMapper;
import com.work.validator.host.persistence.mapper.ValidatorMapper;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;

/**
 * validator-manager.store=postgres 时启用数据库账本（需同时激活 postgres profile 以配置数据源）。
 */
@Configuration
@ConditionalOnProperty(prefix = "validator-manager", name = "store", havingValue = "postgres")
@MapperScan("com.work.validator.host.persistence.mapper")
public class PersistenceConfiguration {

    @Bean
    public MybatisLedgerRepository mybatisLedgerRepository(ManagerStateMapper managerStateMapper,
                                                           ChurnPeriodMapper churnPeriodMapper,
                                                           ValidatorMapper validatorMapper,
                                                           RegisteredNodeMapper registeredNodeMapper,
                                                           PendingMessageMapper pendingMessageMapper,
                                                           PosValidatorMapper posValidatorMapper,
                                                           DelegatorMapper delegatorMapper,
                                                           Clock clock) {
        return new MybatisLedgerRepository(managerStateMapper, churnPeriodMapper, validatorMapper,
                registeredNodeMapper, pendingMessageMapper, posValidatorMapper, delegatorMapper, clock);
    }

    @Bean
    public SpringLedgerTransactionManager ledgerTransactionManager(PlatformTransactionManager transactionManager,
                                                                   ManagerStateMapper managerStateMapper) {
        return new SpringLedgerTransactionManager(transactionManager, managerStateMapper);
    }
}
