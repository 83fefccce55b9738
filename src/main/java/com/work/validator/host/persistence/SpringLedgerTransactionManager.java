package com.work.validator.host.persistence;

import com.work.validator.core.repository.LedgerTransactionManager;
import com.work.validator.host.persistence.mapper.ManagerStateMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * 数据库账本的事务边界：READ_COMMITTED + 锁住 manager_state 行作为全局单写者锁。
 * 嵌套调用加入已存在的事务；提交后动作通过 TransactionSynchronization 注册。
 */
public class SpringLedgerTransactionManager implements LedgerTransactionManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(SpringLedgerTransactionManager.class);

    private final TransactionTemplate transactionTemplate;
    private final ManagerStateMapper managerStateMapper;

    public SpringLedgerTransactionManager(PlatformTransactionManager transactionManager,
                                          ManagerStateMapper managerStateMapper) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        this.managerStateMapper = managerStateMapper;
    }

    @Override
    public <T> T execute(Supplier<T> work) {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            return work.get();
        }
        return transactionTemplate.execute(status -> {
            if (managerStateMapper.lockManagerState() == null) {
                throw new LedgerStorageException("manager_state 行不存在，请先执行 schema.sql");
            }
            return work.get();
        });
    }

    @Override
    public void afterCommit(Runnable action) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            action.run();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                try {
                    action.run();
                } catch (RuntimeException e) {
                    LOGGER.warn("after-commit action failed", e);
                }
            }
        });
    }
}
