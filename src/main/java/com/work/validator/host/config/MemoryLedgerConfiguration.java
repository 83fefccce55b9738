package com.work.validator.host.config;

import com.work.validator.core.repository.memory.InMemoryLedgerStore;
import com.work.validator.core.repository.memory.InMemoryLedgerTransactionManager;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 默认账本：进程内存，重启即丢失，仅适合单实例与演示。
 */
@Configuration
@ConditionalOnProperty(prefix = "validator-manager", name = "store", havingValue = "memory", matchIfMissing = true)
public class MemoryLedgerConfiguration {

    @Bean
    public InMemoryLedgerStore inMemoryLedgerStore() {
        return new InMemoryLedgerStore();
    }

    @Bean
    public InMemoryLedgerTransactionManager ledgerTransactionManager(InMemoryLedgerStore store) {
        return new InMemoryLedgerTransactionManager(store);
    }
}
