package com.work.validator.host.persistence;

import com.work.validator.host.persistence.entity.ManagerStateEntity;
import com.work.validator.host.persistence.mapper.ManagerStateMapper;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class SpringLedgerTransactionManagerTest {

    private final PlatformTransactionManager platform = mock(PlatformTransactionManager.class);
    private final TransactionStatus status = mock(TransactionStatus.class);
    private final ManagerStateMapper managerStateMapper = mock(ManagerStateMapper.class);
    private final SpringLedgerTransactionManager txManager =
            new SpringLedgerTransactionManager(platform, managerStateMapper);

    @Test
    public void work_runs_after_locking_the_manager_state_row() {
        when(platform.getTransaction(any(TransactionDefinition.class))).thenReturn(status);
        when(managerStateMapper.lockManagerState()).thenReturn(new ManagerStateEntity());

        String result = txManager.execute(() -> "ok");

        assertEquals("ok", result);
        verify(managerStateMapper, times(1)).lockManagerState();
        verify(platform, times(1)).commit(eq(status));
    }

    @Test
    public void missing_manager_state_row_rolls_back() {
        when(platform.getTransaction(any(TransactionDefinition.class))).thenReturn(status);
        when(managerStateMapper.lockManagerState()).thenReturn(null);

        assertThrows(LedgerStorageException.class, () -> txManager.execute(() -> "never"));
        verify(platform, times(1)).rollback(eq(status));
        verify(platform, never()).commit(any(TransactionStatus.class));
    }

    @Test
    public void after_commit_without_synchronization_runs_immediately() {
        StringBuilder ran = new StringBuilder();
        txManager.afterCommit(() -> ran.append("x"));
        assertEquals("x", ran.toString());
    }
}
