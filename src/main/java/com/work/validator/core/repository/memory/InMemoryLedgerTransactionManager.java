package com.work.validator.core.repository.memory;

import com.work.validator.core.repository.LedgerTransactionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

/**
 * 内存账本的事务管理：进程内单写者锁 + 快照回滚。
 * <p>写锁即账本的读写锁，事务期间其它线程的读操作会等待提交或回滚完成。
 * 提交后动作在释放写锁前执行，保证出站消息与事件的顺序与事务提交顺序一致。</p>
 */
public class InMemoryLedgerTransactionManager implements LedgerTransactionManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryLedgerTransactionManager.class);

    private final InMemoryLedgerStore store;
    private final Lock writerLock;
    private final ThreadLocal<List<Runnable>> afterCommitActions = new ThreadLocal<>();

    public InMemoryLedgerTransactionManager(InMemoryLedgerStore store) {
        this.store = store;
        this.writerLock = store.writeLock();
    }

    @Override
    public <T> T execute(Supplier<T> work) {
        if (afterCommitActions.get() != null) {
            // 嵌套调用：加入外层事务
            return work.get();
        }
        writerLock.lock();
        InMemoryLedgerStore.Snapshot snapshot = store.snapshot();
        List<Runnable> actions = new ArrayList<>();
        afterCommitActions.set(actions);
        try {
            T result;
            try {
                result = work.get();
            } catch (RuntimeException | Error e) {
                store.restore(snapshot);
                throw e;
            } finally {
                afterCommitActions.remove();
            }
            runAfterCommit(actions);
            return result;
        } finally {
            writerLock.unlock();
        }
    }

    @Override
    public void afterCommit(Runnable action) {
        List<Runnable> actions = afterCommitActions.get();
        if (actions == null) {
            action.run();
            return;
        }
        actions.add(action);
    }

    private void runAfterCommit(List<Runnable> actions) {
        for (Runnable action : actions) {
            try {
                action.run();
            } catch (RuntimeException e) {
                // 状态已提交，单个动作失败不影响后续动作；出站消息可通过重发补偿
                LOGGER.warn("after-commit action failed", e);
            }
        }
    }
}
