package com.work.validator.core.repository;

import java.util.function.Supplier;

/**
 * 账本事务边界：单写者、全有或全无。
 *
 * 约定：
 * 1. execute 内抛出的任何异常都会回滚本次所有写入
 * 2. 嵌套调用加入外层事务
 * 3. afterCommit 注册的动作在最外层事务提交后按注册顺序执行；回滚时丢弃
 */
public interface LedgerTransactionManager {

    <T> T execute(Supplier<T> work);

    default void executeWithoutResult(Runnable work) {
        execute(() -> {
            work.run();
            return null;
        });
    }

    /**
     * 注册提交后动作。不在事务内调用时立即执行。
     */
    void afterCommit(Runnable action);
}
