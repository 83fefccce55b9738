package com.work.validator.core.event;

/**
 * 引擎事件基类。事件仅在所属账本事务提交后发布，名称与链上合约事件一致。
 */
public abstract class ValidatorManagerEvent {

    public String getName() {
        return getClass().getSimpleName();
    }
}
