package com.work.validator.core.exception;

/**
 * 当前状态不满足操作前置条件。
 * <p>currentValue 携带导致失败的当前状态 / nonce / 权重等取值。</p>
 */
public class InvalidStateException extends ValidatorManagerException {

    private final Object currentValue;

    public InvalidStateException(String errorName, String message, Object currentValue) {
        super(ErrorKind.STATE_CONFLICT, errorName, message);
        this.currentValue = currentValue;
    }

    public Object getCurrentValue() {
        return currentValue;
    }
}
