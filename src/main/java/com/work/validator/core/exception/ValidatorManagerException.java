package com.work.validator.core.exception;

/**
 * 验证者管理引擎的统一异常类型。
 * <p>errorName 与链上合约的自定义错误名保持一致（如 MaxChurnRateExceeded），便于客户端按名称处理。</p>
 * <p>任何此类异常抛出时，当前操作不会留下任何状态变更。</p>
 */
public class ValidatorManagerException extends RuntimeException {

    private final ErrorKind kind;
    private final String errorName;

    public ValidatorManagerException(ErrorKind kind, String errorName, String message) {
        super(errorName + ": " + message);
        this.kind = kind;
        this.errorName = errorName;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getErrorName() {
        return errorName;
    }

    /**
     * 标识该异常是否可通过稍后重试解决。默认不可重试。
     */
    public boolean isRetryable() {
        return false;
    }
}
