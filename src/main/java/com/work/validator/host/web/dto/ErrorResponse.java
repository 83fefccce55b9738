package com.work.validator.host.web.dto;

/**
 * 统一错误响应：error 为链上合约同名的错误标识，客户端按名称分支处理。
 */
public class ErrorResponse {

    private final String kind;
    private final String error;
    private final String message;
    private final boolean retryable;
    private final Object currentValue;

    public ErrorResponse(String kind, String error, String message, boolean retryable, Object currentValue) {
        this.kind = kind;
        this.error = error;
        this.message = message;
        this.retryable = retryable;
        this.currentValue = currentValue;
    }

    public String getKind() {
        return kind;
    }

    public String getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public Object getCurrentValue() {
        return currentValue;
    }
}
