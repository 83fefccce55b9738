package com.work.validator.core.exception;

/**
 * 错误分类，宿主侧据此映射 HTTP 状态码。
 */
public enum ErrorKind {
    INPUT_VALIDATION,
    STATE_CONFLICT,
    CHURN_LIMIT,
    AUTHORIZATION,
    EXTERNAL_MESSAGE
}
