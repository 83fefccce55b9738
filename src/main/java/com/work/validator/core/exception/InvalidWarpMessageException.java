package com.work.validator.core.exception;

/**
 * 跨链消息不可用：索引无效、来源链或发送方不符、编码错误、内容与本地数据不一致。
 */
public class InvalidWarpMessageException extends ValidatorManagerException {

    public InvalidWarpMessageException(String errorName, String message) {
        super(ErrorKind.EXTERNAL_MESSAGE, errorName, message);
    }
}
