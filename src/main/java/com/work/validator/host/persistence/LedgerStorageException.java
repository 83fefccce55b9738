package com.work.validator.host.persistence;

/**
 * 账本存储层异常：表结构缺失、写入未生效等非业务错误。
 */
public class LedgerStorageException extends RuntimeException {

    public LedgerStorageException(String message) {
        super(message);
    }

    public LedgerStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
