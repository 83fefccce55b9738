package com.work.validator.core.exception;

/**
 * 入参不合法：长度、范围、排序、阈值等。
 */
public class InvalidInputException extends ValidatorManagerException {

    public InvalidInputException(String errorName, String message) {
        super(ErrorKind.INPUT_VALIDATION, errorName, message);
    }
}
