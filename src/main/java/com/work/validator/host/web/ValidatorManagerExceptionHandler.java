package com.work.validator.host.web;

import com.work.validator.core.exception.InvalidStateException;
import com.work.validator.core.exception.ValidatorManagerException;
import com.work.validator.host.web.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * 引擎异常到 HTTP 状态码的映射：
 * 输入非法 400，状态冲突 409，超出 churn 限制 429，未授权 403，Warp 消息非法 422。
 */
@RestControllerAdvice
public class ValidatorManagerExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ValidatorManagerExceptionHandler.class);

    @ExceptionHandler(ValidatorManagerException.class)
    public ResponseEntity<ErrorResponse> handleEngine(ValidatorManagerException e) {
        HttpStatus status = statusOf(e);
        LOGGER.info("request rejected, status={}, error={}", status.value(), e.getMessage());
        Object currentValue = e instanceof InvalidStateException ? ((InvalidStateException) e).getCurrentValue() : null;
        ErrorResponse body = new ErrorResponse(e.getKind().name(), e.getErrorName(), e.getMessage(),
                e.isRetryable(), currentValue == null ? null : currentValue.toString());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        return badRequest(message);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class,
            MissingRequestHeaderException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        return badRequest(e.getMessage());
    }

    static HttpStatus statusOf(ValidatorManagerException e) {
        switch (e.getKind()) {
            case INPUT_VALIDATION:
                return HttpStatus.BAD_REQUEST;
            case STATE_CONFLICT:
                return HttpStatus.CONFLICT;
            case CHURN_LIMIT:
                return HttpStatus.TOO_MANY_REQUESTS;
            case AUTHORIZATION:
                return HttpStatus.FORBIDDEN;
            case EXTERNAL_MESSAGE:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private static ResponseEntity<ErrorResponse> badRequest(String message) {
        return ResponseEntity.badRequest().body(new ErrorResponse("INPUT_VALIDATION", "InvalidRequest", message,
                false, null));
    }
}
