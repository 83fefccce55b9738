package com.work.validator.core.exception;

/**
 * 权重变更超出 churn 限制。
 * <p>MaxChurnRateExceeded 在下一个 churn 周期开始后可重试；InvalidTotalWeight 不可重试。</p>
 */
public class ChurnExceededException extends ValidatorManagerException {

    public static final String MAX_CHURN_RATE_EXCEEDED = "MaxChurnRateExceeded";
    public static final String INVALID_TOTAL_WEIGHT = "InvalidTotalWeight";

    private final long value;

    public ChurnExceededException(String errorName, long value, String message) {
        super(ErrorKind.CHURN_LIMIT, errorName, message);
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    @Override
    public boolean isRetryable() {
        return MAX_CHURN_RATE_EXCEEDED.equals(getErrorName());
    }
}
