package com.work.validator.core.support.metrics;

public class NoopValidatorManagerMetrics implements ValidatorManagerMetrics {
}
