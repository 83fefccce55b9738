package com.work.validator.core.message;

import com.work.validator.core.model.Bytes32;

public final class ValidationUptimeMessage {

    private final Bytes32 validationId;
    private final long uptimeSeconds;

    public ValidationUptimeMessage(Bytes32 validationId, long uptimeSeconds) {
        this.validationId = validationId;
        this.uptimeSeconds = uptimeSeconds;
    }

    public Bytes32 getValidationId() {
        return validationId;
    }

    public long getUptimeSeconds() {
        return uptimeSeconds;
    }
}
