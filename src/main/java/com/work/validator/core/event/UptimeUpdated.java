package com.work.validator.core.event;

import com.work.validator.core.model.Bytes32;

public class UptimeUpdated extends ValidatorManagerEvent {

    private final Bytes32 validationId;
    private final long uptime;

    public UptimeUpdated(Bytes32 validationId, long uptime) {
        this.validationId = validationId;
        this.uptime = uptime;
    }

    public Bytes32 getValidationId() {
        return validationId;
    }

    public long getUptime() {
        return uptime;
    }

    @Override
    public String toString() {
        return "UptimeUpdated{" +
                "validationId=" + validationId +
                ", uptime=" + uptime +
                '}';
    }
}
