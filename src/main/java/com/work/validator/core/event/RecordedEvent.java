package com.work.validator.core.event;

public final class RecordedEvent {

    private final long sequence;
    private final ValidatorManagerEvent event;

    public RecordedEvent(long sequence, ValidatorManagerEvent event) {
        this.sequence = sequence;
        this.event = event;
    }

    public long getSequence() {
        return sequence;
    }

    public String getName() {
        return event.getName();
    }

    public ValidatorManagerEvent getEvent() {
        return event;
    }
}
