package com.work.validator.core.event;

public interface ValidatorEventPublisher {

    void publish(ValidatorManagerEvent event);
}
