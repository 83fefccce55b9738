package com.work.validator.core.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 按发布顺序保存事件并分配递增序号，供轮询读取。
 */
public class InMemoryValidatorEventLog implements ValidatorEventPublisher {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryValidatorEventLog.class);

    private final List<RecordedEvent> events = new ArrayList<>();

    @Override
    public synchronized void publish(ValidatorManagerEvent event) {
        RecordedEvent recorded = new RecordedEvent(events.size() + 1L, event);
        events.add(recorded);
        LOGGER.info("[event] #{} {}", recorded.getSequence(), event);
    }

    /**
     * 序号大于 afterSequence 的事件，最多 limit 条。
     */
    public synchronized List<RecordedEvent> since(long afterSequence, int limit) {
        List<RecordedEvent> result = new ArrayList<>();
        int from = (int) Math.max(0, Math.min(afterSequence, events.size()));
        for (int i = from; i < events.size() && result.size() < limit; i++) {
            result.add(events.get(i));
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    public synchronized <T extends ValidatorManagerEvent> List<T> eventsOfType(Class<T> type) {
        List<T> result = new ArrayList<>();
        for (RecordedEvent recorded : events) {
            if (type.isInstance(recorded.getEvent())) {
                result.add((T) recorded.getEvent());
            }
        }
        return result;
    }

    public synchronized int size() {
        return events.size();
    }
}
