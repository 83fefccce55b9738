package com.work.validator.host.web;

import com.work.validator.core.event.InMemoryValidatorEventLog;
import com.work.validator.core.event.RecordedEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/events")
public class EventController {

    private final InMemoryValidatorEventLog eventLog;

    public EventController(InMemoryValidatorEventLog eventLog) {
        this.eventLog = eventLog;
    }

    @GetMapping
    public List<RecordedEvent> events(@RequestParam(value = "after", defaultValue = "0") long after,
                                      @RequestParam(value = "limit", defaultValue = "100") int limit) {
        return eventLog.since(after, limit);
    }
}
