package com.realdonation.registry.api;

import com.realdonation.eventmodel.EventEnvelope;
import com.realdonation.eventmodel.EventJournal;
import com.realdonation.eventmodel.EventType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read access to the event journal, in append order.
 */
@RestController
@RequestMapping("/api/v1/events")
public class EventController {

    private final EventJournal journal;

    public EventController(EventJournal journal) {
        this.journal = journal;
    }

    /**
     * @param type optional event name ({@code Create}, {@code ModifyDescription}, {@code Cease},
     *             {@code Donate}); an unknown name is a bad request
     */
    @GetMapping
    public List<EventEnvelope<?>> events(@RequestParam(required = false) String type) {
        if (type == null || type.isBlank()) {
            return journal.events();
        }
        EventType eventType = EventType.fromString(type)
                .orElseThrow(() -> new IllegalArgumentException("Unknown event type: " + type));
        return journal.eventsOfType(eventType);
    }
}
