package com.realdonation.registry.api;

import com.realdonation.eventmodel.EventJournal;
import com.realdonation.registry.config.DonationRegistryProperties;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Lightweight runtime information next to {@code /actuator/info}.
 */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final DonationRegistryProperties properties;
    private final EventJournal journal;

    public ServiceInfoController(DonationRegistryProperties properties, EventJournal journal) {
        this.properties = properties;
        this.journal = journal;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        return Map.of(
                "name", properties.name(),
                "environment", properties.environment(),
                "description", properties.description() != null ? properties.description() : "",
                "events", journal.size(),
                "status", "running",
                "timestamp", Instant.now().toString());
    }
}
