package com.realdonation.registry.domain.event;

import com.realdonation.registry.domain.ProjectId;
import com.realdonation.security.Address;

import java.time.Instant;

/** Payload of the {@code Create} event. */
public record ProjectCreated(
        ProjectId id, Address creator, String name, String description, Instant time) {}
