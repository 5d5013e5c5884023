package com.realdonation.registry.domain.event;

import com.realdonation.registry.domain.ProjectId;

import java.time.Instant;

/** Payload of the {@code Cease} event. */
public record ProjectCeased(ProjectId id, Instant time) {}
