package com.realdonation.registry.domain.event;

import com.realdonation.registry.domain.ProjectId;

import java.time.Instant;

/** Payload of the {@code ModifyDescription} event. The registry keeps no other copy of the text. */
public record DescriptionModified(ProjectId id, String description, Instant time) {}
