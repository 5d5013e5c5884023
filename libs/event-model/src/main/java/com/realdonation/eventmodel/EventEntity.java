package com.realdonation.eventmodel;

/**
 * Tracks the domain entity an event relates to.
 *
 * @param entityType the kind of entity, e.g. "Project"
 * @param entityId unique identifier of the entity instance
 * @param sequence monotonically increasing event number for this entity (for ordering)
 */
public record EventEntity(String entityType, String entityId, long sequence) {}
