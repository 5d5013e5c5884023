package com.realdonation.eventmodel;

import java.time.Instant;

/**
 * Canonical event envelope for every event the registry appends to its journal.
 *
 * <p>The envelope carries standard metadata (identification, correlation, versioning) alongside
 * the domain-specific payload. Once appended, an event is never modified; consumers reconstruct
 * history by replaying envelopes in journal order.
 *
 * @param <T> the type of the domain-specific payload
 */
public record EventEnvelope<T>(
        /** Unique identifier for this event instance (UUID v4). */
        String eventId,

        /** The type/name of this event (e.g. "Donate"). */
        String eventType,

        /** Schema version of this event type, starts at 1. */
        int eventVersion,

        /** When the event occurred. */
        Instant occurredAt,

        /** Name of the component that produced this event. */
        String producer,

        /** Correlation ID linking the event to the request that caused it. */
        String correlationId,

        /** ID of the command or event that directly caused this event. */
        String causationId,

        /** The domain entity this event relates to. */
        EventEntity entity,

        /** Domain-specific event data. */
        T payload) {}
