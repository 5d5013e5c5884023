package com.realdonation.eventmodel;

import java.time.Instant;
import java.util.UUID;

/**
 * Factory methods for creating {@link EventEnvelope} instances.
 *
 * <p>Encapsulates default value logic (UUID generation, default version and causation) so callers
 * don't repeat boilerplate.
 */
public final class EventFactory {

    /** Causation marker for events caused directly by an external call. */
    public static final String DIRECT_CAUSATION = "direct";

    private EventFactory() {
        // utility class
    }

    /**
     * Creates a new event envelope with auto-generated eventId and correlationId, stamped with the
     * given occurrence time.
     */
    public static <T> EventEnvelope<T> create(
            EventType eventType,
            String producer,
            Instant occurredAt,
            EventEntity entity,
            T payload
    ) {
        return create(eventType, producer, occurredAt, UUID.randomUUID().toString(), entity, payload);
    }

    /**
     * Creates a new event envelope that carries the caller's correlation ID.
     */
    public static <T> EventEnvelope<T> create(
            EventType eventType,
            String producer,
            Instant occurredAt,
            String correlationId,
            EventEntity entity,
            T payload
    ) {
        return new EventEnvelope<>(
                UUID.randomUUID().toString(),
                eventType.value(),
                1,
                occurredAt,
                producer,
                correlationId,
                DIRECT_CAUSATION,
                entity,
                payload
        );
    }
}
