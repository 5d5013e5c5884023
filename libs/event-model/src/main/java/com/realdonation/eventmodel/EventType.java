package com.realdonation.eventmodel;

import java.util.Optional;

/**
 * All event types the donation registry emits.
 *
 * <p>The {@code value} field holds the canonical string used in JSON serialization and in journal
 * queries.
 */
public enum EventType {
    PROJECT_CREATED("Create"),
    DESCRIPTION_MODIFIED("ModifyDescription"),
    PROJECT_CEASED("Cease"),
    DONATION_MADE("Donate");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    /** The canonical string representation used in JSON (e.g. "Donate"). */
    public String value() {
        return value;
    }

    /**
     * Looks up an EventType by its canonical string value.
     *
     * @param value the string to match (e.g. "Cease")
     * @return the matching EventType, or empty if not found
     */
    public static Optional<EventType> fromString(String value) {
        for (EventType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /** Checks whether a string corresponds to a known event type. */
    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }
}
