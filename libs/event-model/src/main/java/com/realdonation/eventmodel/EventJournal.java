package com.realdonation.eventmodel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Append-only, ordered log of {@link EventEnvelope}s.
 * <p>
 * The journal is the audit trail of the registry: every committed mutation appends exactly one
 * event, and the current view of anything not kept in primary state (such as a project's
 * description) is reconstructed by replaying it. Events are never removed or rewritten.
 * <p>
 * Each entity's events carry a sequence that must increase by exactly one per event; use
 * {@link #nextSequence(String)} to obtain it. Listeners are notified synchronously on the
 * appending thread, after the event is visible to readers.
 */
public class EventJournal {

    private static final Logger log = LoggerFactory.getLogger(EventJournal.class);

    private final List<EventEnvelope<?>> events = new ArrayList<>();
    private final Map<String, Long> sequences = new HashMap<>();
    private final List<Registration> listeners = new CopyOnWriteArrayList<>();

    /**
     * Appends an event and notifies matching listeners.
     *
     * @param event the event to append
     * @return the journal position of the appended event (0-based)
     * @throws IllegalArgumentException if the event is malformed or out of sequence
     */
    public long append(EventEnvelope<?> event) {
        ValidationResult validation = EventValidator.validate(event);
        if (!validation.valid()) {
            throw new IllegalArgumentException("Invalid event: " + String.join("; ", validation.errors()));
        }
        long position;
        synchronized (this) {
            String entityId = event.entity().entityId();
            long expected = sequences.getOrDefault(entityId, 0L) + 1;
            if (event.entity().sequence() != expected) {
                throw new IllegalArgumentException("Event %s for entity %s has sequence %d, expected %d"
                        .formatted(event.eventType(), entityId, event.entity().sequence(), expected));
            }
            sequences.put(entityId, expected);
            events.add(event);
            position = events.size() - 1L;
        }
        if (log.isDebugEnabled()) {
            log.debug("Appended event #{}: {}", position, EventSerializer.serialize(event));
        }
        notifyListeners(event);
        return position;
    }

    /** Returns the sequence number the next event for the given entity must carry. */
    public synchronized long nextSequence(String entityId) {
        return sequences.getOrDefault(entityId, 0L) + 1;
    }

    /** Returns a snapshot of all events in append order. */
    public synchronized List<EventEnvelope<?>> events() {
        return List.copyOf(events);
    }

    /** Returns a snapshot of the events of one entity, in append order. */
    public synchronized List<EventEnvelope<?>> eventsFor(String entityId) {
        return events.stream()
                .filter(e -> e.entity().entityId().equals(entityId))
                .toList();
    }

    /** Returns a snapshot of the events of one type, in append order. */
    public synchronized List<EventEnvelope<?>> eventsOfType(EventType type) {
        return events.stream()
                .filter(e -> e.eventType().equals(type.value()))
                .toList();
    }

    /** Number of events appended so far. */
    public synchronized int size() {
        return events.size();
    }

    /**
     * Registers a listener for events of the given type.
     *
     * @param type     the event type to listen for
     * @param listener callback invoked with each matching event
     * @return a subscription that removes the listener when closed
     */
    public Subscription subscribe(EventType type, Consumer<EventEnvelope<?>> listener) {
        return register(new Registration(type, listener));
    }

    /** Registers a listener for every event regardless of type. */
    public Subscription subscribeAll(Consumer<EventEnvelope<?>> listener) {
        return register(new Registration(null, listener));
    }

    /**
     * Returns a future completed by the next event of the given type. The underlying listener is
     * removed once the future completes or is cancelled.
     */
    public CompletableFuture<EventEnvelope<?>> once(EventType type) {
        CompletableFuture<EventEnvelope<?>> next = new CompletableFuture<>();
        Subscription subscription = subscribe(type, next::complete);
        next.whenComplete((event, error) -> subscription.close());
        return next;
    }

    /**
     * Runs an action and waits for the event of the given type that it produces.
     * <p>
     * The waiter is registered before the action runs, so an event appended synchronously by the
     * action is never missed. If the action throws, the wait is abandoned and the exception
     * propagates.
     *
     * @param type    the event type to wait for
     * @param action  the action expected to produce the event
     * @param timeout how long to wait for the event after the action returns
     * @return the first matching event appended after registration
     * @throws TimeoutException     if no matching event arrives in time
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public EventEnvelope<?> awaitNext(EventType type, Runnable action, Duration timeout)
            throws TimeoutException, InterruptedException {
        CompletableFuture<EventEnvelope<?>> next = once(type);
        try {
            action.run();
        } catch (RuntimeException e) {
            next.cancel(false);
            throw e;
        }
        try {
            return next.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            next.cancel(false);
            throw e;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Event wait failed", e.getCause());
        }
    }

    private Subscription register(Registration registration) {
        listeners.add(registration);
        return () -> listeners.remove(registration);
    }

    private void notifyListeners(EventEnvelope<?> event) {
        for (Registration registration : listeners) {
            if (registration.type() != null && !registration.type().value().equals(event.eventType())) {
                continue;
            }
            try {
                registration.listener().accept(event);
            } catch (RuntimeException e) {
                // The event is already committed; a faulty listener must not undo it.
                log.warn("Listener failed on event {} ({})", event.eventId(), event.eventType(), e);
            }
        }
    }

    /** Handle returned by the subscribe methods. */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {

        /** Removes the listener. Closing twice has no effect. */
        @Override
        void close();
    }

    private record Registration(EventType type, Consumer<EventEnvelope<?>> listener) {}
}
