package com.realdonation.eventmodel;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EventJournal")
class EventJournalTest {

    private EventJournal journal;

    @BeforeEach
    void setUp() {
        journal = new EventJournal();
    }

    private EventEnvelope<String> event(EventType type, String entityId) {
        var entity = new EventEntity("Project", entityId, journal.nextSequence(entityId));
        return EventFactory.create(type, "registry", Instant.now(), entity, "payload");
    }

    @Nested
    @DisplayName("append")
    class Append {

        @Test
        @DisplayName("keeps events in append order")
        void keepsOrder() {
            journal.append(event(EventType.PROJECT_CREATED, "p1"));
            journal.append(event(EventType.DESCRIPTION_MODIFIED, "p1"));
            journal.append(event(EventType.PROJECT_CREATED, "p2"));

            assertThat(journal.events())
                    .extracting(EventEnvelope::eventType)
                    .containsExactly("Create", "ModifyDescription", "Create");
            assertThat(journal.size()).isEqualTo(3);
        }

        @Test
        @DisplayName("assigns per-entity sequences")
        void perEntitySequences() {
            journal.append(event(EventType.PROJECT_CREATED, "p1"));
            journal.append(event(EventType.PROJECT_CREATED, "p2"));
            journal.append(event(EventType.PROJECT_CEASED, "p1"));

            assertThat(journal.eventsFor("p1"))
                    .extracting(e -> e.entity().sequence())
                    .containsExactly(1L, 2L);
            assertThat(journal.nextSequence("p2")).isEqualTo(2);
        }

        @Test
        @DisplayName("rejects out-of-sequence events")
        void rejectsOutOfSequence() {
            var stale = event(EventType.PROJECT_CREATED, "p1");
            journal.append(event(EventType.PROJECT_CREATED, "p1"));

            assertThatThrownBy(() -> journal.append(stale))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("expected 2");
            assertThat(journal.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("rejects malformed events")
        void rejectsMalformed() {
            var bad = new EventEnvelope<>("id", "Create", 1, null, "registry", "c", "direct",
                    new EventEntity("Project", "p1", 1), "payload");

            assertThatThrownBy(() -> journal.append(bad))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("occurredAt");
        }

        @Test
        @DisplayName("filters by type")
        void filtersByType() {
            journal.append(event(EventType.PROJECT_CREATED, "p1"));
            journal.append(event(EventType.DONATION_MADE, "p1"));

            assertThat(journal.eventsOfType(EventType.DONATION_MADE)).hasSize(1);
            assertThat(journal.eventsOfType(EventType.PROJECT_CEASED)).isEmpty();
        }
    }

    @Nested
    @DisplayName("listeners")
    class Listeners {

        @Test
        @DisplayName("subscribe receives only matching events until closed")
        void subscribeMatchingOnly() {
            List<String> seen = new ArrayList<>();
            var subscription = journal.subscribe(EventType.DONATION_MADE, e -> seen.add(e.eventId()));

            journal.append(event(EventType.PROJECT_CREATED, "p1"));
            var donation = event(EventType.DONATION_MADE, "p1");
            journal.append(donation);
            subscription.close();
            journal.append(event(EventType.DONATION_MADE, "p1"));

            assertThat(seen).containsExactly(donation.eventId());
        }

        @Test
        @DisplayName("a failing listener does not prevent the append")
        void failingListener() {
            journal.subscribeAll(e -> {
                throw new IllegalStateException("listener bug");
            });

            journal.append(event(EventType.PROJECT_CREATED, "p1"));

            assertThat(journal.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("once completes with the next matching event")
        void onceCompletes() {
            var next = journal.once(EventType.PROJECT_CEASED);
            journal.append(event(EventType.PROJECT_CREATED, "p1"));
            assertThat(next).isNotDone();

            var cease = event(EventType.PROJECT_CEASED, "p1");
            journal.append(cease);

            assertThat(next).isCompletedWithValue(cease);
        }
    }

    @Nested
    @DisplayName("awaitNext")
    class AwaitNext {

        @Test
        @DisplayName("returns the event produced by the action")
        void returnsProducedEvent() throws Exception {
            var create = event(EventType.PROJECT_CREATED, "p1");

            var received = journal.awaitNext(
                    EventType.PROJECT_CREATED, () -> journal.append(create), Duration.ofSeconds(1));

            assertThat(received).isSameAs(create);
        }

        @Test
        @DisplayName("times out when the action emits nothing")
        void timesOut() {
            assertThatThrownBy(() -> journal.awaitNext(
                    EventType.PROJECT_CREATED, () -> { }, Duration.ofMillis(50)))
                    .isInstanceOf(TimeoutException.class);
        }

        @Test
        @DisplayName("propagates the action's failure")
        void propagatesFailure() {
            assertThatThrownBy(() -> journal.awaitNext(
                    EventType.PROJECT_CREATED,
                    () -> {
                        throw new IllegalArgumentException("rejected");
                    },
                    Duration.ofSeconds(1)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("rejected");
        }
    }
}
