package com.realdonation.registry.domain;

import com.realdonation.eventmodel.EventEnvelope;
import com.realdonation.eventmodel.EventJournal;
import com.realdonation.eventmodel.EventType;
import com.realdonation.registry.domain.event.DescriptionModified;
import com.realdonation.registry.domain.event.ProjectCeased;
import com.realdonation.registry.domain.event.ProjectCreated;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Current description of each live project, derived from the event journal.
 * <p>
 * The registry never stores descriptions; this index replays {@code Create} and
 * {@code ModifyDescription} events and keeps the latest text per id. {@code Cease} drops the
 * entry. All other events are ignored.
 */
public class DescriptionIndex implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DescriptionIndex.class);

    private final Map<ProjectId, String> descriptions = new ConcurrentHashMap<>();
    private final EventJournal.Subscription subscription;

    private DescriptionIndex(EventJournal journal) {
        journal.events().forEach(this::apply);
        this.subscription = journal.subscribeAll(this::apply);
    }

    /**
     * Builds the index from everything already in {@code journal} and keeps it current with
     * events appended afterwards.
     * <p>
     * Events appended by another thread while the replay runs may be missed; attach before the
     * journal receives concurrent writes.
     */
    public static DescriptionIndex attach(EventJournal journal) {
        DescriptionIndex index = new DescriptionIndex(journal);
        log.info("Description index attached with {} live descriptions", index.size());
        return index;
    }

    /** Latest description of a live project, empty if unknown or ceased. */
    public Optional<String> currentDescription(ProjectId id) {
        return Optional.ofNullable(descriptions.get(id));
    }

    public int size() {
        return descriptions.size();
    }

    /** Stops following the journal; the index keeps its last state. */
    @Override
    public void close() {
        subscription.close();
    }

    private void apply(EventEnvelope<?> event) {
        Optional<EventType> type = EventType.fromString(event.eventType());
        if (type.isEmpty()) {
            return;
        }
        switch (type.get()) {
            case PROJECT_CREATED -> {
                if (event.payload() instanceof ProjectCreated created) {
                    descriptions.put(created.id(), created.description());
                }
            }
            case DESCRIPTION_MODIFIED -> {
                if (event.payload() instanceof DescriptionModified modified) {
                    descriptions.put(modified.id(), modified.description());
                }
            }
            case PROJECT_CEASED -> {
                if (event.payload() instanceof ProjectCeased ceased) {
                    descriptions.remove(ceased.id());
                }
            }
            default -> {
                // donations carry no description
            }
        }
    }
}
