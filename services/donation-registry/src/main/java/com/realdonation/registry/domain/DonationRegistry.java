package com.realdonation.registry.domain;

import com.realdonation.eventmodel.EventEntity;
import com.realdonation.eventmodel.EventFactory;
import com.realdonation.eventmodel.EventJournal;
import com.realdonation.eventmodel.EventType;
import com.realdonation.observability.CorrelationContextHolder;
import com.realdonation.observability.SpanHelper;
import com.realdonation.registry.domain.event.DescriptionModified;
import com.realdonation.registry.domain.event.DonationMade;
import com.realdonation.registry.domain.event.ProjectCeased;
import com.realdonation.registry.domain.event.ProjectCreated;
import com.realdonation.security.Address;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

import static com.realdonation.registry.domain.RegistryGuards.DESCRIPTION_MAX_BYTES;
import static com.realdonation.registry.domain.RegistryGuards.MESSAGE_MAX_BYTES;
import static com.realdonation.registry.domain.RegistryGuards.NAME_MAX_BYTES;
import static com.realdonation.registry.domain.RegistryGuards.NAME_MIN_BYTES;

/**
 * The project registry and donation ledger.
 * <p>
 * Four mutating operations ({@link #create}, {@link #modifyDescription}, {@link #cease},
 * {@link #donate}) and two queries. Each mutation runs entirely under one write lock and follows
 * the same shape: guards, then (for donations) the value transfer, then the state change, then one
 * event appended to the {@link EventJournal}. A failure at any step before the state change leaves
 * nothing behind; the state change and the append cannot fail for well-formed input.
 * <p>
 * Queries take the read lock and return the zero value for unknown keys.
 */
public class DonationRegistry {

    /** Entity type recorded on every event the registry emits. */
    public static final String ENTITY_TYPE = "Project";

    private static final Logger log = LoggerFactory.getLogger(DonationRegistry.class);

    private final Map<ProjectId, Project> projects = new HashMap<>();
    private final Map<LedgerKey, BigInteger> donated = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final ValueTransfer valueTransfer;
    private final EventJournal journal;
    private final Clock clock;
    private final RegistryMetrics metrics;
    private final SpanHelper spans;
    private final String producer;

    public DonationRegistry(
            ValueTransfer valueTransfer,
            EventJournal journal,
            Clock clock,
            RegistryMetrics metrics,
            SpanHelper spans,
            String producer) {
        this.valueTransfer = Objects.requireNonNull(valueTransfer, "valueTransfer");
        this.journal = Objects.requireNonNull(journal, "journal");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.spans = Objects.requireNonNull(spans, "spans");
        this.producer = Objects.requireNonNull(producer, "producer");
    }

    /**
     * Registers a project owned by {@code caller} and emits {@code Create}.
     * <p>
     * The id is derived from (caller, name, current second). A second create with the same triple
     * replaces the stored record; the replacement is logged and both {@code Create} events remain
     * in the journal.
     *
     * @return the derived project id
     */
    public ProjectId create(Address caller, String name, String description) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(description, "description");
        return execute("registry.create", caller, null, () -> {
            RegistryGuards.requireLength(name, NAME_MIN_BYTES, NAME_MAX_BYTES);
            RegistryGuards.requireLength(description, 0, DESCRIPTION_MAX_BYTES);

            Instant now = now();
            ProjectId id = ProjectId.derive(caller, name, now);
            Project previous = projects.put(id, new Project(id, caller, name, now));
            boolean replaced = previous != null;
            if (replaced) {
                log.warn("Project id collision for {} (creator {}, name '{}'); previous record replaced",
                        id, caller, name);
            }
            emit(EventType.PROJECT_CREATED, id, now, new ProjectCreated(id, caller, name, description, now));
            metrics.projectCreated(replaced);
            log.info("Project {} created by {}", id, caller);
            return id;
        });
    }

    /**
     * Emits {@code ModifyDescription} for a project the caller created. Stored state is unchanged.
     */
    public void modifyDescription(Address caller, ProjectId id, String description) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(description, "description");
        execute("registry.modifyDescription", caller, id, () -> {
            RegistryGuards.requireCreator(lookup(id), caller);
            RegistryGuards.requireLength(description, 0, DESCRIPTION_MAX_BYTES);

            Instant now = now();
            emit(EventType.DESCRIPTION_MODIFIED, id, now, new DescriptionModified(id, description, now));
            metrics.descriptionModified();
            log.info("Description of project {} modified", id);
            return null;
        });
    }

    /**
     * Removes a project the caller created and emits {@code Cease}. Ledger entries for the project
     * are kept.
     */
    public void cease(Address caller, ProjectId id) {
        Objects.requireNonNull(id, "id");
        execute("registry.cease", caller, id, () -> {
            RegistryGuards.requireCreator(lookup(id), caller);

            Instant now = now();
            projects.remove(id);
            emit(EventType.PROJECT_CEASED, id, now, new ProjectCeased(id, now));
            metrics.projectCeased();
            log.info("Project {} ceased by {}", id, caller);
            return null;
        });
    }

    /**
     * Forwards {@code amount} from the caller to the project's current creator, adds it to the
     * caller's ledger entry for the project and emits {@code Donate}.
     *
     * @throws DonationRegistryException with {@link ErrorCode#TRANSACTION_FAILED} if the transfer
     *     is rejected; the ledger is then untouched
     */
    public void donate(Address caller, ProjectId id, BigInteger amount, String message) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(amount, "amount");
        Objects.requireNonNull(message, "message");
        execute("registry.donate", caller, id, () -> {
            RegistryGuards.requirePositive(amount);
            RegistryGuards.requireLength(message, 0, MESSAGE_MAX_BYTES);
            Project project = lookup(id);
            RegistryGuards.requireExists(id, project);
            RegistryGuards.requireNotCreator(project, caller);

            Instant now = now();
            forward(caller, project.creator(), amount);
            donated.merge(new LedgerKey(caller, id), amount, BigInteger::add);
            emit(EventType.DONATION_MADE, id, now,
                    new DonationMade(id, caller, project.creator(), project.name(), amount, message, now));
            metrics.donation(amount);
            log.info("Donation of {} from {} to project {}", amount, caller, id);
            return null;
        });
    }

    /** Returns the stored project, or {@link Project#EMPTY} if absent or ceased. */
    public Project getProject(ProjectId id) {
        lock.readLock().lock();
        try {
            return lookup(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Returns the total {@code donor} has ever donated to {@code id}, zero if nothing. */
    public BigInteger getDonated(Address donor, ProjectId id) {
        lock.readLock().lock();
        try {
            return donated.getOrDefault(new LedgerKey(donor, id), BigInteger.ZERO);
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T execute(String operation, Address caller, ProjectId id, Supplier<T> work) {
        Objects.requireNonNull(caller, "caller");
        Map<String, String> attributes = id == null
                ? Map.of("registry.caller", caller.toHex())
                : Map.of("registry.caller", caller.toHex(), "registry.project", id.toHex());
        return spans.traced(operation, attributes, () -> {
            lock.writeLock().lock();
            try {
                if (caller.isZero()) {
                    throw DonationRegistryException.illegalCaller(caller);
                }
                return work.get();
            } catch (DonationRegistryException e) {
                metrics.guardFailure(e.code());
                log.debug("{} rejected for caller {}: {}", operation, caller, e.getMessage());
                throw e;
            } finally {
                lock.writeLock().unlock();
            }
        });
    }

    private void forward(Address donor, Address creator, BigInteger amount) {
        Timer.Sample sample = Timer.start();
        try {
            valueTransfer.transfer(donor, creator, amount);
        } catch (TransferRejectedException e) {
            log.warn("Transfer of {} from {} to {} rejected: {}", amount, donor, creator, e.getMessage());
            throw DonationRegistryException.transactionFailed(e);
        } finally {
            sample.stop(metrics.transferTimer());
        }
    }

    private void emit(EventType type, ProjectId id, Instant time, Object payload) {
        String entityId = id.toHex();
        var entity = new EventEntity(ENTITY_TYPE, entityId, journal.nextSequence(entityId));
        journal.append(EventFactory.create(
                type, producer, time, CorrelationContextHolder.correlationIdOrNew(), entity, payload));
    }

    private Project lookup(ProjectId id) {
        return projects.getOrDefault(id, Project.EMPTY);
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }

    private record LedgerKey(Address donor, ProjectId id) {}
}
