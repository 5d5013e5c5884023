package com.realdonation.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Factory for Micrometer meters that all carry the owning service's name as a {@code service}
 * tag.
 * <p>
 * Meters are registered lazily; asking twice for the same name and tags returns the same meter,
 * so callers may either cache the result or look it up per call (as done for guard failures,
 * whose {@code error} tag varies).
 */
public final class MetricFactory {

    /** Tag key for service name. */
    public static final String TAG_SERVICE = "service";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * Creates a MetricFactory bound to the given registry and service name.
     *
     * @param registry    the Micrometer meter registry
     * @param serviceName logical service name included as a default tag
     */
    public MetricFactory(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * Creates (or returns the existing) counter.
     *
     * @param name        metric name (e.g., "registry.donations")
     * @param description human-readable description
     * @param tags        additional tags (key-value pairs)
     */
    public Counter counter(String name, String description, String... tags) {
        return Counter.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Creates (or returns the existing) timer.
     *
     * @param name        metric name (e.g., "registry.transfer.duration")
     * @param description human-readable description
     * @param tags        additional tags (key-value pairs)
     */
    public Timer timer(String name, String description, String... tags) {
        return Timer.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Creates (or returns the existing) distribution summary.
     *
     * @param name        metric name (e.g., "registry.donation.amount")
     * @param description human-readable description
     * @param tags        additional tags (key-value pairs)
     */
    public DistributionSummary distributionSummary(String name, String description, String... tags) {
        return DistributionSummary.builder(name)
                .description(description)
                .tags(baseTags(tags))
                .register(registry);
    }

    /**
     * Registers a gauge whose value is held in the returned {@link AtomicLong}.
     *
     * @param name        metric name (e.g., "registry.projects.active")
     * @param description human-readable description
     * @param tags        additional tags (key-value pairs)
     * @return the holder to update; the registry keeps a strong reference to it
     */
    public AtomicLong gauge(String name, String description, String... tags) {
        AtomicLong value = new AtomicLong(0);
        Gauge.builder(name, value, AtomicLong::doubleValue)
                .description(description)
                .tags(baseTags(tags))
                .strongReference(true)
                .register(registry);
        return value;
    }

    private Tags baseTags(String... extraTags) {
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
