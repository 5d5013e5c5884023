package com.realdonation.registry.domain;

import com.realdonation.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;

import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Meters recorded by {@link DonationRegistry}. Only committed operations are counted, apart from
 * {@code registry.guard.failures} which counts rejections per error code.
 */
public class RegistryMetrics {

    private final MetricFactory factory;
    private final Counter projectsCreated;
    private final Counter projectsCeased;
    private final Counter descriptionsModified;
    private final Counter donations;
    private final DistributionSummary donationAmount;
    private final Timer transferDuration;
    private final AtomicLong activeProjects;

    public RegistryMetrics(MetricFactory factory) {
        this.factory = factory;
        this.projectsCreated = factory.counter("registry.projects.created", "Projects created");
        this.projectsCeased = factory.counter("registry.projects.ceased", "Projects ceased");
        this.descriptionsModified =
                factory.counter("registry.descriptions.modified", "Description updates emitted");
        this.donations = factory.counter("registry.donations", "Committed donations");
        this.donationAmount =
                factory.distributionSummary("registry.donation.amount", "Donated value per donation");
        this.transferDuration =
                factory.timer("registry.transfer.duration", "Time spent forwarding value to creators");
        this.activeProjects = factory.gauge("registry.projects.active", "Projects currently registered");
    }

    void projectCreated(boolean replacedExisting) {
        projectsCreated.increment();
        if (!replacedExisting) {
            activeProjects.incrementAndGet();
        }
    }

    void projectCeased() {
        projectsCeased.increment();
        activeProjects.decrementAndGet();
    }

    void descriptionModified() {
        descriptionsModified.increment();
    }

    void donation(BigInteger amount) {
        donations.increment();
        // Precision loss above 2^53 is acceptable for a histogram.
        donationAmount.record(amount.doubleValue());
    }

    Timer transferTimer() {
        return transferDuration;
    }

    void guardFailure(ErrorCode code) {
        factory.counter("registry.guard.failures", "Rejected registry calls", "error", code.value())
                .increment();
    }
}
