package com.realdonation.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("MetricFactory")
class MetricFactoryTest {

    private SimpleMeterRegistry registry;
    private MetricFactory factory;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        factory = new MetricFactory(registry, "donation-registry");
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should reject null registry")
        void shouldRejectNullRegistry() {
            assertThatThrownBy(() -> new MetricFactory(null, "svc"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("registry");
        }

        @Test
        @DisplayName("should reject blank service name")
        void shouldRejectBlankServiceName() {
            assertThatThrownBy(() -> new MetricFactory(registry, "  "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("serviceName");
        }
    }

    @Test
    @DisplayName("counter carries service and extra tags and is shared per name/tags")
    void counterTagsAndSharing() {
        Counter counter =
                factory.counter("registry.guard.failures", "Guard failures", "error", "IllegalCaller");
        counter.increment();
        factory.counter("registry.guard.failures", "Guard failures", "error", "IllegalCaller")
                .increment();

        assertThat(counter.count()).isEqualTo(2.0);
        assertThat(counter.getId().getTag("service")).isEqualTo("donation-registry");
        assertThat(counter.getId().getTag("error")).isEqualTo("IllegalCaller");
    }

    @Test
    @DisplayName("timer records durations")
    void timerRecords() {
        Timer timer = factory.timer("registry.transfer.duration", "Transfer latency");

        timer.record(Duration.ofMillis(150));
        timer.record(Duration.ofMillis(250));

        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(400.0);
    }

    @Test
    @DisplayName("distribution summary records amounts")
    void summaryRecords() {
        DistributionSummary summary =
                factory.distributionSummary("registry.donation.amount", "Donated amounts");

        summary.record(100);
        summary.record(200);

        assertThat(summary.count()).isEqualTo(2);
        assertThat(summary.totalAmount()).isEqualTo(300.0);
    }

    @Test
    @DisplayName("gauge follows its AtomicLong holder")
    void gaugeFollowsHolder() {
        AtomicLong active = factory.gauge("registry.projects.active", "Live projects");

        active.set(3);
        assertThat(registry.get("registry.projects.active")
                .tag("service", "donation-registry").gauge().value()).isEqualTo(3.0);

        active.decrementAndGet();
        assertThat(registry.get("registry.projects.active").gauge().value()).isEqualTo(2.0);
    }
}
