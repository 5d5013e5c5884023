package com.realdonation.registry.config;

import com.realdonation.eventmodel.EventJournal;
import com.realdonation.observability.MetricFactory;
import com.realdonation.observability.SpanHelper;
import com.realdonation.registry.domain.DescriptionIndex;
import com.realdonation.registry.domain.DonationRegistry;
import com.realdonation.registry.domain.RegistryMetrics;
import com.realdonation.registry.infrastructure.bank.NativeValueBank;
import com.realdonation.security.Address;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the registry, its journal, the value bank and the observability helpers.
 */
@Configuration
public class RegistryConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RegistryConfiguration.class);

    @Bean
    public Clock registryClock() {
        return Clock.systemUTC();
    }

    @Bean
    public EventJournal eventJournal() {
        return new EventJournal();
    }

    @Bean(destroyMethod = "close")
    public NativeValueBank nativeValueBank(DonationRegistryProperties properties) {
        var bank = new NativeValueBank(properties.transferTimeout());
        for (String account : properties.genesisAccounts()) {
            bank.credit(Address.parse(account), properties.genesisBalance());
        }
        log.info("Value bank funded {} genesis accounts with {} each",
                properties.genesisAccounts().size(), properties.genesisBalance());
        return bank;
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry meterRegistry, DonationRegistryProperties properties) {
        return new MetricFactory(meterRegistry, properties.name());
    }

    @Bean
    public RegistryMetrics registryMetrics(MetricFactory metricFactory) {
        return new RegistryMetrics(metricFactory);
    }

    @Bean
    public SpanHelper spanHelper(ObjectProvider<OpenTelemetry> openTelemetry, DonationRegistryProperties properties) {
        OpenTelemetry otel = openTelemetry.getIfAvailable(GlobalOpenTelemetry::get);
        return new SpanHelper(otel.getTracer(properties.name()));
    }

    @Bean
    public DonationRegistry donationRegistry(
            NativeValueBank bank,
            EventJournal journal,
            Clock registryClock,
            RegistryMetrics metrics,
            SpanHelper spans,
            DonationRegistryProperties properties) {
        return new DonationRegistry(bank, journal, registryClock, metrics, spans, properties.name());
    }

    @Bean(destroyMethod = "close")
    public DescriptionIndex descriptionIndex(EventJournal journal) {
        return DescriptionIndex.attach(journal);
    }
}
