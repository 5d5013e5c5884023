package com.realdonation.registry;

import com.realdonation.registry.config.DonationRegistryProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Donation registry service.
 * <p>
 * Out of the box:
 * <ul>
 *   <li>Project registry, donation ledger and event journal held in memory</li>
 *   <li>Native value bank with genesis accounts from {@code realdonation.registry.genesis-accounts}</li>
 *   <li>Actuator health, metrics and Prometheus endpoints</li>
 *   <li>Correlation id propagation and RFC 7807 error responses</li>
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties(DonationRegistryProperties.class)
public class DonationRegistryApplication {

    private static final Logger log = LoggerFactory.getLogger(DonationRegistryApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(DonationRegistryApplication.class, args);
        log.info("Donation registry started");
    }
}
