package com.realdonation.registry.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;

/**
 * Settings of the donation registry service, bound from {@code realdonation.registry.*}:
 *
 * <pre>
 * realdonation:
 *   registry:
 *     name: donation-registry
 *     environment: production
 *     transfer-timeout: 5s
 *     genesis-balance: 10000
 *     genesis-accounts:
 *       - 0xa000000000000000000000000000000000000001
 * </pre>
 *
 * @param name            service name used as event producer, meter tag and tracer name. Required.
 * @param environment     deployment environment (development, staging, production)
 * @param description     human-readable description shown by {@code /api/v1/info}
 * @param transferTimeout how long a receiving account may take to accept a donation
 * @param genesisBalance  balance credited to each genesis account at startup
 * @param genesisAccounts hex addresses funded at startup
 */
@ConfigurationProperties(prefix = "realdonation.registry")
@Validated
public record DonationRegistryProperties(
        @NotBlank String name,
        String environment,
        String description,
        Duration transferTimeout,
        BigInteger genesisBalance,
        List<String> genesisAccounts) {

    public static final Duration DEFAULT_TRANSFER_TIMEOUT = Duration.ofSeconds(5);
    public static final BigInteger DEFAULT_GENESIS_BALANCE = BigInteger.valueOf(10_000);

    /** Applies defaults before Bean Validation runs. */
    public DonationRegistryProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (transferTimeout == null || transferTimeout.isNegative() || transferTimeout.isZero()) {
            transferTimeout = DEFAULT_TRANSFER_TIMEOUT;
        }
        if (genesisBalance == null || genesisBalance.signum() <= 0) {
            genesisBalance = DEFAULT_GENESIS_BALANCE;
        }
        genesisAccounts = genesisAccounts == null ? List.of() : List.copyOf(genesisAccounts);
    }
}
