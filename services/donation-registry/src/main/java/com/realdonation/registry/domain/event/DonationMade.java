package com.realdonation.registry.domain.event;

import com.realdonation.registry.domain.ProjectId;
import com.realdonation.security.Address;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Payload of the {@code Donate} event.
 *
 * @param id       the project donated to
 * @param donor    the calling account
 * @param receiver the creator the value was forwarded to
 * @param name     the project's name at donation time
 * @param amount   value transferred
 * @param message  donor's message, 0–256 UTF-8 bytes
 * @param time     time of the donating call
 */
public record DonationMade(
        ProjectId id,
        Address donor,
        Address receiver,
        String name,
        BigInteger amount,
        String message,
        Instant time) {}
