package com.realdonation.registry.domain;

import com.realdonation.security.Address;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

/**
 * Preconditions run before any registry mutation. Each guard throws
 * {@link DonationRegistryException} carrying the offending value.
 */
public final class RegistryGuards {

    public static final int NAME_MIN_BYTES = 1;
    public static final int NAME_MAX_BYTES = 64;
    public static final int DESCRIPTION_MAX_BYTES = 1024;
    public static final int MESSAGE_MAX_BYTES = 256;

    private RegistryGuards() {
        // utility class
    }

    /** Byte length bounds are inclusive and measured in UTF-8. */
    public static void requireLength(String value, int minBytes, int maxBytes) {
        int length = value.getBytes(StandardCharsets.UTF_8).length;
        if (length < minBytes || length > maxBytes) {
            throw DonationRegistryException.incorrectStringFormat(value);
        }
    }

    public static void requirePositive(BigInteger amount) {
        if (amount.signum() <= 0) {
            throw DonationRegistryException.insufficientFunds(amount);
        }
    }

    /** Fails unless {@code caller} is the stored creator; an absent project has no creator. */
    public static void requireCreator(Project project, Address caller) {
        if (!project.creator().equals(caller)) {
            throw DonationRegistryException.illegalCaller(caller);
        }
    }

    public static void requireNotCreator(Project project, Address caller) {
        if (project.creator().equals(caller)) {
            throw DonationRegistryException.illegalCaller(caller);
        }
    }

    /**
     * @param id      the id that was looked up (reported on failure)
     * @param project the stored record, {@link Project#EMPTY} when absent
     */
    public static void requireExists(ProjectId id, Project project) {
        if (!project.exists()) {
            throw DonationRegistryException.projectMissing(id);
        }
    }
}
