package com.realdonation.security;

import java.util.Optional;

/**
 * Extracts the calling account's address from the {@value #HEADER} request header.
 * <p>
 * Every mutating call must identify its caller. Centralising the parsing keeps the accepted
 * format identical across the HTTP filter and the controllers.
 */
public final class CallerAddressExtractor {

    /** Header carrying the caller's address. */
    public static final String HEADER = "X-Caller-Address";

    private CallerAddressExtractor() {
        // utility class
    }

    /**
     * Parses the header value into an address.
     *
     * @param headerValue the raw header value (may be null)
     * @return the address, or empty if the header is missing, malformed or the zero address
     */
    public static Optional<Address> extract(String headerValue) {
        if (headerValue == null || headerValue.isBlank()) {
            return Optional.empty();
        }
        try {
            Address address = Address.parse(headerValue);
            return address.isZero() ? Optional.empty() : Optional.of(address);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * Parses the header value, failing when no usable caller is present.
     *
     * @throws IllegalArgumentException if the header is missing, malformed or the zero address
     */
    public static Address require(String headerValue) {
        return extract(headerValue).orElseThrow(() -> new IllegalArgumentException(
                "Missing or invalid " + HEADER + " header"));
    }
}
