package com.realdonation.security;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Locale;

/**
 * A caller identity: an opaque, fixed-width 20-byte account address.
 * <p>
 * Addresses carry no behavior; they are compared by value and rendered as {@code 0x}-prefixed
 * lower-case hex. The all-zero {@link #ZERO} address stands for "no account" and is never a
 * valid caller.
 */
public final class Address {

    /** Width of an address in bytes. */
    public static final int LENGTH = 20;

    /** The zero address, marking an absent owner. */
    public static final Address ZERO = new Address(new byte[LENGTH]);

    private static final HexFormat HEX = HexFormat.of();

    private final byte[] bytes;

    private Address(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Wraps a raw 20-byte value.
     *
     * @throws IllegalArgumentException if {@code bytes} is not exactly 20 bytes long
     */
    public static Address of(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Address must be exactly " + LENGTH + " bytes");
        }
        return new Address(bytes.clone());
    }

    /**
     * Parses a {@code 0x}-prefixed, 40-digit hex string (case-insensitive).
     *
     * @throws IllegalArgumentException if the text is not a well-formed address
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Address parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Address must not be null");
        }
        String trimmed = text.strip();
        if (!trimmed.startsWith("0x") && !trimmed.startsWith("0X")) {
            throw new IllegalArgumentException("Address must start with 0x: " + text);
        }
        String digits = trimmed.substring(2);
        if (digits.length() != LENGTH * 2) {
            throw new IllegalArgumentException("Address must have " + (LENGTH * 2) + " hex digits: " + text);
        }
        try {
            return new Address(HEX.parseHex(digits.toLowerCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Address is not valid hex: " + text, e);
        }
    }

    /** Returns a copy of the raw bytes. */
    public byte[] toBytes() {
        return bytes.clone();
    }

    /** True for the all-zero address. */
    public boolean isZero() {
        return equals(ZERO);
    }

    @JsonValue
    public String toHex() {
        return "0x" + HEX.formatHex(bytes);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Address other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
