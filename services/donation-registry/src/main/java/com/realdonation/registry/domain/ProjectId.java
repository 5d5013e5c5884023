package com.realdonation.registry.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.realdonation.security.Address;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Fixed-size (32-byte) project identifier.
 * <p>
 * Ids are derived, never chosen: {@link #derive(Address, String, Instant)} hashes the creator's
 * address, the project name and the creation second with SHA-256 over the packed encoding
 * {@code creator(20) ‖ utf8(name) ‖ uint256(epochSecond)}. The same triple always yields the same
 * id; no uniqueness is enforced beyond that.
 */
public final class ProjectId {

    /** Width of an id in bytes. */
    public static final int LENGTH = 32;

    /** The all-zero id; never produced by derivation in practice. */
    public static final ProjectId ZERO = new ProjectId(new byte[LENGTH]);

    private static final HexFormat HEX = HexFormat.of();

    private final byte[] bytes;

    private ProjectId(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Derives the id of a project created by {@code creator} under {@code name} at {@code createTime}.
     * Sub-second precision of {@code createTime} is ignored.
     */
    public static ProjectId derive(Address creator, String name, Instant createTime) {
        MessageDigest digest = sha256();
        digest.update(creator.toBytes());
        digest.update(name.getBytes(StandardCharsets.UTF_8));
        digest.update(uint256(createTime.getEpochSecond()));
        return new ProjectId(digest.digest());
    }

    /**
     * Parses a {@code 0x}-prefixed, 64-digit hex string.
     *
     * @throws IllegalArgumentException if the text is not a well-formed id
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ProjectId parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Project id must not be null");
        }
        String trimmed = text.strip();
        if (!trimmed.startsWith("0x") && !trimmed.startsWith("0X")) {
            throw new IllegalArgumentException("Project id must start with 0x: " + text);
        }
        String digits = trimmed.substring(2);
        if (digits.length() != LENGTH * 2) {
            throw new IllegalArgumentException("Project id must have " + (LENGTH * 2) + " hex digits: " + text);
        }
        try {
            return new ProjectId(HEX.parseHex(digits.toLowerCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Project id is not valid hex: " + text, e);
        }
    }

    public boolean isZero() {
        return equals(ZERO);
    }

    @JsonValue
    public String toHex() {
        return "0x" + HEX.formatHex(bytes);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ProjectId other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }

    private static byte[] uint256(long value) {
        byte[] word = new byte[32];
        byte[] raw = BigInteger.valueOf(value).toByteArray();
        int copy = Math.min(raw.length, word.length);
        System.arraycopy(raw, raw.length - copy, word, word.length - copy, copy);
        return word;
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
