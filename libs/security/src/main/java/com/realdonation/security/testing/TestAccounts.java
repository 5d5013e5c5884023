package com.realdonation.security.testing;

import com.realdonation.security.Address;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Deterministic test accounts, in the spirit of a local development chain's pre-funded signers.
 * <p>
 * Placed in {@code src/main} so other modules can use it from their test scope through a regular
 * Maven dependency. Package {@code testing} signals "for tests only."
 */
public final class TestAccounts {

    /** Account reserved for deployment; never creates or donates in fixtures. */
    public static final Address DEPLOYER = account(0);

    /** Default project creator. */
    public static final Address CREATOR = account(1);

    /** Default donor. */
    public static final Address DONOR = account(2);

    private TestAccounts() {
        // utility class
    }

    /**
     * Returns the n-th deterministic account. Index 0 is {@link #DEPLOYER}.
     *
     * @param index non-negative account index
     */
    public static Address account(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0");
        }
        byte[] bytes = new byte[Address.LENGTH];
        bytes[0] = (byte) 0xA0;
        ByteBuffer.wrap(bytes, Address.LENGTH - Integer.BYTES, Integer.BYTES).putInt(index + 1);
        return Address.of(bytes);
    }

    /** Returns accounts {@code 3 .. 3+count-1}, which play no default role. */
    public static List<Address> others(int count) {
        return IntStream.range(3, 3 + count).mapToObj(TestAccounts::account).toList();
    }
}
