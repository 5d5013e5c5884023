package com.realdonation.registry.domain;

import com.realdonation.security.Address;

import java.math.BigInteger;

/**
 * Moves native value between accounts. Implementations must either move the full amount or
 * nothing, and must not block indefinitely.
 */
public interface ValueTransfer {

    /**
     * Transfers {@code amount} from {@code from} to {@code to}.
     *
     * @throws TransferRejectedException if the value could not be moved; no balance changed
     */
    void transfer(Address from, Address to, BigInteger amount) throws TransferRejectedException;
}
