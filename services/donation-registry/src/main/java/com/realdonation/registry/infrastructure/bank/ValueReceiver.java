package com.realdonation.registry.infrastructure.bank;

import com.realdonation.security.Address;

import java.math.BigInteger;

/**
 * Accept logic of an account that can refuse incoming value.
 * <p>
 * Runs on a bank worker thread with a deadline; returning {@code false}, throwing, or missing
 * the deadline all reject the transfer.
 */
@FunctionalInterface
public interface ValueReceiver {

    /**
     * @param from   the sending account
     * @param amount the value offered
     * @return whether the value is accepted
     */
    boolean accept(Address from, BigInteger amount);
}
