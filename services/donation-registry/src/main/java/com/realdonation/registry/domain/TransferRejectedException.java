package com.realdonation.registry.domain;

/**
 * Signals that a value transfer did not happen: the receiver refused or failed, did not answer
 * in time, or the sender could not cover the amount.
 */
public class TransferRejectedException extends Exception {

    public TransferRejectedException(String message) {
        super(message);
    }

    public TransferRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
