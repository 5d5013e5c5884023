package com.realdonation.registry.domain;

import com.realdonation.security.Address;

import java.math.BigInteger;

/**
 * Thrown when a registry operation is rejected. Nothing is changed and no event is emitted when
 * this is thrown.
 * <p>
 * Unchecked: every failure is caller-correctable and surfaces unchanged to the API layer, which
 * maps the {@link ErrorCode} to a response.
 */
public class DonationRegistryException extends RuntimeException {

    private final ErrorCode code;
    private final transient Object offendingValue;

    public DonationRegistryException(ErrorCode code, Object offendingValue) {
        this(code, offendingValue, null);
    }

    public DonationRegistryException(ErrorCode code, Object offendingValue, Throwable cause) {
        super("%s(%s)".formatted(code.value(), offendingValue == null ? "" : offendingValue), cause);
        this.code = code;
        this.offendingValue = offendingValue;
    }

    public static DonationRegistryException illegalCaller(Address caller) {
        return new DonationRegistryException(ErrorCode.ILLEGAL_CALLER, caller);
    }

    public static DonationRegistryException incorrectStringFormat(String value) {
        return new DonationRegistryException(ErrorCode.INCORRECT_STRING_FORMAT, value);
    }

    public static DonationRegistryException projectMissing(ProjectId id) {
        return new DonationRegistryException(ErrorCode.PROJECT_EXISTED, id);
    }

    public static DonationRegistryException insufficientFunds(BigInteger amount) {
        return new DonationRegistryException(ErrorCode.INSUFFICIENT_FUNDS, amount);
    }

    public static DonationRegistryException transactionFailed(Throwable cause) {
        return new DonationRegistryException(ErrorCode.TRANSACTION_FAILED, null, cause);
    }

    public ErrorCode code() {
        return code;
    }

    /** The value that caused the rejection; null for {@link ErrorCode#TRANSACTION_FAILED}. */
    public Object offendingValue() {
        return offendingValue;
    }
}
