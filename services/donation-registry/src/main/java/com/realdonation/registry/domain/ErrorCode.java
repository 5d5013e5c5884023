package com.realdonation.registry.domain;

/**
 * Failure taxonomy of the registry. Each failure carries the offending value.
 */
public enum ErrorCode {
    /** Caller is not allowed to perform the operation on this project; carries the caller. */
    ILLEGAL_CALLER("IllegalCaller"),
    /** A string is outside its byte-length bounds; carries the string. */
    INCORRECT_STRING_FORMAT("IncorrectStringFormat"),
    /** The project does not exist (name kept from the original event log); carries the id. */
    PROJECT_EXISTED("ProjectExisted"),
    /** The attached amount is not positive; carries the amount. */
    INSUFFICIENT_FUNDS("InsufficientFunds"),
    /** The value transfer to the creator failed; carries nothing. */
    TRANSACTION_FAILED("TransactionFailed");

    private final String value;

    ErrorCode(String value) {
        this.value = value;
    }

    /** Canonical error name as reported to callers. */
    public String value() {
        return value;
    }
}
