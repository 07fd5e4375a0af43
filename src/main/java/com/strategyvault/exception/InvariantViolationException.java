package com.strategyvault.exception;

/**
 * Allocation caps or the rebalance target invariant would be broken.
 */
public class InvariantViolationException extends VaultException {

    public InvariantViolationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public InvariantViolationException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
