package com.strategyvault.exception;

/**
 * Bad input rejected before any state change (bad index, blank address, zero amount).
 */
public class ValidationException extends VaultException {

    public ValidationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public ValidationException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
