package com.strategyvault.exception;

/**
 * The pool cannot serve the request in its current state (no shares, unknown or completed request, missing liquidity).
 */
public class InsufficientStateException extends VaultException {

    public InsufficientStateException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public InsufficientStateException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
