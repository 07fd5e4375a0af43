package com.strategyvault.exception;

/**
 * A strategy or the asset ledger failed or returned an inconsistent result.
 */
public class ExternalFailureException extends VaultException {

    public ExternalFailureException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public ExternalFailureException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
