package com.strategyvault.exception;

/**
 * Base exception for every rejected vault operation.
 * Carries a structured error code so the REST layer can map it to a status.
 */
public class VaultException extends RuntimeException {

    public enum Category {
        VALIDATION,
        INVARIANT_VIOLATION,
        INSUFFICIENT_STATE,
        EXTERNAL_FAILURE,
        ACCESS_DENIED,
        PAUSED
    }

    public enum ErrorCode {
        // Validation
        ZERO_AMOUNT(Category.VALIDATION),
        NEGATIVE_AMOUNT(Category.VALIDATION),
        INVALID_ADDRESS(Category.VALIDATION),
        INVALID_INDEX(Category.VALIDATION),
        UNKNOWN_STRATEGY(Category.VALIDATION),
        DUPLICATE_STRATEGY(Category.VALIDATION),
        STRATEGY_INACTIVE(Category.VALIDATION),
        UNSUPPORTED_STRATEGY_KIND(Category.VALIDATION),

        // Invariant violations
        ALLOCATION_EXCEEDS_MAX(Category.INVARIANT_VIOLATION),
        TOTAL_ALLOCATION_INVALID(Category.INVARIANT_VIOLATION),
        DIRECT_DIVESTMENT_UNSUPPORTED(Category.INVARIANT_VIOLATION),

        // Insufficient state
        NO_SHARES(Category.INSUFFICIENT_STATE),
        POOL_HAS_NO_VALUE(Category.INSUFFICIENT_STATE),
        INSUFFICIENT_SHARES(Category.INSUFFICIENT_STATE),
        INSUFFICIENT_ALLOWANCE(Category.INSUFFICIENT_STATE),
        REQUEST_NOT_FOUND(Category.INSUFFICIENT_STATE),
        REQUEST_ALREADY_COMPLETED(Category.INSUFFICIENT_STATE),
        INSUFFICIENT_LIQUIDITY(Category.INSUFFICIENT_STATE),
        REENTRANT_CALL(Category.INSUFFICIENT_STATE),

        // External failures
        ASSET_TRANSFER_FAILED(Category.EXTERNAL_FAILURE),
        STRATEGY_CALL_FAILED(Category.EXTERNAL_FAILURE),
        STRATEGY_INCONSISTENT(Category.EXTERNAL_FAILURE),

        ACCESS_DENIED(Category.ACCESS_DENIED),

        VAULT_PAUSED(Category.PAUSED),
        VAULT_NOT_PAUSED(Category.PAUSED);

        private final Category category;

        ErrorCode(Category category) {
            this.category = category;
        }

        public Category getCategory() {
            return category;
        }
    }

    private final ErrorCode errorCode;

    public VaultException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public VaultException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public Category getCategory() {
        return errorCode.getCategory();
    }
}
