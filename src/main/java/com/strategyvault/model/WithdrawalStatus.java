package com.strategyvault.model;

/**
 * Lifecycle of a queued withdrawal. PENDING -> COMPLETED is the only transition.
 */
public enum WithdrawalStatus {
    PENDING,
    COMPLETED
}
