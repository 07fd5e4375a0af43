package com.strategyvault.event;

public enum VaultEventType {
    STRATEGY_ADDED,
    STRATEGY_ALLOCATION_UPDATED,
    STRATEGY_REMOVED,
    STRATEGY_UNWOUND,
    REBALANCE_COMPLETED,
    DEPOSITED,
    WITHDRAWN,
    WITHDRAWAL_QUEUED,
    WITHDRAWAL_COMPLETED,
    VALUATION_CHANGED,
    EMERGENCY_UNWIND,
    PAUSE_CHANGED
}
