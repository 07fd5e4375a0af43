package com.strategyvault.model;

/**
 * Capability shape of a strategy sub-account.
 */
public enum StrategyKind {
    /**
     * Exposes a share-like exchange rate: the vault holds units that convert to assets
     */
    CONVERTIBLE,

    /**
     * Plain asset balance held at the strategy account, no conversion
     */
    DIRECT
}
