package com.strategyvault.event;

import java.time.Instant;

/**
 * Observable signal emitted by the vault after an operation commits.
 * Events are never part of the vault's state.
 */
public interface VaultEvent {

    VaultEventType type();

    Instant timestamp();

    /**
     * Holder the event concerns, or null for pool-wide events
     */
    default String holder() {
        return null;
    }

    /**
     * One-line human readable summary, used for logs and the event store
     */
    String describe();
}
