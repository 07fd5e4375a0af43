package com.strategyvault.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Registry entry for one strategy. Entries are appended and never removed;
 * the index is a stable handle.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class StrategyAllocation {

    private int index;
    private String address;
    private int allocationBps;
    private StrategyKind kind;

    // Informational only, lets operators anticipate queued withdrawals
    private boolean hasLockup;

    private boolean active;
    private Instant addedAt;
    private Instant removedAt;

    public boolean isConvertible() {
        return kind == StrategyKind.CONVERTIBLE;
    }

    public StrategyAllocation copy() {
        return toBuilder().build();
    }
}
