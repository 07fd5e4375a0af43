package com.strategyvault.service;

import com.strategyvault.event.ValuationChangedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;

/**
 * Last valuation snapshot, used only to report yield or loss between operations.
 * Never a source for conversions.
 */
@Component
@Slf4j
public class ValuationTracker {

    private final ValuationOracle oracle;
    private final UndoJournal journal;
    private final OperationGuard guard;
    private final Clock clock;

    private BigInteger cachedTotalValue;
    private Instant cachedAt;

    public ValuationTracker(ValuationOracle oracle, UndoJournal journal, OperationGuard guard, Clock clock) {
        this.oracle = oracle;
        this.journal = journal;
        this.guard = guard;
        this.clock = clock;
    }

    /**
     * Revalue the pool and report any change since the last snapshot.
     *
     * @return the fresh total value
     */
    public synchronized BigInteger accrue() {
        BigInteger current = oracle.totalValue();
        if (cachedTotalValue != null && current.compareTo(cachedTotalValue) != 0) {
            BigInteger delta = current.subtract(cachedTotalValue);
            Instant now = clock.instant();
            if (delta.signum() > 0) {
                log.info("Yield accrued: {} (total value {} -> {})", delta, cachedTotalValue, current);
            } else {
                log.warn("Loss recorded: {} (total value {} -> {})", delta.negate(), cachedTotalValue, current);
            }
            guard.emit(new ValuationChangedEvent(cachedTotalValue, current, delta, now));
        }
        store(current);
        return current;
    }

    /**
     * Store the post-operation value without reporting it: the difference is the
     * operation's own flow, not yield.
     */
    public synchronized void record(BigInteger totalValue) {
        store(totalValue);
    }

    public synchronized BigInteger cachedTotalValue() {
        return cachedTotalValue;
    }

    public synchronized Instant cachedAt() {
        return cachedAt;
    }

    private void store(BigInteger value) {
        BigInteger previousValue = cachedTotalValue;
        Instant previousAt = cachedAt;
        cachedTotalValue = value;
        cachedAt = clock.instant();
        journal.record(() -> {
            cachedTotalValue = previousValue;
            cachedAt = previousAt;
        });
    }
}
