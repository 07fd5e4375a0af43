package com.strategyvault.strategy;

import com.strategyvault.config.VaultConfig;
import com.strategyvault.event.StrategyAddedEvent;
import com.strategyvault.event.StrategyAllocationUpdatedEvent;
import com.strategyvault.event.StrategyRemovedEvent;
import com.strategyvault.exception.InvariantViolationException;
import com.strategyvault.exception.ValidationException;
import com.strategyvault.exception.VaultException.ErrorCode;
import com.strategyvault.model.StrategyAllocation;
import com.strategyvault.model.StrategyKind;
import com.strategyvault.service.OperationGuard;
import com.strategyvault.service.UndoJournal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered, append-only list of strategies with their target allocations.
 *
 * Invariants held after every mutation:
 * <ul>
 *   <li>each allocation is at most the configured per-strategy cap</li>
 *   <li>allocations of active strategies sum to at most 10000 bps</li>
 * </ul>
 * Indices are stable handles; removal only clears the active flag.
 */
@Component
@Slf4j
public class StrategyRegistry {

    public static final int MAX_TOTAL_BPS = 10_000;

    private final List<StrategyAllocation> strategies = new ArrayList<>();
    private final VaultConfig config;
    private final StrategyGateway gateway;
    private final UndoJournal journal;
    private final OperationGuard guard;
    private final Clock clock;

    public StrategyRegistry(VaultConfig config, StrategyGateway gateway, UndoJournal journal,
                            OperationGuard guard, Clock clock) {
        this.config = config;
        this.gateway = gateway;
        this.journal = journal;
        this.guard = guard;
        this.clock = clock;
    }

    public synchronized int addStrategy(String address, int allocationBps, StrategyKind kind, boolean hasLockup) {
        if (address == null || address.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_ADDRESS, "Strategy address is required");
        }
        if (kind == null) {
            throw new ValidationException(ErrorCode.UNSUPPORTED_STRATEGY_KIND, "Strategy kind is required");
        }
        if (allocationBps < 0) {
            throw new ValidationException(ErrorCode.NEGATIVE_AMOUNT, "Allocation cannot be negative: " + allocationBps);
        }
        if (address.equals(config.getAddress())) {
            throw new ValidationException(ErrorCode.INVALID_ADDRESS, "The vault cannot be its own strategy");
        }
        if (kind == StrategyKind.CONVERTIBLE && !gateway.isKnown(address)) {
            throw new ValidationException(ErrorCode.UNKNOWN_STRATEGY,
                    "No convertible strategy endpoint at address " + address);
        }
        // An address keeps its index for good; unwinding a removed entry redeems everything held there
        if (isRegistered(address)) {
            throw new ValidationException(ErrorCode.DUPLICATE_STRATEGY, "Strategy already registered: " + address);
        }
        checkCap(allocationBps);
        checkAggregate(totalActiveAllocationBps() + allocationBps);

        Instant now = clock.instant();
        StrategyAllocation entry = StrategyAllocation.builder()
                .index(strategies.size())
                .address(address)
                .allocationBps(allocationBps)
                .kind(kind)
                .hasLockup(hasLockup)
                .active(true)
                .addedAt(now)
                .build();
        strategies.add(entry);
        journal.record(() -> strategies.remove(entry));

        log.info("Strategy #{} added: address={}, kind={}, allocation={} bps, lockup={}",
                entry.getIndex(), address, kind, allocationBps, hasLockup);
        guard.emit(new StrategyAddedEvent(entry.getIndex(), address, allocationBps, kind, hasLockup, now));
        return entry.getIndex();
    }

    public synchronized void updateAllocation(int index, int newBps) {
        StrategyAllocation entry = entryAt(index);
        if (!entry.isActive()) {
            throw new ValidationException(ErrorCode.STRATEGY_INACTIVE, "Strategy #" + index + " is not active");
        }
        if (newBps < 0) {
            throw new ValidationException(ErrorCode.NEGATIVE_AMOUNT, "Allocation cannot be negative: " + newBps);
        }
        checkCap(newBps);
        int previousBps = entry.getAllocationBps();
        checkAggregate(totalActiveAllocationBps() - previousBps + newBps);

        entry.setAllocationBps(newBps);
        journal.record(() -> entry.setAllocationBps(previousBps));

        log.info("Strategy #{} allocation updated: {} -> {} bps", index, previousBps, newBps);
        guard.emit(new StrategyAllocationUpdatedEvent(index, entry.getAddress(), previousBps, newBps, clock.instant()));
    }

    /**
     * Deactivate a strategy. Calling it again on an inactive entry is a no-op.
     *
     * @return true if the entry was active before the call
     */
    public synchronized boolean removeStrategy(int index) {
        StrategyAllocation entry = entryAt(index);
        if (!entry.isActive()) {
            log.debug("Strategy #{} already inactive, nothing to remove", index);
            return false;
        }
        Instant now = clock.instant();
        entry.setActive(false);
        entry.setRemovedAt(now);
        journal.record(() -> {
            entry.setActive(true);
            entry.setRemovedAt(null);
        });

        log.info("Strategy #{} ({}) deactivated; its balance no longer counts toward total value", index, entry.getAddress());
        guard.emit(new StrategyRemovedEvent(index, entry.getAddress(), now));
        return true;
    }

    /**
     * Whether {@code address} belongs to any entry, active or removed.
     */
    public synchronized boolean isRegistered(String address) {
        return strategies.stream().anyMatch(s -> s.getAddress().equals(address));
    }

    public synchronized List<StrategyAllocation> strategies() {
        return strategies.stream().map(StrategyAllocation::copy).toList();
    }

    public synchronized List<StrategyAllocation> activeStrategies() {
        return strategies.stream().filter(StrategyAllocation::isActive).map(StrategyAllocation::copy).toList();
    }

    public synchronized StrategyAllocation get(int index) {
        return entryAt(index).copy();
    }

    public synchronized int size() {
        return strategies.size();
    }

    public synchronized int totalActiveAllocationBps() {
        return strategies.stream().filter(StrategyAllocation::isActive).mapToInt(StrategyAllocation::getAllocationBps).sum();
    }

    public int maxAllocationBps() {
        return config.getMaxAllocationBps();
    }

    private StrategyAllocation entryAt(int index) {
        if (index < 0 || index >= strategies.size()) {
            throw new ValidationException(ErrorCode.INVALID_INDEX,
                    "Strategy index " + index + " out of range (" + strategies.size() + " registered)");
        }
        return strategies.get(index);
    }

    private void checkCap(int bps) {
        if (bps > config.getMaxAllocationBps()) {
            throw new InvariantViolationException(ErrorCode.ALLOCATION_EXCEEDS_MAX,
                    String.format("Allocation %d bps exceeds the per-strategy cap of %d bps", bps, config.getMaxAllocationBps()));
        }
    }

    private void checkAggregate(int totalBps) {
        if (totalBps > MAX_TOTAL_BPS) {
            throw new InvariantViolationException(ErrorCode.TOTAL_ALLOCATION_INVALID,
                    String.format("Total active allocation would be %d bps (max %d)", totalBps, MAX_TOTAL_BPS));
        }
    }
}
