package com.strategyvault.service;

import com.strategyvault.asset.AssetLedger;
import com.strategyvault.config.VaultConfig;
import com.strategyvault.event.WithdrawalCompletedEvent;
import com.strategyvault.event.WithdrawalQueuedEvent;
import com.strategyvault.exception.ExternalFailureException;
import com.strategyvault.exception.InsufficientStateException;
import com.strategyvault.exception.VaultException.ErrorCode;
import com.strategyvault.model.WithdrawalRequest;
import com.strategyvault.model.WithdrawalStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Deferred settlement for withdrawals that idle liquidity could not cover.
 *
 * Requests are append-only per holder and addressed by their position in the holder's
 * list. {@code totalQueuedAssets} always equals the sum of assets owed by pending requests.
 */
@Component
@Slf4j
public class WithdrawalQueue {

    private final Map<String, List<WithdrawalRequest>> requestsByHolder = new HashMap<>();
    private BigInteger totalQueuedAssets = BigInteger.ZERO;

    private final VaultConfig config;
    private final AssetLedger assetLedger;
    private final UndoJournal journal;
    private final OperationGuard guard;
    private final Clock clock;

    public WithdrawalQueue(VaultConfig config, AssetLedger assetLedger, UndoJournal journal,
                           OperationGuard guard, Clock clock) {
        this.config = config;
        this.assetLedger = assetLedger;
        this.journal = journal;
        this.guard = guard;
        this.clock = clock;
    }

    /**
     * Record a claim whose shares the caller has already burned.
     *
     * @return the request id within the holder's queue
     */
    public synchronized int enqueue(String holder, BigInteger sharesBurned, BigInteger assetsOwed) {
        List<WithdrawalRequest> requests = requestsByHolder.computeIfAbsent(holder, k -> new ArrayList<>());
        Instant now = clock.instant();
        WithdrawalRequest request = WithdrawalRequest.builder()
                .requestId(requests.size())
                .holder(holder)
                .sharesBurned(sharesBurned)
                .assetsOwed(assetsOwed)
                .createdAt(now)
                .status(WithdrawalStatus.PENDING)
                .build();
        requests.add(request);
        BigInteger previousTotal = totalQueuedAssets;
        totalQueuedAssets = totalQueuedAssets.add(assetsOwed);
        journal.record(() -> {
            requests.remove(requests.size() - 1);
            totalQueuedAssets = previousTotal;
        });

        log.info("Withdrawal #{} queued for {}: {} shares burned, {} assets owed (queue total {})",
                request.getRequestId(), holder, sharesBurned, assetsOwed, totalQueuedAssets);
        guard.emit(new WithdrawalQueuedEvent(holder, sharesBurned, assetsOwed, request.getRequestId(), now));
        return request.getRequestId();
    }

    /**
     * Settle a pending request from idle balance.
     *
     * @return assets paid to the holder
     */
    public synchronized BigInteger complete(String holder, int requestId) {
        List<WithdrawalRequest> requests = requestsByHolder.getOrDefault(holder, List.of());
        if (requestId < 0 || requestId >= requests.size()) {
            throw new InsufficientStateException(ErrorCode.REQUEST_NOT_FOUND,
                    String.format("No withdrawal request #%d for %s", requestId, holder));
        }
        WithdrawalRequest request = requests.get(requestId);
        if (request.isCompleted()) {
            throw new InsufficientStateException(ErrorCode.REQUEST_ALREADY_COMPLETED,
                    String.format("Withdrawal request #%d for %s is already completed", requestId, holder));
        }
        BigInteger idle = assetLedger.balanceOf(config.getAddress());
        BigInteger owed = request.getAssetsOwed();
        if (idle.compareTo(owed) < 0) {
            throw new InsufficientStateException(ErrorCode.INSUFFICIENT_LIQUIDITY,
                    String.format("Idle balance %s cannot cover %s owed on request #%d; retry after a rebalance",
                            idle, owed, requestId));
        }

        Instant now = clock.instant();
        BigInteger previousTotal = totalQueuedAssets;
        request.setStatus(WithdrawalStatus.COMPLETED);
        request.setCompletedAt(now);
        totalQueuedAssets = totalQueuedAssets.subtract(owed);
        journal.record(() -> {
            request.setStatus(WithdrawalStatus.PENDING);
            request.setCompletedAt(null);
            totalQueuedAssets = previousTotal;
        });

        if (!assetLedger.transfer(config.getAddress(), holder, owed)) {
            throw new ExternalFailureException(ErrorCode.ASSET_TRANSFER_FAILED,
                    "Asset transfer of " + owed + " to " + holder + " was refused");
        }

        log.info("Withdrawal #{} completed for {}: {} assets paid (queue total {})", requestId, holder, owed, totalQueuedAssets);
        guard.emit(new WithdrawalCompletedEvent(holder, requestId, owed, now));
        return owed;
    }

    public synchronized List<WithdrawalRequest> requestsOf(String holder) {
        return requestsByHolder.getOrDefault(holder, List.of()).stream().map(WithdrawalRequest::copy).toList();
    }

    public synchronized BigInteger totalQueuedAssets() {
        return totalQueuedAssets;
    }

    /**
     * Recomputes the pending sum from the individual requests.
     */
    public synchronized BigInteger sumOfPendingClaims() {
        return requestsByHolder.values().stream()
                .flatMap(List::stream)
                .filter(r -> !r.isCompleted())
                .map(WithdrawalRequest::getAssetsOwed)
                .reduce(BigInteger.ZERO, BigInteger::add);
    }

    public synchronized long pendingCount() {
        return requestsByHolder.values().stream().flatMap(List::stream).filter(r -> !r.isCompleted()).count();
    }
}
