package com.strategyvault.service;

import com.strategyvault.asset.AssetLedger;
import com.strategyvault.config.VaultConfig;
import com.strategyvault.event.DepositedEvent;
import com.strategyvault.event.EmergencyUnwindEvent;
import com.strategyvault.event.StrategyUnwoundEvent;
import com.strategyvault.event.WithdrawnEvent;
import com.strategyvault.exception.ExternalFailureException;
import com.strategyvault.exception.InvariantViolationException;
import com.strategyvault.exception.ValidationException;
import com.strategyvault.exception.VaultException.ErrorCode;
import com.strategyvault.model.EmergencyUnwindReport;
import com.strategyvault.model.RebalanceMovement;
import com.strategyvault.model.RebalanceMovement.Direction;
import com.strategyvault.model.RebalancePlan;
import com.strategyvault.model.RebalanceReport;
import com.strategyvault.model.StrategyAllocation;
import com.strategyvault.model.StrategyKind;
import com.strategyvault.model.VaultMetrics;
import com.strategyvault.model.WithdrawalOutcome;
import com.strategyvault.model.WithdrawalRequest;
import com.strategyvault.strategy.StrategyRegistry;
import com.strategyvault.util.VaultMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for every pool operation.
 *
 * <p>Each balance-affecting call runs as one {@link OperationGuard} operation: the cached
 * valuation is accrued first (reporting yield or loss since the previous call), the
 * operation's changes are applied, and the post-operation value is recorded. Any failure
 * leaves shares, balances, registry and queue exactly as they were.</p>
 *
 * <p>Share price is based on the net asset value: total value minus assets already owed
 * to queued withdrawals.</p>
 */
@Service
@Slf4j
public class MultiStrategyVault {

    private final VaultConfig config;
    private final AssetLedger assetLedger;
    private final ShareLedger shareLedger;
    private final StrategyRegistry registry;
    private final ValuationOracle oracle;
    private final ValuationTracker valuationTracker;
    private final Rebalancer rebalancer;
    private final WithdrawalQueue withdrawalQueue;
    private final VaultPauseState pauseState;
    private final OperationGuard guard;
    private final Clock clock;

    public MultiStrategyVault(VaultConfig config, AssetLedger assetLedger, ShareLedger shareLedger,
                              StrategyRegistry registry, ValuationOracle oracle, ValuationTracker valuationTracker,
                              Rebalancer rebalancer, WithdrawalQueue withdrawalQueue, VaultPauseState pauseState,
                              OperationGuard guard, Clock clock) {
        this.config = config;
        this.assetLedger = assetLedger;
        this.shareLedger = shareLedger;
        this.registry = registry;
        this.oracle = oracle;
        this.valuationTracker = valuationTracker;
        this.rebalancer = rebalancer;
        this.withdrawalQueue = withdrawalQueue;
        this.pauseState = pauseState;
        this.guard = guard;
        this.clock = clock;
    }

    // ==================== DEPOSITS ====================

    /**
     * Pull {@code assets} from the caller and mint shares to {@code receiver}, rounded down.
     *
     * @return shares minted
     */
    public BigInteger deposit(String caller, BigInteger assets, String receiver) {
        return guard.execute("deposit", () -> {
            pauseState.requireNotPaused();
            requirePositive(assets, "Deposit amount");
            requirePayer(caller);
            requireAccount(receiver, "Receiver");

            BigInteger nav = netAssetValue(valuationTracker.accrue());
            BigInteger shares = shareLedger.sharesForDeposit(assets, nav);
            if (shares.signum() == 0) {
                throw new ValidationException(ErrorCode.ZERO_AMOUNT,
                        "Deposit of " + assets + " is too small to mint a share");
            }
            pullAssets(caller, assets);
            shareLedger.mint(receiver, shares);

            log.info("Deposit: {} paid {} assets, {} shares minted to {}", caller, assets, shares, receiver);
            guard.emit(new DepositedEvent(caller, receiver, assets, shares, clock.instant()));
            valuationTracker.record(oracle.totalValue());
            return shares;
        });
    }

    /**
     * Mint exactly {@code shares} to {@code receiver}, charging the caller the asset cost rounded up.
     *
     * @return assets charged
     */
    public BigInteger mint(String caller, BigInteger shares, String receiver) {
        return guard.execute("mint", () -> {
            pauseState.requireNotPaused();
            requirePositive(shares, "Share amount");
            requirePayer(caller);
            requireAccount(receiver, "Receiver");

            BigInteger nav = netAssetValue(valuationTracker.accrue());
            BigInteger assets = shareLedger.assetsForMint(shares, nav);
            pullAssets(caller, assets);
            shareLedger.mint(receiver, shares);

            log.info("Mint: {} paid {} assets, {} shares minted to {}", caller, assets, shares, receiver);
            guard.emit(new DepositedEvent(caller, receiver, assets, shares, clock.instant()));
            valuationTracker.record(oracle.totalValue());
            return assets;
        });
    }

    // ==================== WITHDRAWALS ====================

    /**
     * Withdraw exactly {@code assets} for {@code owner}, burning shares rounded up.
     * Paid to {@code receiver} right away when unreserved idle balance covers it,
     * otherwise queued for {@code owner}.
     */
    public WithdrawalOutcome withdraw(String caller, BigInteger assets, String receiver, String owner) {
        return guard.execute("withdraw", () -> {
            pauseState.requireNotPaused();
            requirePositive(assets, "Withdrawal amount");
            requireAccount(caller, "Caller");
            requireAccount(receiver, "Receiver");
            requireAccount(owner, "Owner");

            BigInteger nav = netAssetValue(valuationTracker.accrue());
            BigInteger shares = shareLedger.sharesForWithdraw(assets, nav);
            return settle(caller, receiver, owner, shares, assets);
        });
    }

    /**
     * Redeem exactly {@code shares} of {@code owner} for assets rounded down.
     */
    public WithdrawalOutcome redeem(String caller, BigInteger shares, String receiver, String owner) {
        return guard.execute("redeem", () -> {
            pauseState.requireNotPaused();
            requirePositive(shares, "Share amount");
            requireAccount(caller, "Caller");
            requireAccount(receiver, "Receiver");
            requireAccount(owner, "Owner");

            BigInteger nav = netAssetValue(valuationTracker.accrue());
            BigInteger assets = shareLedger.assetsForRedeem(shares, nav);
            if (assets.signum() == 0) {
                throw new ValidationException(ErrorCode.ZERO_AMOUNT,
                        "Redeeming " + shares + " shares yields no assets");
            }
            return settle(caller, receiver, owner, shares, assets);
        });
    }

    /**
     * Pay out a queued withdrawal once idle balance covers it.
     *
     * @return assets paid to the holder
     */
    public BigInteger completeWithdrawal(String holder, int requestId) {
        return guard.execute("completeWithdrawal", () -> {
            requireAccount(holder, "Holder");
            valuationTracker.accrue();
            BigInteger paid = withdrawalQueue.complete(holder, requestId);
            valuationTracker.record(oracle.totalValue());
            return paid;
        });
    }

    public List<WithdrawalRequest> pendingWithdrawals(String holder) {
        return guard.read(() -> withdrawalQueue.requestsOf(holder));
    }

    // ==================== STRATEGIES ====================

    public int addStrategy(String address, int allocationBps, StrategyKind kind, boolean hasLockup) {
        return guard.execute("addStrategy", () -> {
            valuationTracker.accrue();
            int index = registry.addStrategy(address, allocationBps, kind, hasLockup);
            valuationTracker.record(oracle.totalValue());
            return index;
        });
    }

    public void updateAllocation(int index, int allocationBps) {
        guard.run("updateAllocation", () -> registry.updateAllocation(index, allocationBps));
    }

    public boolean removeStrategy(int index) {
        return guard.execute("removeStrategy", () -> {
            valuationTracker.accrue();
            boolean removed = registry.removeStrategy(index);
            // Its balance no longer counts; not a loss
            valuationTracker.record(oracle.totalValue());
            return removed;
        });
    }

    public List<StrategyAllocation> listStrategies() {
        return registry.strategies();
    }

    public RebalanceReport rebalance() {
        return guard.execute("rebalance", () -> {
            pauseState.requireNotPaused();
            valuationTracker.accrue();
            RebalanceReport report = rebalancer.rebalance();
            valuationTracker.record(oracle.totalValue());
            return report;
        });
    }

    /**
     * The legs a rebalance would execute now, without calling any mutating strategy method.
     */
    public RebalancePlan previewRebalance() {
        return guard.read(rebalancer::plan);
    }

    /**
     * Redeem every unit the vault holds in one convertible strategy back to idle balance.
     * Used to recover funds from a deactivated strategy.
     */
    public RebalanceMovement unwindStrategy(int index) {
        return guard.execute("unwindStrategy", () -> {
            StrategyAllocation strategy = registry.get(index);
            if (!strategy.isConvertible()) {
                throw new InvariantViolationException(ErrorCode.DIRECT_DIVESTMENT_UNSUPPORTED,
                        "Direct strategy #" + index + " cannot be unwound by the vault");
            }
            valuationTracker.accrue();
            BigInteger units = rebalancer.heldUnits(strategy);
            BigInteger assets = units.signum() == 0 ? BigInteger.ZERO : rebalancer.redeemUnits(strategy, units);

            log.info("Strategy #{} ({}) unwound: {} units redeemed for {} assets", index, strategy.getAddress(), units, assets);
            guard.emit(new StrategyUnwoundEvent(index, strategy.getAddress(), units, assets, clock.instant()));
            valuationTracker.record(oracle.totalValue());
            return new RebalanceMovement(index, strategy.getAddress(), Direction.DIVEST, assets, units);
        });
    }

    // ==================== ADMIN ====================

    public void pause(String actor) {
        guard.run("pause", () -> pauseState.pause(actor));
    }

    public void unpause(String actor) {
        guard.run("unpause", () -> pauseState.unpause(actor));
    }

    public boolean isPaused() {
        return pauseState.isPaused();
    }

    /**
     * Redeem the vault's full position in every convertible strategy, active or not.
     * Only allowed while paused. Direct strategies holding assets are reported as skipped.
     * A single failing redemption aborts the whole unwind.
     */
    public EmergencyUnwindReport emergencyWithdrawAll() {
        return guard.execute("emergencyWithdrawAll", () -> {
            pauseState.requirePaused();
            valuationTracker.accrue();

            List<RebalanceMovement> movements = new ArrayList<>();
            List<String> skipped = new ArrayList<>();
            BigInteger recovered = BigInteger.ZERO;
            for (StrategyAllocation strategy : registry.strategies()) {
                if (!strategy.isConvertible()) {
                    if (assetLedger.balanceOf(strategy.getAddress()).signum() > 0) {
                        skipped.add(strategy.getAddress());
                    }
                    continue;
                }
                BigInteger units = rebalancer.heldUnits(strategy);
                if (units.signum() == 0) {
                    continue;
                }
                BigInteger assets = rebalancer.redeemUnits(strategy, units);
                movements.add(new RebalanceMovement(strategy.getIndex(), strategy.getAddress(), Direction.DIVEST, assets, units));
                recovered = recovered.add(assets);
            }

            BigInteger idleAfter = oracle.idleBalance();
            if (skipped.isEmpty()) {
                log.warn("Emergency unwind recovered {} assets, idle now {}", recovered, idleAfter);
            } else {
                log.warn("Emergency unwind recovered {} assets, idle now {}; direct strategies not unwound: {}",
                        recovered, idleAfter, skipped);
            }
            guard.emit(new EmergencyUnwindEvent(recovered, List.copyOf(skipped), clock.instant()));
            valuationTracker.record(oracle.totalValue());
            return new EmergencyUnwindReport(recovered, List.copyOf(movements), List.copyOf(skipped), idleAfter);
        });
    }

    // ==================== SHARES ====================

    public void approveShares(String owner, String spender, BigInteger shares) {
        guard.run("approveShares", () -> {
            requireAccount(owner, "Owner");
            requireAccount(spender, "Spender");
            if (shares == null || shares.signum() < 0) {
                throw new ValidationException(ErrorCode.NEGATIVE_AMOUNT, "Share allowance cannot be negative");
            }
            shareLedger.approve(owner, spender, shares);
        });
    }

    public BigInteger shareBalanceOf(String holder) {
        return shareLedger.balanceOf(holder);
    }

    public BigInteger shareAllowance(String owner, String spender) {
        return shareLedger.allowance(owner, spender);
    }

    public BigInteger totalShares() {
        return shareLedger.totalShares();
    }

    // ==================== VALUATION ====================

    // Views read through guard.read so a concurrent operation is seen whole or not at all

    public BigInteger totalValue() {
        return guard.read(oracle::totalValue);
    }

    public BigInteger netAssetValue() {
        return guard.read(() -> netAssetValue(oracle.totalValue()));
    }

    /**
     * Assets {@code shares} would redeem for right now, rounded down.
     */
    public BigInteger convertToAssets(BigInteger shares) {
        requireNotNegative(shares, "Share amount");
        return guard.read(() -> shareLedger.totalShares().signum() == 0
                ? shares
                : shareLedger.assetsForRedeem(shares, netAssetValue(oracle.totalValue())));
    }

    public BigInteger convertToShares(BigInteger assets) {
        requireNotNegative(assets, "Asset amount");
        return guard.read(() -> shareLedger.sharesForDeposit(assets, netAssetValue(oracle.totalValue())));
    }

    public BigInteger previewDeposit(BigInteger assets) {
        requirePositive(assets, "Deposit amount");
        return guard.read(() -> shareLedger.sharesForDeposit(assets, netAssetValue(oracle.totalValue())));
    }

    public BigInteger previewMint(BigInteger shares) {
        requirePositive(shares, "Share amount");
        return guard.read(() -> shareLedger.assetsForMint(shares, netAssetValue(oracle.totalValue())));
    }

    public BigInteger previewWithdraw(BigInteger assets) {
        requirePositive(assets, "Withdrawal amount");
        return guard.read(() -> shareLedger.sharesForWithdraw(assets, netAssetValue(oracle.totalValue())));
    }

    public BigInteger previewRedeem(BigInteger shares) {
        requirePositive(shares, "Share amount");
        return guard.read(() -> shareLedger.assetsForRedeem(shares, netAssetValue(oracle.totalValue())));
    }

    public VaultMetrics metrics() {
        return guard.read(this::snapshotMetrics);
    }

    private VaultMetrics snapshotMetrics() {
        BigInteger totalValue = oracle.totalValue();
        BigInteger totalShares = shareLedger.totalShares();
        BigInteger nav = netAssetValue(totalValue);
        BigInteger oneShare = VaultMath.unit(config.getAssetDecimals());
        BigInteger pricePerShare = totalShares.signum() == 0
                ? oneShare
                : shareLedger.assetsForRedeem(oneShare, nav);

        return VaultMetrics.builder()
                .totalValue(totalValue)
                .totalShares(totalShares)
                .pricePerShare(pricePerShare)
                .totalQueued(withdrawalQueue.totalQueuedAssets())
                .idleBalance(oracle.idleBalance())
                .netAssetValue(nav)
                .activeStrategies(registry.activeStrategies().size())
                .totalAllocationBps(registry.totalActiveAllocationBps())
                .paused(pauseState.isPaused())
                .lastValuation(valuationTracker.cachedTotalValue())
                .lastValuationAt(valuationTracker.cachedAt())
                .build();
    }

    // ==================== INTERNALS ====================

    private WithdrawalOutcome settle(String caller, String receiver, String owner, BigInteger shares, BigInteger assets) {
        if (!caller.equals(owner)) {
            shareLedger.spendAllowance(owner, caller, shares);
        }
        shareLedger.burn(owner, shares);

        BigInteger available = VaultMath.subtractFloorZero(oracle.idleBalance(), withdrawalQueue.totalQueuedAssets());
        WithdrawalOutcome outcome;
        if (available.compareTo(assets) >= 0) {
            if (!assetLedger.transfer(config.getAddress(), receiver, assets)) {
                throw new ExternalFailureException(ErrorCode.ASSET_TRANSFER_FAILED,
                        "Asset transfer of " + assets + " to " + receiver + " was refused");
            }
            log.info("Withdrawal settled: {} shares of {} burned, {} assets paid to {}", shares, owner, assets, receiver);
            guard.emit(new WithdrawnEvent(caller, receiver, owner, assets, shares, clock.instant()));
            outcome = WithdrawalOutcome.immediate(owner, receiver, shares, assets);
        } else {
            log.info("Idle balance {} (unreserved {}) cannot cover {}; queueing for {}",
                    oracle.idleBalance(), available, assets, owner);
            int requestId = withdrawalQueue.enqueue(owner, shares, assets);
            outcome = WithdrawalOutcome.queued(owner, shares, assets, requestId);
        }
        valuationTracker.record(oracle.totalValue());
        return outcome;
    }

    private void pullAssets(String from, BigInteger assets) {
        if (!assetLedger.transferFrom(config.getAddress(), from, config.getAddress(), assets)) {
            throw new ExternalFailureException(ErrorCode.ASSET_TRANSFER_FAILED,
                    String.format("Could not pull %s %s from %s; check balance and approval",
                            assets, assetLedger.symbol(), from));
        }
    }

    private BigInteger netAssetValue(BigInteger totalValue) {
        return VaultMath.subtractFloorZero(totalValue, withdrawalQueue.totalQueuedAssets());
    }

    private static void requirePositive(BigInteger amount, String what) {
        if (amount == null || amount.signum() == 0) {
            throw new ValidationException(ErrorCode.ZERO_AMOUNT, what + " must be greater than zero");
        }
        if (amount.signum() < 0) {
            throw new ValidationException(ErrorCode.NEGATIVE_AMOUNT, what + " cannot be negative");
        }
    }

    /**
     * Assets must come from outside the pool: a transfer from the vault or one of its
     * strategies to the vault adds no value.
     */
    private void requirePayer(String caller) {
        requireAccount(caller, "Caller");
        if (caller.equals(config.getAddress()) || registry.isRegistered(caller)) {
            throw new ValidationException(ErrorCode.INVALID_ADDRESS,
                    "Caller " + caller + " is the vault or one of its strategies and cannot fund a deposit");
        }
    }

    private static void requireNotNegative(BigInteger amount, String what) {
        if (amount == null || amount.signum() < 0) {
            throw new ValidationException(ErrorCode.NEGATIVE_AMOUNT, what + " cannot be negative");
        }
    }

    private static void requireAccount(String account, String what) {
        if (account == null || account.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_ADDRESS, what + " address is required");
        }
    }
}
