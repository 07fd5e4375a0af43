package com.strategyvault.service;

import com.strategyvault.asset.AssetLedger;
import com.strategyvault.config.VaultConfig;
import com.strategyvault.event.RebalanceCompletedEvent;
import com.strategyvault.exception.ExternalFailureException;
import com.strategyvault.exception.InvariantViolationException;
import com.strategyvault.exception.VaultException.ErrorCode;
import com.strategyvault.model.RebalanceLeg;
import com.strategyvault.model.RebalanceMovement;
import com.strategyvault.model.RebalanceMovement.Direction;
import com.strategyvault.model.RebalancePlan;
import com.strategyvault.model.RebalanceReport;
import com.strategyvault.model.StrategyAllocation;
import com.strategyvault.model.StrategyKind;
import com.strategyvault.model.StrategyValuation;
import com.strategyvault.strategy.ConvertibleStrategy;
import com.strategyvault.strategy.StrategyCalls;
import com.strategyvault.strategy.StrategyGateway;
import com.strategyvault.strategy.StrategyRegistry;
import com.strategyvault.util.VaultMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Moves capital between the idle balance and the active strategies so each strategy
 * holds its target share of the pool.
 *
 * <p>Targets come from one valuation snapshot taken before any strategy is called.
 * Excess is divested first, then shortfalls are funded from whatever idle balance is
 * not reserved for queued withdrawals, in registry order. Every external call is
 * checked against the vault's own asset balance afterwards.</p>
 *
 * <p>Callers must run {@link #rebalance()} inside an {@link OperationGuard} operation
 * so a failing leg rolls back the legs before it.</p>
 */
@Service
@Slf4j
public class Rebalancer {

    private final VaultConfig config;
    private final AssetLedger assetLedger;
    private final ValuationOracle oracle;
    private final StrategyRegistry registry;
    private final StrategyGateway gateway;
    private final WithdrawalQueue withdrawalQueue;
    private final OperationGuard guard;
    private final Clock clock;

    public Rebalancer(VaultConfig config, AssetLedger assetLedger, ValuationOracle oracle, StrategyRegistry registry,
                      StrategyGateway gateway, WithdrawalQueue withdrawalQueue, OperationGuard guard, Clock clock) {
        this.config = config;
        this.assetLedger = assetLedger;
        this.oracle = oracle;
        this.registry = registry;
        this.gateway = gateway;
        this.withdrawalQueue = withdrawalQueue;
        this.guard = guard;
        this.clock = clock;
    }

    /**
     * Compute divest and invest legs from a single valuation snapshot. Calls only view
     * methods on strategies.
     *
     * @throws InvariantViolationException if a direct strategy holds more than its target
     */
    public RebalancePlan plan() {
        BigInteger idle = oracle.idleBalance();
        List<StrategyValuation> valuations = oracle.activeValuations();
        BigInteger totalValue = valuations.stream().map(StrategyValuation::value).reduce(idle, BigInteger::add);
        BigInteger investable = VaultMath.subtractFloorZero(totalValue, withdrawalQueue.totalQueuedAssets());

        List<RebalanceLeg> divestments = new ArrayList<>();
        List<RebalanceLeg> investments = new ArrayList<>();
        for (StrategyValuation valuation : valuations) {
            StrategyAllocation strategy = valuation.strategy();
            BigInteger current = valuation.value();
            BigInteger target = VaultMath.bpsOf(investable, strategy.getAllocationBps());
            int cmp = current.compareTo(target);
            if (cmp > 0) {
                if (!strategy.isConvertible()) {
                    throw new InvariantViolationException(ErrorCode.DIRECT_DIVESTMENT_UNSUPPORTED,
                            String.format("Direct strategy #%d (%s) holds %s above its target %s and cannot be divested",
                                    strategy.getIndex(), strategy.getAddress(), current, target));
                }
                divestments.add(leg(strategy, current, target, current.subtract(target)));
            } else if (cmp < 0) {
                investments.add(leg(strategy, current, target, target.subtract(current)));
            }
        }
        return new RebalancePlan(totalValue, investable, idle, List.copyOf(divestments), List.copyOf(investments));
    }

    public RebalanceReport rebalance() {
        RebalancePlan plan = plan();
        log.info("Rebalancing on total value {} (investable {}): {} divestments, {} investments",
                plan.totalValue(), plan.investable(), plan.divestments().size(), plan.investments().size());

        List<RebalanceMovement> movements = new ArrayList<>();
        BigInteger divested = BigInteger.ZERO;
        for (RebalanceLeg leg : plan.divestments()) {
            RebalanceMovement movement = divest(leg);
            if (movement != null) {
                movements.add(movement);
                divested = divested.add(movement.assets());
            }
        }

        BigInteger available = VaultMath.subtractFloorZero(oracle.idleBalance(), withdrawalQueue.totalQueuedAssets());
        BigInteger invested = BigInteger.ZERO;
        for (RebalanceLeg leg : plan.investments()) {
            BigInteger amount = leg.amount().min(available);
            if (amount.signum() == 0) {
                log.debug("Strategy #{} short by {} but no idle balance is available", leg.strategyIndex(), leg.amount());
                continue;
            }
            movements.add(invest(leg, amount));
            available = available.subtract(amount);
            invested = invested.add(amount);
        }

        BigInteger idleAfter = oracle.idleBalance();
        Instant now = clock.instant();
        log.info("Rebalance completed: divested {}, invested {}, idle now {}", divested, invested, idleAfter);
        guard.emit(new RebalanceCompletedEvent(plan.totalValue(), divested, invested, idleAfter, now));
        return new RebalanceReport(plan, List.copyOf(movements), divested, invested, idleAfter, now);
    }

    /**
     * Redeem {@code units} from a convertible strategy back to the idle balance.
     *
     * @return assets received, verified against the vault's asset balance
     */
    public BigInteger redeemUnits(StrategyAllocation strategy, BigInteger units) {
        ConvertibleStrategy endpoint = gateway.resolve(strategy.getAddress());
        String vault = config.getAddress();
        BigInteger idleBefore = assetLedger.balanceOf(vault);
        BigInteger reported = StrategyCalls.invoke(strategy, "redeem", () -> endpoint.redeem(vault, units));
        BigInteger received = assetLedger.balanceOf(vault).subtract(idleBefore);
        if (received.compareTo(reported) != 0) {
            log.error("Strategy #{} ({}) reported {} assets for redeeming {} units but the vault received {}",
                    strategy.getIndex(), strategy.getAddress(), reported, units, received);
            throw new ExternalFailureException(ErrorCode.STRATEGY_INCONSISTENT,
                    String.format("Strategy %s reported %s assets redeemed but %s arrived", strategy.getAddress(), reported, received));
        }
        return received;
    }

    /**
     * Units of {@code strategy} currently held by the vault.
     */
    public BigInteger heldUnits(StrategyAllocation strategy) {
        ConvertibleStrategy endpoint = gateway.resolve(strategy.getAddress());
        return StrategyCalls.invoke(strategy, "balanceOf", () -> endpoint.balanceOf(config.getAddress()));
    }

    private RebalanceMovement divest(RebalanceLeg leg) {
        StrategyAllocation strategy = registry.get(leg.strategyIndex());
        ConvertibleStrategy endpoint = gateway.resolve(leg.address());
        BigInteger held = heldUnits(strategy);
        BigInteger wanted = StrategyCalls.invoke(strategy, "convertToShares", () -> endpoint.convertToShares(leg.amount()));
        // convertToShares floors; one more unit so the redemption covers the whole excess
        if (wanted.compareTo(held) < 0 && wanted.signum() > 0) {
            BigInteger floored = wanted;
            BigInteger covered = StrategyCalls.invoke(strategy, "convertToAssets", () -> endpoint.convertToAssets(floored));
            if (covered.compareTo(leg.amount()) < 0) {
                wanted = wanted.add(BigInteger.ONE);
            }
        }
        BigInteger units = wanted.min(held);
        if (units.signum() == 0) {
            log.debug("Strategy #{} excess {} rounds to zero units, skipping", leg.strategyIndex(), leg.amount());
            return null;
        }
        BigInteger assets = redeemUnits(strategy, units);
        log.debug("Divested {} assets ({} units) from strategy #{}", assets, units, leg.strategyIndex());
        return new RebalanceMovement(leg.strategyIndex(), leg.address(), Direction.DIVEST, assets, units);
    }

    private RebalanceMovement invest(RebalanceLeg leg, BigInteger amount) {
        String vault = config.getAddress();
        if (leg.kind() == StrategyKind.DIRECT) {
            if (!assetLedger.transfer(vault, leg.address(), amount)) {
                throw new ExternalFailureException(ErrorCode.ASSET_TRANSFER_FAILED,
                        "Asset transfer of " + amount + " to direct strategy " + leg.address() + " was refused");
            }
            log.debug("Transferred {} assets to direct strategy #{}", amount, leg.strategyIndex());
            return new RebalanceMovement(leg.strategyIndex(), leg.address(), Direction.INVEST, amount, amount);
        }

        StrategyAllocation strategy = registry.get(leg.strategyIndex());
        ConvertibleStrategy endpoint = gateway.resolve(leg.address());
        if (!assetLedger.approve(vault, leg.address(), amount)) {
            throw new ExternalFailureException(ErrorCode.ASSET_TRANSFER_FAILED,
                    "Approval of " + amount + " for strategy " + leg.address() + " was refused");
        }
        BigInteger idleBefore = assetLedger.balanceOf(vault);
        BigInteger units = StrategyCalls.invoke(strategy, "deposit", () -> endpoint.deposit(vault, amount));
        BigInteger sent = idleBefore.subtract(assetLedger.balanceOf(vault));
        if (!assetLedger.approve(vault, leg.address(), BigInteger.ZERO)) {
            throw new ExternalFailureException(ErrorCode.ASSET_TRANSFER_FAILED,
                    "Allowance reset for strategy " + leg.address() + " was refused");
        }
        if (sent.compareTo(amount) != 0) {
            log.error("Strategy #{} ({}) pulled {} assets on a deposit of {}", leg.strategyIndex(), leg.address(), sent, amount);
            throw new ExternalFailureException(ErrorCode.STRATEGY_INCONSISTENT,
                    String.format("Strategy %s pulled %s assets on a deposit of %s", leg.address(), sent, amount));
        }
        log.debug("Invested {} assets into strategy #{} for {} units", amount, leg.strategyIndex(), units);
        return new RebalanceMovement(leg.strategyIndex(), leg.address(), Direction.INVEST, amount, units);
    }

    private static RebalanceLeg leg(StrategyAllocation strategy, BigInteger current, BigInteger target, BigInteger amount) {
        return new RebalanceLeg(strategy.getIndex(), strategy.getAddress(), strategy.getKind(), current, target, amount);
    }
}
