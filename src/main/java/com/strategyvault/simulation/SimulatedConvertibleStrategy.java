package com.strategyvault.simulation;

import com.strategyvault.asset.AssetLedger;
import com.strategyvault.service.UndoJournal;
import com.strategyvault.strategy.ConvertibleStrategy;
import com.strategyvault.util.VaultMath;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * In-process convertible strategy. Holds its assets as a plain account on the asset
 * ledger and issues units pro rata; yield and loss change the asset balance and
 * therefore the unit price.
 */
@Slf4j
public class SimulatedConvertibleStrategy implements ConvertibleStrategy {

    private final String address;
    private final String name;
    private final AssetLedger assetLedger;
    private final UndoJournal journal;

    private final Map<String, BigInteger> units = new HashMap<>();
    private BigInteger totalUnits = BigInteger.ZERO;

    public SimulatedConvertibleStrategy(String address, String name, AssetLedger assetLedger, UndoJournal journal) {
        this.address = address;
        this.name = name;
        this.assetLedger = assetLedger;
        this.journal = journal;
    }

    @Override
    public String address() {
        return address;
    }

    public String name() {
        return name;
    }

    @Override
    public synchronized BigInteger deposit(String caller, BigInteger assets) {
        if (!VaultMath.isPositive(assets)) {
            throw new IllegalArgumentException("Deposit must be positive");
        }
        BigInteger issued = convertToShares(assets);
        if (!assetLedger.transferFrom(address, caller, address, assets)) {
            throw new IllegalStateException("Asset transfer from " + caller + " failed");
        }
        credit(caller, issued);
        log.debug("[{}] {} deposited {} assets for {} units", name, caller, assets, issued);
        return issued;
    }

    @Override
    public synchronized BigInteger redeem(String caller, BigInteger amount) {
        if (!VaultMath.isPositive(amount)) {
            throw new IllegalArgumentException("Redeem amount must be positive");
        }
        BigInteger held = balanceOf(caller);
        if (held.compareTo(amount) < 0) {
            throw new IllegalStateException(caller + " holds " + held + " units, cannot redeem " + amount);
        }
        BigInteger assets = convertToAssets(amount);
        debit(caller, amount);
        if (!assetLedger.transfer(address, caller, assets)) {
            throw new IllegalStateException("Asset transfer to " + caller + " failed");
        }
        log.debug("[{}] {} redeemed {} units for {} assets", name, caller, amount, assets);
        return assets;
    }

    @Override
    public synchronized BigInteger convertToAssets(BigInteger amount) {
        if (totalUnits.signum() == 0) {
            return amount;
        }
        return VaultMath.mulDivDown(amount, totalAssets(), totalUnits);
    }

    @Override
    public synchronized BigInteger convertToShares(BigInteger assets) {
        BigInteger total = totalAssets();
        if (totalUnits.signum() == 0 || total.signum() == 0) {
            return assets;
        }
        return VaultMath.mulDivDown(assets, totalUnits, total);
    }

    @Override
    public synchronized BigInteger balanceOf(String holder) {
        return units.getOrDefault(holder, BigInteger.ZERO);
    }

    public BigInteger totalAssets() {
        return assetLedger.balanceOf(address);
    }

    public synchronized BigInteger totalUnits() {
        return totalUnits;
    }

    /**
     * Grow the strategy's assets by {@code bps} basis points.
     *
     * @return assets added
     */
    public BigInteger simulateYield(int bps) {
        BigInteger gain = VaultMath.bpsOf(totalAssets(), bps);
        if (gain.signum() > 0) {
            assetLedger.mint(address, gain);
        }
        log.info("[{}] simulated yield of {} bps: +{}", name, bps, gain);
        return gain;
    }

    /**
     * Shrink the strategy's assets by {@code bps} basis points.
     *
     * @return assets removed
     */
    public BigInteger simulateLoss(int bps) {
        BigInteger loss = VaultMath.bpsOf(totalAssets(), Math.min(bps, VaultMath.BPS_DENOMINATOR.intValue()));
        if (loss.signum() > 0 && !assetLedger.burn(address, loss)) {
            throw new IllegalStateException("Could not burn " + loss + " from " + address);
        }
        log.info("[{}] simulated loss of {} bps: -{}", name, bps, loss);
        return loss;
    }

    private void credit(String holder, BigInteger amount) {
        setUnits(holder, balanceOf(holder).add(amount), totalUnits.add(amount));
    }

    private void debit(String holder, BigInteger amount) {
        setUnits(holder, balanceOf(holder).subtract(amount), totalUnits.subtract(amount));
    }

    private void setUnits(String holder, BigInteger balance, BigInteger newTotal) {
        BigInteger previousBalance = units.get(holder);
        BigInteger previousTotal = totalUnits;
        units.put(holder, balance);
        totalUnits = newTotal;
        journal.record(() -> {
            synchronized (this) {
                if (previousBalance == null) {
                    units.remove(holder);
                } else {
                    units.put(holder, previousBalance);
                }
                totalUnits = previousTotal;
            }
        });
    }
}
