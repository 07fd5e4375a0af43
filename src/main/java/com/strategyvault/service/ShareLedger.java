package com.strategyvault.service;

import com.strategyvault.exception.InsufficientStateException;
import com.strategyvault.exception.ValidationException;
import com.strategyvault.exception.VaultException.ErrorCode;
import com.strategyvault.util.VaultMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Share supply, per-holder balances and share allowances, plus the asset/share conversion law.
 *
 * Conversions take the pool's net asset value as an argument so a whole operation can use
 * one valuation snapshot. Every conversion rounds in favour of the pool: shares issued and
 * assets paid round down, shares burned and assets charged round up.
 */
@Component
@Slf4j
public class ShareLedger {

    private final UndoJournal journal;

    private final Map<String, BigInteger> balances = new HashMap<>();
    // owner -> spender -> shares
    private final Map<String, Map<String, BigInteger>> allowances = new HashMap<>();
    private BigInteger totalShares = BigInteger.ZERO;

    public ShareLedger(UndoJournal journal) {
        this.journal = journal;
    }

    // ==================== CONVERSION ====================

    /**
     * Shares issued for a deposit of {@code assets}, rounded down. 1:1 while no shares exist.
     */
    public synchronized BigInteger sharesForDeposit(BigInteger assets, BigInteger netAssetValue) {
        if (totalShares.signum() == 0) {
            return assets;
        }
        requireValue(netAssetValue);
        return VaultMath.mulDivDown(assets, totalShares, netAssetValue);
    }

    /**
     * Assets charged to mint {@code shares}, rounded up. 1:1 while no shares exist.
     */
    public synchronized BigInteger assetsForMint(BigInteger shares, BigInteger netAssetValue) {
        if (totalShares.signum() == 0) {
            return shares;
        }
        requireValue(netAssetValue);
        return VaultMath.mulDivUp(shares, netAssetValue, totalShares);
    }

    /**
     * Shares burned to withdraw exactly {@code assets}, rounded up.
     */
    public synchronized BigInteger sharesForWithdraw(BigInteger assets, BigInteger netAssetValue) {
        requireShares();
        requireValue(netAssetValue);
        return VaultMath.mulDivUp(assets, totalShares, netAssetValue);
    }

    /**
     * Assets paid for redeeming {@code shares}, rounded down.
     */
    public synchronized BigInteger assetsForRedeem(BigInteger shares, BigInteger netAssetValue) {
        requireShares();
        return VaultMath.mulDivDown(shares, netAssetValue, totalShares);
    }

    // ==================== BALANCES ====================

    public synchronized BigInteger totalShares() {
        return totalShares;
    }

    public synchronized BigInteger balanceOf(String holder) {
        return balances.getOrDefault(holder, BigInteger.ZERO);
    }

    public synchronized Map<String, BigInteger> holders() {
        return Map.copyOf(balances);
    }

    public synchronized void mint(String to, BigInteger shares) {
        requireHolder(to);
        BigInteger previousTotal = totalShares;
        setBalance(to, balanceOf(to).add(shares));
        totalShares = totalShares.add(shares);
        journal.record(() -> totalShares = previousTotal);
        log.debug("Minted {} shares to {} (supply {})", shares, to, totalShares);
    }

    public synchronized void burn(String from, BigInteger shares) {
        BigInteger balance = balanceOf(from);
        if (balance.compareTo(shares) < 0) {
            throw new InsufficientStateException(ErrorCode.INSUFFICIENT_SHARES,
                    String.format("%s holds %s shares, %s required", from, balance, shares));
        }
        BigInteger previousTotal = totalShares;
        setBalance(from, balance.subtract(shares));
        totalShares = totalShares.subtract(shares);
        journal.record(() -> totalShares = previousTotal);
        log.debug("Burned {} shares of {} (supply {})", shares, from, totalShares);
    }

    // ==================== ALLOWANCES ====================

    public synchronized BigInteger allowance(String owner, String spender) {
        return allowances.getOrDefault(owner, Map.of()).getOrDefault(spender, BigInteger.ZERO);
    }

    public synchronized void approve(String owner, String spender, BigInteger shares) {
        requireHolder(owner);
        requireHolder(spender);
        if (shares == null || shares.signum() < 0) {
            throw new ValidationException(ErrorCode.NEGATIVE_AMOUNT, "Allowance cannot be negative");
        }
        setAllowance(owner, spender, shares);
    }

    /**
     * Consume allowance when {@code spender} acts for {@code owner}. Owners spend freely.
     */
    public synchronized void spendAllowance(String owner, String spender, BigInteger shares) {
        if (owner.equals(spender)) {
            return;
        }
        BigInteger allowed = allowance(owner, spender);
        if (allowed.compareTo(shares) < 0) {
            throw new InsufficientStateException(ErrorCode.INSUFFICIENT_ALLOWANCE,
                    String.format("%s may spend %s shares of %s, %s required", spender, allowed, owner, shares));
        }
        setAllowance(owner, spender, allowed.subtract(shares));
    }

    private void setBalance(String holder, BigInteger value) {
        BigInteger previous = balances.get(holder);
        if (value.signum() == 0) {
            balances.remove(holder);
        } else {
            balances.put(holder, value);
        }
        journal.record(() -> restore(balances, holder, previous));
    }

    private void setAllowance(String owner, String spender, BigInteger value) {
        Map<String, BigInteger> granted = allowances.computeIfAbsent(owner, k -> new HashMap<>());
        BigInteger previous = granted.get(spender);
        granted.put(spender, value);
        journal.record(() -> restore(granted, spender, previous));
    }

    private static void restore(Map<String, BigInteger> map, String key, BigInteger previous) {
        if (previous == null) {
            map.remove(key);
        } else {
            map.put(key, previous);
        }
    }

    private void requireShares() {
        if (totalShares.signum() == 0) {
            throw new InsufficientStateException(ErrorCode.NO_SHARES, "No shares exist to redeem");
        }
    }

    private void requireValue(BigInteger netAssetValue) {
        if (netAssetValue == null || netAssetValue.signum() <= 0) {
            throw new InsufficientStateException(ErrorCode.POOL_HAS_NO_VALUE,
                    "Pool has outstanding shares but no redeemable value");
        }
    }

    private static void requireHolder(String holder) {
        if (holder == null || holder.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_ADDRESS, "Holder address is required");
        }
    }
}
