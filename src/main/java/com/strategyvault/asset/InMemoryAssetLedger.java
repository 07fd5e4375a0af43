package com.strategyvault.asset;

import com.strategyvault.service.UndoJournal;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Process-local asset ledger. Every balance and allowance change is recorded in the
 * undo journal so a failed vault operation leaves the ledger untouched.
 */
@Slf4j
public class InMemoryAssetLedger implements AssetLedger {

    private final String symbol;
    private final int decimals;
    private final UndoJournal journal;

    private final Map<String, BigInteger> balances = new HashMap<>();
    // owner -> spender -> amount
    private final Map<String, Map<String, BigInteger>> allowances = new HashMap<>();

    public InMemoryAssetLedger(String symbol, int decimals, UndoJournal journal) {
        this.symbol = symbol;
        this.decimals = decimals;
        this.journal = journal;
    }

    @Override
    public String symbol() {
        return symbol;
    }

    @Override
    public int decimals() {
        return decimals;
    }

    @Override
    public synchronized BigInteger balanceOf(String account) {
        return balances.getOrDefault(account, BigInteger.ZERO);
    }

    @Override
    public synchronized BigInteger allowance(String owner, String spender) {
        return allowances.getOrDefault(owner, Map.of()).getOrDefault(spender, BigInteger.ZERO);
    }

    @Override
    public synchronized boolean transfer(String from, String to, BigInteger amount) {
        if (!validAmount(amount) || from == null || to == null) {
            return false;
        }
        if (balanceOf(from).compareTo(amount) < 0) {
            log.debug("[{}] transfer refused: {} has {} < {}", symbol, from, balanceOf(from), amount);
            return false;
        }
        setBalance(from, balanceOf(from).subtract(amount));
        setBalance(to, balanceOf(to).add(amount));
        return true;
    }

    @Override
    public synchronized boolean transferFrom(String spender, String from, String to, BigInteger amount) {
        if (!validAmount(amount) || spender == null) {
            return false;
        }
        BigInteger allowed = allowance(from, spender);
        if (allowed.compareTo(amount) < 0) {
            log.debug("[{}] transferFrom refused: allowance {} -> {} is {} < {}", symbol, from, spender, allowed, amount);
            return false;
        }
        if (balanceOf(from).compareTo(amount) < 0) {
            return false;
        }
        setAllowance(from, spender, allowed.subtract(amount));
        return transfer(from, to, amount);
    }

    @Override
    public synchronized boolean approve(String owner, String spender, BigInteger amount) {
        if (owner == null || spender == null || amount == null || amount.signum() < 0) {
            return false;
        }
        setAllowance(owner, spender, amount);
        return true;
    }

    @Override
    public synchronized void mint(String to, BigInteger amount) {
        if (!validAmount(amount) || to == null) {
            throw new IllegalArgumentException("Mint requires a receiver and a non-negative amount");
        }
        setBalance(to, balanceOf(to).add(amount));
    }

    @Override
    public synchronized boolean burn(String from, BigInteger amount) {
        if (!validAmount(amount) || balanceOf(from).compareTo(amount) < 0) {
            return false;
        }
        setBalance(from, balanceOf(from).subtract(amount));
        return true;
    }

    private void setBalance(String account, BigInteger value) {
        BigInteger previous = balances.get(account);
        balances.put(account, value);
        journal.record(() -> restore(balances, account, previous));
    }

    private void setAllowance(String owner, String spender, BigInteger value) {
        Map<String, BigInteger> granted = allowances.computeIfAbsent(owner, k -> new HashMap<>());
        BigInteger previous = granted.get(spender);
        granted.put(spender, value);
        journal.record(() -> restore(granted, spender, previous));
    }

    private synchronized void restore(Map<String, BigInteger> map, String key, BigInteger previous) {
        if (previous == null) {
            map.remove(key);
        } else {
            map.put(key, previous);
        }
    }

    private static boolean validAmount(BigInteger amount) {
        return amount != null && amount.signum() >= 0;
    }
}
