package com.strategyvault.simulation;

import com.strategyvault.asset.AssetLedger;
import com.strategyvault.config.VaultConfig;
import com.strategyvault.exception.ValidationException;
import com.strategyvault.exception.VaultException.ErrorCode;
import com.strategyvault.service.MultiStrategyVault;
import com.strategyvault.service.OperationGuard;
import com.strategyvault.service.UndoJournal;
import com.strategyvault.strategy.StrategyGateway;
import com.strategyvault.util.VaultMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Drives the in-process world around the vault: funds accounts, deploys simulated
 * strategies and moves their value up or down. Balance changes go through the
 * operation guard so they never interleave with a vault operation.
 */
@Service
@Slf4j
public class SimulationService {

    private final VaultConfig config;
    private final AssetLedger assetLedger;
    private final StrategyGateway gateway;
    private final UndoJournal journal;
    private final MultiStrategyVault vault;
    private final OperationGuard guard;

    private final Map<String, SimulatedConvertibleStrategy> deployed = new ConcurrentHashMap<>();

    public SimulationService(VaultConfig config, AssetLedger assetLedger, StrategyGateway gateway,
                             UndoJournal journal, MultiStrategyVault vault, OperationGuard guard) {
        this.config = config;
        this.assetLedger = assetLedger;
        this.gateway = gateway;
        this.journal = journal;
        this.vault = vault;
        this.guard = guard;
    }

    /**
     * Mint {@code wholeTokens} of the asset to {@code account}.
     *
     * @return base units minted
     */
    public BigInteger faucet(String account, long wholeTokens) {
        requireAccount(account);
        if (wholeTokens <= 0 || wholeTokens > config.getSimulation().getFaucetLimit()) {
            throw new ValidationException(ErrorCode.ZERO_AMOUNT, String.format(
                    "Faucet amount must be between 1 and %d", config.getSimulation().getFaucetLimit()));
        }
        BigInteger amount = BigInteger.valueOf(wholeTokens).multiply(VaultMath.unit(assetLedger.decimals()));
        guard.run("faucet", () -> assetLedger.mint(account, amount));
        log.info("Faucet: minted {} {} to {}", amount, assetLedger.symbol(), account);
        return amount;
    }

    /**
     * Approve the vault to pull {@code amount} base units from {@code owner}.
     */
    public void approveVault(String owner, BigInteger amount) {
        requireAccount(owner);
        if (owner.equals(config.getAddress())) {
            throw new ValidationException(ErrorCode.INVALID_ADDRESS, "The vault cannot approve itself");
        }
        if (amount == null || amount.signum() < 0) {
            throw new ValidationException(ErrorCode.NEGATIVE_AMOUNT, "Approval cannot be negative");
        }
        guard.run("approve", () -> assetLedger.approve(owner, config.getAddress(), amount));
        log.info("{} approved vault for {} {}", owner, amount, assetLedger.symbol());
    }

    /**
     * Deploy a simulated convertible strategy at {@code address} and make it resolvable.
     * A lockable strategy starts unlocked.
     */
    public SimulatedConvertibleStrategy deployStrategy(String address, String name, boolean lockable) {
        requireAccount(address);
        if (address.equals(config.getAddress()) || deployed.containsKey(address)) {
            throw new ValidationException(ErrorCode.DUPLICATE_STRATEGY, "Address already in use: " + address);
        }
        String label = name != null && !name.isBlank() ? name : address;
        SimulatedConvertibleStrategy strategy = lockable
                ? new SimulatedLockedStrategy(address, label, assetLedger, journal, false)
                : new SimulatedConvertibleStrategy(address, label, assetLedger, journal);
        gateway.register(strategy);
        deployed.put(address, strategy);
        log.info("Deployed simulated {}strategy {} at {}", lockable ? "lockable " : "", label, address);
        return strategy;
    }

    public BigInteger simulateYield(String address, int bps) {
        requireBps(bps);
        SimulatedConvertibleStrategy strategy = strategy(address);
        return guard.execute("simulateYield", () -> strategy.simulateYield(bps));
    }

    public BigInteger simulateLoss(String address, int bps) {
        requireBps(bps);
        SimulatedConvertibleStrategy strategy = strategy(address);
        return guard.execute("simulateLoss", () -> strategy.simulateLoss(bps));
    }

    public void lock(String address) {
        locked(address).lock();
    }

    public void unlock(String address) {
        locked(address).unlock();
    }

    /**
     * Asset balance, share balance and the share value of one account.
     */
    public Map<String, Object> balances(String account) {
        requireAccount(account);
        BigInteger shares = vault.shareBalanceOf(account);
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("account", account);
        view.put("asset", assetLedger.symbol());
        view.put("assetBalance", assetLedger.balanceOf(account));
        view.put("vaultAllowance", assetLedger.allowance(account, config.getAddress()));
        view.put("shares", shares);
        view.put("shareValue", shares.signum() == 0 ? BigInteger.ZERO : vault.convertToAssets(shares));
        return view;
    }

    public Map<String, SimulatedConvertibleStrategy> deployedStrategies() {
        return Map.copyOf(deployed);
    }

    private SimulatedConvertibleStrategy strategy(String address) {
        SimulatedConvertibleStrategy strategy = deployed.get(address);
        if (strategy == null) {
            throw new ValidationException(ErrorCode.UNKNOWN_STRATEGY, "No simulated strategy at " + address);
        }
        return strategy;
    }

    private SimulatedLockedStrategy locked(String address) {
        if (strategy(address) instanceof SimulatedLockedStrategy lockedStrategy) {
            return lockedStrategy;
        }
        throw new ValidationException(ErrorCode.UNSUPPORTED_STRATEGY_KIND, "Strategy at " + address + " has no lockup");
    }

    private static void requireBps(int bps) {
        if (bps <= 0 || bps > 10_000) {
            throw new ValidationException(ErrorCode.INVALID_INDEX, "Basis points must be between 1 and 10000");
        }
    }

    private static void requireAccount(String account) {
        if (account == null || account.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_ADDRESS, "Account address is required");
        }
    }
}
