package com.strategyvault.simulation;

import com.strategyvault.asset.AssetLedger;
import com.strategyvault.service.UndoJournal;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

/**
 * Convertible strategy whose redemptions are refused while locked.
 * Deposits and valuation keep working during the lockup.
 */
@Slf4j
public class SimulatedLockedStrategy extends SimulatedConvertibleStrategy {

    private volatile boolean locked;

    public SimulatedLockedStrategy(String address, String name, AssetLedger assetLedger, UndoJournal journal,
                                   boolean locked) {
        super(address, name, assetLedger, journal);
        this.locked = locked;
    }

    @Override
    public synchronized BigInteger redeem(String caller, BigInteger amount) {
        if (locked) {
            throw new IllegalStateException("Funds in " + name() + " are locked");
        }
        return super.redeem(caller, amount);
    }

    public boolean isLocked() {
        return locked;
    }

    public void lock() {
        locked = true;
        log.info("[{}] locked", name());
    }

    public void unlock() {
        locked = false;
        log.info("[{}] unlocked", name());
    }
}
