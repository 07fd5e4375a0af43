package com.strategyvault.strategy;

import com.strategyvault.exception.ExternalFailureException;
import com.strategyvault.exception.VaultException;
import com.strategyvault.exception.VaultException.ErrorCode;
import com.strategyvault.model.StrategyAllocation;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.function.Supplier;

/**
 * Wraps calls into untrusted strategy endpoints. Any runtime failure becomes
 * {@code STRATEGY_CALL_FAILED}; a null or negative amount becomes {@code STRATEGY_INCONSISTENT}.
 * Vault errors raised inside the call (a rejected reentrant call) pass through unchanged.
 */
@Slf4j
public final class StrategyCalls {

    private StrategyCalls() {
        throw new AssertionError("Cannot instantiate utility class");
    }

    public static BigInteger invoke(StrategyAllocation strategy, String method, Supplier<BigInteger> call) {
        BigInteger result;
        try {
            result = call.get();
        } catch (VaultException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Strategy #{} ({}) failed on {}: {}", strategy.getIndex(), strategy.getAddress(), method, e.getMessage());
            throw new ExternalFailureException(ErrorCode.STRATEGY_CALL_FAILED,
                    String.format("Strategy %s failed on %s: %s", strategy.getAddress(), method, e.getMessage()), e);
        }
        if (result == null || result.signum() < 0) {
            log.error("Strategy #{} ({}) returned inconsistent {} result: {}", strategy.getIndex(), strategy.getAddress(), method, result);
            throw new ExternalFailureException(ErrorCode.STRATEGY_INCONSISTENT,
                    String.format("Strategy %s returned %s from %s", strategy.getAddress(), result, method));
        }
        return result;
    }
}
