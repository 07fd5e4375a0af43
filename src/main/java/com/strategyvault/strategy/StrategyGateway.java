package com.strategyvault.strategy;

import com.strategyvault.exception.ValidationException;
import com.strategyvault.exception.VaultException.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves strategy addresses to the convertible endpoints the vault can call.
 * Direct strategies need no endpoint: they are plain accounts on the asset ledger.
 */
@Component
@Slf4j
public class StrategyGateway {

    private final Map<String, ConvertibleStrategy> endpoints = new ConcurrentHashMap<>();

    public void register(ConvertibleStrategy strategy) {
        ConvertibleStrategy previous = endpoints.putIfAbsent(strategy.address(), strategy);
        if (previous != null && previous != strategy) {
            throw new IllegalStateException("Address already bound to another strategy: " + strategy.address());
        }
        log.info("Registered convertible strategy endpoint {}", strategy.address());
    }

    public boolean isKnown(String address) {
        return address != null && endpoints.containsKey(address);
    }

    public Optional<ConvertibleStrategy> find(String address) {
        return Optional.ofNullable(address).map(endpoints::get);
    }

    public ConvertibleStrategy resolve(String address) {
        return find(address).orElseThrow(() -> new ValidationException(ErrorCode.UNKNOWN_STRATEGY,
                "No convertible strategy endpoint at address " + address));
    }

    public Collection<ConvertibleStrategy> all() {
        return List.copyOf(endpoints.values());
    }
}
