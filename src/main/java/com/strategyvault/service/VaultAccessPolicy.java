package com.strategyvault.service;

import com.strategyvault.config.VaultConfig;
import com.strategyvault.exception.VaultException;
import com.strategyvault.exception.VaultException.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Role checks for operator actions. Roles come from {@code vault.access} in configuration.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VaultAccessPolicy {

    private final VaultConfig config;

    public boolean isAdmin(String userId) {
        return userId != null && config.getAccess().getAdmins().contains(userId);
    }

    public boolean isManager(String userId) {
        return userId != null && (config.getAccess().getManagers().contains(userId) || isAdmin(userId));
    }

    public void requireManager(String userId, String action) {
        if (!isManager(userId)) {
            log.warn("User {} denied manager action {}", userId, action);
            throw new VaultException(ErrorCode.ACCESS_DENIED, "User " + userId + " is not allowed to " + action);
        }
    }

    public void requireAdmin(String userId, String action) {
        if (!isAdmin(userId)) {
            log.warn("User {} denied admin action {}", userId, action);
            throw new VaultException(ErrorCode.ACCESS_DENIED, "User " + userId + " is not allowed to " + action);
        }
    }
}
