package com.strategyvault.service;

import com.strategyvault.config.VaultConfig;
import com.strategyvault.exception.VaultException;
import com.strategyvault.exception.VaultException.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class VaultAccessPolicyTest {

    private VaultAccessPolicy policy;

    @BeforeEach
    void setUp() {
        VaultConfig config = new VaultConfig();
        config.getAccess().setManagers(Set.of("manager"));
        config.getAccess().setAdmins(Set.of("admin"));
        policy = new VaultAccessPolicy(config);
    }

    @Test
    void adminsAreAlsoManagers() {
        assertTrue(policy.isManager("admin"));
        assertTrue(policy.isManager("manager"));
        assertFalse(policy.isAdmin("manager"));
        assertFalse(policy.isManager(null));
    }

    @Test
    void deniedActionsThrow() {
        VaultException ex = assertThrows(VaultException.class, () -> policy.requireManager("alice", "rebalance"));
        assertEquals(ErrorCode.ACCESS_DENIED, ex.getErrorCode());
        assertThrows(VaultException.class, () -> policy.requireAdmin("manager", "pause"));

        assertDoesNotThrow(() -> policy.requireManager("manager", "rebalance"));
        assertDoesNotThrow(() -> policy.requireAdmin("admin", "pause"));
    }
}
