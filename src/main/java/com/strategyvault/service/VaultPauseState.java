package com.strategyvault.service;

import com.strategyvault.event.PauseChangedEvent;
import com.strategyvault.exception.VaultException;
import com.strategyvault.exception.VaultException.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Circuit breaker for user flows. While paused, deposits, mints, withdrawals and
 * rebalances are rejected; the emergency unwind requires the paused state.
 */
@Component
@Slf4j
public class VaultPauseState {

    private final UndoJournal journal;
    private final OperationGuard guard;
    private final Clock clock;

    private volatile boolean paused;

    public VaultPauseState(UndoJournal journal, OperationGuard guard, Clock clock) {
        this.journal = journal;
        this.guard = guard;
        this.clock = clock;
    }

    public boolean isPaused() {
        return paused;
    }

    public void pause(String actor) {
        requireNotPaused();
        setPaused(true, actor);
    }

    public void unpause(String actor) {
        requirePaused();
        setPaused(false, actor);
    }

    public void requireNotPaused() {
        if (paused) {
            throw new VaultException(ErrorCode.VAULT_PAUSED, "Vault is paused");
        }
    }

    public void requirePaused() {
        if (!paused) {
            throw new VaultException(ErrorCode.VAULT_NOT_PAUSED, "Vault is not paused");
        }
    }

    private void setPaused(boolean value, String actor) {
        boolean previous = paused;
        paused = value;
        journal.record(() -> paused = previous);
        if (value) {
            log.warn("Vault paused by {}", actor);
        } else {
            log.info("Vault unpaused by {}", actor);
        }
        guard.emit(new PauseChangedEvent(value, actor, clock.instant()));
    }
}
