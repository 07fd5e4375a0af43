package com.strategyvault.event;

import java.time.Instant;

public record PauseChangedEvent(boolean paused, String actor, Instant timestamp) implements VaultEvent {

    @Override
    public VaultEventType type() {
        return VaultEventType.PAUSE_CHANGED;
    }

    @Override
    public String holder() {
        return actor;
    }

    @Override
    public String describe() {
        return (paused ? "vault paused by " : "vault unpaused by ") + actor;
    }
}
