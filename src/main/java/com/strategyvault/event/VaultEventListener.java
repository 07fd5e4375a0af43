package com.strategyvault.event;

import com.strategyvault.service.persistence.VaultEventPersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Receives committed vault events: logs them and hands them to the event store.
 * Events from a rolled-back operation never reach this listener.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VaultEventListener {

    private final VaultEventPersistenceService persistenceService;

    @EventListener
    public void onVaultEvent(VaultEvent event) {
        log.info("[EVENT] {} {}", event.type(), event.describe());
        persistenceService.persistEventAsync(event);
    }
}
