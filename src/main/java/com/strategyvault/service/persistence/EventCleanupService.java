package com.strategyvault.service.persistence;

import com.strategyvault.config.PersistenceConfig;
import com.strategyvault.repository.VaultEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Deletes stored events past their retention period.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "persistence.cleanup.enabled", havingValue = "true", matchIfMissing = true)
public class EventCleanupService {

    private final PersistenceConfig persistenceConfig;
    private final VaultEventRepository repository;
    private final Clock clock;

    @Scheduled(cron = "${persistence.cleanup.cron:0 0 2 * * ?}")
    @Transactional
    public void performScheduledCleanup() {
        log.info("Starting scheduled event cleanup...");
        try {
            int deleted = cleanupOldEvents();
            log.info("Event cleanup completed: {} rows deleted", deleted);
        } catch (Exception e) {
            log.error("Event cleanup failed", e);
        }
    }

    @Transactional
    public int cleanupOldEvents() {
        Instant cutoff = clock.instant().minus(Duration.ofDays(persistenceConfig.getRetention().getEventsDays()));
        log.debug("Cleaning up vault events older than {}", cutoff);
        return repository.deleteByTimestampBefore(cutoff);
    }
}
