package com.strategyvault.service.persistence;

import com.strategyvault.config.PersistenceConfig;
import com.strategyvault.dto.VaultEventResponse;
import com.strategyvault.entity.VaultEventEntity;
import com.strategyvault.event.VaultEvent;
import com.strategyvault.repository.VaultEventRepository;
import com.strategyvault.util.CurrentUserContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Stores committed vault events for the audit trail.
 * Writes are asynchronous so vault operations never wait on the database.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VaultEventPersistenceService {

    private final VaultEventRepository repository;
    private final PersistenceConfig persistenceConfig;
    private final Clock clock;

    @Async("persistenceExecutor")
    @Transactional
    public CompletableFuture<VaultEventEntity> persistEventAsync(VaultEvent event) {
        if (!persistenceConfig.isEnabled()) {
            return CompletableFuture.completedFuture(null);
        }
        try {
            VaultEventEntity saved = repository.save(toEntity(event));
            log.debug("Persisted event: type={}, holder={}", event.type(), event.holder());
            return CompletableFuture.completedFuture(saved);
        } catch (Exception e) {
            log.error("Failed to persist event: type={}", event.type(), e);
            return CompletableFuture.failedFuture(e);
        }
    }

    @Transactional(readOnly = true)
    public List<VaultEventResponse> recentEvents(String holder) {
        List<VaultEventEntity> events = holder == null || holder.isBlank()
                ? repository.findTop100ByOrderByTimestampDescIdDesc()
                : repository.findTop100ByHolderOrderByTimestampDescIdDesc(holder);
        return events.stream().map(VaultEventPersistenceService::toResponse).toList();
    }

    VaultEventEntity toEntity(VaultEvent event) {
        return VaultEventEntity.builder()
                .eventType(event.type().name())
                .holder(event.holder())
                .description(truncate(event.describe(), 512))
                .actor(CurrentUserContext.getUserId())
                .timestamp(event.timestamp())
                .recordedAt(clock.instant())
                .build();
    }

    private static VaultEventResponse toResponse(VaultEventEntity entity) {
        return VaultEventResponse.builder()
                .id(entity.getId())
                .eventType(entity.getEventType())
                .holder(entity.getHolder())
                .description(entity.getDescription())
                .timestamp(entity.getTimestamp())
                .build();
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }
}
