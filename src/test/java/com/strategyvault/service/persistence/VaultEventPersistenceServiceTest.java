package com.strategyvault.service.persistence;

import com.strategyvault.config.PersistenceConfig;
import com.strategyvault.dto.VaultEventResponse;
import com.strategyvault.entity.VaultEventEntity;
import com.strategyvault.event.DepositedEvent;
import com.strategyvault.repository.VaultEventRepository;
import com.strategyvault.util.CurrentUserContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class VaultEventPersistenceServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private VaultEventRepository repository;

    private PersistenceConfig persistenceConfig;
    private VaultEventPersistenceService service;
    private EventCleanupService cleanupService;
    private AutoCloseable mocks;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        persistenceConfig = new PersistenceConfig();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        service = new VaultEventPersistenceService(repository, persistenceConfig, clock);
        cleanupService = new EventCleanupService(persistenceConfig, repository, clock);
    }

    @AfterEach
    void tearDown() throws Exception {
        CurrentUserContext.clear();
        mocks.close();
    }

    private static DepositedEvent deposit() {
        return new DepositedEvent("alice", "bob", BigInteger.valueOf(1_000_000), BigInteger.valueOf(990_000),
                NOW.minusSeconds(5));
    }

    @Test
    void persistsEventWithActor() {
        CurrentUserContext.setUserId("alice");
        when(repository.save(any(VaultEventEntity.class))).thenAnswer(invocation -> invocation.getArgument(0));

        CompletableFuture<VaultEventEntity> future = service.persistEventAsync(deposit());

        ArgumentCaptor<VaultEventEntity> captor = ArgumentCaptor.forClass(VaultEventEntity.class);
        verify(repository).save(captor.capture());
        VaultEventEntity saved = captor.getValue();
        assertEquals("DEPOSITED", saved.getEventType());
        assertEquals("bob", saved.getHolder());
        assertEquals("alice", saved.getActor());
        assertEquals(NOW.minusSeconds(5), saved.getTimestamp());
        assertEquals(NOW, saved.getRecordedAt());
        assertSame(saved, future.join());
    }

    @Test
    void disabledPersistenceSkipsRepository() {
        persistenceConfig.setEnabled(false);

        assertNull(service.persistEventAsync(deposit()).join());
        verifyNoInteractions(repository);
    }

    @Test
    void repositoryFailureCompletesExceptionally() {
        when(repository.save(any(VaultEventEntity.class))).thenThrow(new IllegalStateException("db down"));

        CompletableFuture<VaultEventEntity> future = service.persistEventAsync(deposit());

        assertTrue(future.isCompletedExceptionally());
    }

    @Test
    void recentEventsFiltersByHolder() {
        VaultEventEntity entity = VaultEventEntity.builder()
                .id(7L).eventType("DEPOSITED").holder("bob").description("d").timestamp(NOW).build();
        when(repository.findTop100ByHolderOrderByTimestampDescIdDesc("bob")).thenReturn(List.of(entity));

        List<VaultEventResponse> events = service.recentEvents("bob");

        assertEquals(1, events.size());
        assertEquals(7L, events.get(0).getId());
        verify(repository, never()).findTop100ByOrderByTimestampDescIdDesc();

        service.recentEvents(" ");
        verify(repository).findTop100ByOrderByTimestampDescIdDesc();
    }

    @Test
    void cleanupDeletesEventsPastRetention() {
        persistenceConfig.getRetention().setEventsDays(30);
        when(repository.deleteByTimestampBefore(any(Instant.class))).thenReturn(12);

        assertEquals(12, cleanupService.cleanupOldEvents());
        verify(repository).deleteByTimestampBefore(NOW.minus(Duration.ofDays(30)));
    }

    @Test
    void scheduledCleanupSwallowsFailure() {
        when(repository.deleteByTimestampBefore(any(Instant.class))).thenThrow(new IllegalStateException("locked"));

        assertDoesNotThrow(() -> cleanupService.performScheduledCleanup());
    }
}
