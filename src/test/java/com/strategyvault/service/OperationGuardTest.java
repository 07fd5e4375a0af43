package com.strategyvault.service;

import com.strategyvault.event.PauseChangedEvent;
import com.strategyvault.exception.VaultException;
import com.strategyvault.exception.VaultException.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class OperationGuardTest {

    private UndoJournal journal;
    private ApplicationEventPublisher publisher;
    private OperationGuard guard;

    @BeforeEach
    void setUp() {
        journal = new UndoJournal();
        publisher = mock(ApplicationEventPublisher.class);
        guard = new OperationGuard(journal, publisher);
    }

    private static PauseChangedEvent event() {
        return new PauseChangedEvent(true, "admin", Instant.EPOCH);
    }

    @Test
    void eventsArePublishedAfterCommit() {
        PauseChangedEvent event = event();

        String result = guard.execute("op", () -> {
            guard.emit(event);
            verify(publisher, never()).publishEvent(any(Object.class));
            return "done";
        });

        assertEquals("done", result);
        verify(publisher).publishEvent(event);
        assertFalse(journal.isOpen());
    }

    @Test
    void failureRunsUndoInReverseOrderAndDropsEvents() {
        List<String> undone = new ArrayList<>();

        assertThrows(IllegalArgumentException.class, () -> guard.run("op", () -> {
            journal.record(() -> undone.add("first"));
            journal.record(() -> undone.add("second"));
            guard.emit(event());
            throw new IllegalArgumentException("boom");
        }));

        assertEquals(List.of("second", "first"), undone);
        verify(publisher, never()).publishEvent(any(Object.class));
        assertFalse(guard.isInOperation());
    }

    @Test
    void nestedCallIsRejected() {
        VaultException ex = assertThrows(VaultException.class,
                () -> guard.run("outer", () -> guard.run("inner", () -> { })));

        assertEquals(ErrorCode.REENTRANT_CALL, ex.getErrorCode());
        assertFalse(guard.isInOperation());
    }

    @Test
    void emitOutsideOperationPublishesImmediately() {
        PauseChangedEvent event = event();

        guard.emit(event);

        verify(publisher).publishEvent(event);
    }

    @Test
    void recordOutsideOperationIsIgnored() {
        AtomicInteger undone = new AtomicInteger();
        journal.record(undone::incrementAndGet);

        assertThrows(IllegalStateException.class, () -> guard.run("op", () -> {
            throw new IllegalStateException("boom");
        }));

        assertEquals(0, undone.get());
    }

    @Test
    void readWaitsForRunningOperation() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger state = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(2);

        pool.submit(() -> guard.run("op", () -> {
            state.set(1);
            started.countDown();
            try {
                release.await(3, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            state.set(2);
        }));
        assertTrue(started.await(3, TimeUnit.SECONDS));
        Future<Integer> seen = pool.submit(() -> guard.read(state::get));

        assertThrows(TimeoutException.class, () -> seen.get(100, TimeUnit.MILLISECONDS));
        release.countDown();
        assertEquals(2, seen.get(3, TimeUnit.SECONDS));
        pool.shutdownNow();
    }

    @Test
    void readInsideOperationIsAllowed() {
        assertEquals("inner", guard.execute("op", () -> guard.read(() -> "inner")));
        assertFalse(guard.isInOperation());
    }

    @Test
    void concurrentOperationsRunOneAtATime() throws InterruptedException {
        int threads = 8;
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch latch = new CountDownLatch(threads);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        for (int i = 0; i < threads; i++) {
            pool.submit(() -> {
                try {
                    guard.run("op", () -> {
                        maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                        Thread.onSpinWait();
                        inside.decrementAndGet();
                    });
                } finally {
                    latch.countDown();
                }
            });
        }
        assertTrue(latch.await(3, TimeUnit.SECONDS));
        assertEquals(1, maxInside.get());
        pool.shutdownNow();
    }
}
