package com.strategyvault.service;

import com.strategyvault.event.VaultEvent;
import com.strategyvault.exception.InsufficientStateException;
import com.strategyvault.exception.VaultException.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Single mutual-exclusion guard shared by every state-mutating vault entry point.
 *
 * Operations from different threads run one at a time in arrival order. A nested
 * call from inside a running operation (a strategy calling back into the vault)
 * is rejected. Each operation is all-or-nothing: on any exception the undo journal
 * reverses every recorded change and buffered events are discarded.
 */
@Component
@Slf4j
public class OperationGuard {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final UndoJournal journal;
    private final ApplicationEventPublisher eventPublisher;

    public OperationGuard(UndoJournal journal, ApplicationEventPublisher eventPublisher) {
        this.journal = journal;
        this.eventPublisher = eventPublisher;
    }

    public <T> T execute(String operation, Supplier<T> body) {
        if (lock.isHeldByCurrentThread()) {
            log.warn("Rejected reentrant call to {} while another vault operation is in flight", operation);
            throw new InsufficientStateException(ErrorCode.REENTRANT_CALL,
                    "Reentrant call to " + operation + " rejected");
        }

        lock.lock();
        List<VaultEvent> events;
        T result;
        try {
            journal.begin();
            try {
                result = body.get();
            } catch (RuntimeException | Error e) {
                journal.rollback();
                log.debug("Operation {} failed and was rolled back: {}", operation, e.getMessage());
                throw e;
            }
            events = journal.commit();
        } finally {
            lock.unlock();
        }

        events.forEach(eventPublisher::publishEvent);
        return result;
    }

    /**
     * Run a read-only view under the operation lock, so it sees state either before or after
     * any operation, never in between. Nothing is journaled. Allowed inside an operation.
     */
    public <T> T read(Supplier<T> view) {
        if (lock.isHeldByCurrentThread()) {
            return view.get();
        }
        lock.lock();
        try {
            return view.get();
        } finally {
            lock.unlock();
        }
    }

    public void run(String operation, Runnable body) {
        execute(operation, () -> {
            body.run();
            return null;
        });
    }

    /**
     * Publish an event right away when no operation is open, otherwise buffer it.
     */
    public void emit(VaultEvent event) {
        if (!journal.emit(event)) {
            eventPublisher.publishEvent(event);
        }
    }

    public boolean isInOperation() {
        return lock.isHeldByCurrentThread();
    }
}
