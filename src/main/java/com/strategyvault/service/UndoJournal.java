package com.strategyvault.service;

import com.strategyvault.event.VaultEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Records how to reverse each state change made while an operation is open,
 * plus the events that operation wants to emit.
 *
 * Only the thread holding the OperationGuard lock opens the journal, so no
 * extra synchronization is needed here. Changes made with no open operation
 * (test fixtures, faucet mints) are not recorded.
 */
@Component
@Slf4j
public class UndoJournal {

    private final Deque<Runnable> undoLog = new ArrayDeque<>();
    private final List<VaultEvent> pendingEvents = new ArrayList<>();
    private volatile Thread owner;

    void begin() {
        if (owner != null) {
            throw new IllegalStateException("Journal already open for thread " + owner.getName());
        }
        owner = Thread.currentThread();
        undoLog.clear();
        pendingEvents.clear();
    }

    public boolean isOpen() {
        return owner == Thread.currentThread();
    }

    /**
     * Register the inverse of a change that has just been applied.
     */
    public void record(Runnable undo) {
        if (isOpen()) {
            undoLog.push(undo);
        }
    }

    /**
     * Buffer an event until commit. Outside an operation there is nothing to
     * buffer against, so the event is returned to the caller for immediate publication.
     */
    public boolean emit(VaultEvent event) {
        if (isOpen()) {
            pendingEvents.add(event);
            return true;
        }
        return false;
    }

    List<VaultEvent> commit() {
        List<VaultEvent> events = new ArrayList<>(pendingEvents);
        reset();
        return events;
    }

    void rollback() {
        int steps = undoLog.size();
        try {
            while (!undoLog.isEmpty()) {
                undoLog.pop().run();
            }
        } finally {
            reset();
        }
        log.debug("Rolled back {} state changes", steps);
    }

    private void reset() {
        undoLog.clear();
        pendingEvents.clear();
        owner = null;
    }
}
