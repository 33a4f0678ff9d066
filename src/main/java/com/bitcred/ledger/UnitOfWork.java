package com.bitcred.ledger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.springframework.context.ApplicationEvent;

/**
 * Write journal and event buffer of a single ledger operation.
 *
 * <p>Every journaled write pushes an undo action. Rolling back replays them newest first, which
 * restores each container to the value it held when the operation started. Events stay buffered
 * until commit so that a rolled-back operation is never observable by listeners.
 */
public class UnitOfWork {

    private final String operation;
    private final Deque<Runnable> undoLog = new ArrayDeque<>();
    private final List<ApplicationEvent> pendingEvents = new ArrayList<>();

    UnitOfWork(String operation) {
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }

    void recordUndo(Runnable undo) {
        undoLog.push(undo);
    }

    void enqueueEvent(ApplicationEvent event) {
        pendingEvents.add(event);
    }

    public int getWriteCount() {
        return undoLog.size();
    }

    List<ApplicationEvent> commit() {
        undoLog.clear();
        List<ApplicationEvent> events = List.copyOf(pendingEvents);
        pendingEvents.clear();
        return events;
    }

    void rollback() {
        while (!undoLog.isEmpty()) {
            undoLog.pop().run();
        }
        pendingEvents.clear();
    }
}
