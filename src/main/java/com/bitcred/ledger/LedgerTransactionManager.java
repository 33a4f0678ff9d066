package com.bitcred.ledger;

import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Runs ledger operations as atomic, serialized units.
 *
 * <p>Protocol for every top-level operation:
 * <ol>
 *   <li>Acquire the ledger lock (fair, so operations commit in arrival order)</li>
 *   <li>Bind a fresh {@link UnitOfWork} to the calling thread</li>
 *   <li>Run the operation; journaled containers record an undo action per write</li>
 *   <li>On success, drop the journal and publish buffered events in the order raised</li>
 *   <li>On any exception, replay the journal in reverse, discard buffered events and rethrow</li>
 * </ol>
 *
 * <p>A call to {@link #execute} from inside a running unit joins that unit, so a component may
 * call another component's operation and still commit or roll back as one.
 */
@Component
public class LedgerTransactionManager {

    private static final Logger log = LoggerFactory.getLogger(LedgerTransactionManager.class);

    private final ReentrantLock ledgerLock = new ReentrantLock(true);
    private final ThreadLocal<UnitOfWork> currentUnit = new ThreadLocal<>();
    private final ApplicationEventPublisher applicationEventPublisher;

    public LedgerTransactionManager(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    /**
     * Executes {@code work} atomically and returns its result.
     *
     * @param operation name used in logs
     * @param work      the operation body; any exception it throws aborts the unit
     */
    public <T> T execute(String operation, Supplier<T> work) {
        if (currentUnit.get() != null) {
            return work.get();
        }

        ledgerLock.lock();
        try {
            UnitOfWork unit = new UnitOfWork(operation);
            currentUnit.set(unit);
            T result;
            List<ApplicationEvent> events;
            try {
                result = work.get();
                events = unit.commit();
            } catch (RuntimeException | Error ex) {
                int writes = unit.getWriteCount();
                unit.rollback();
                log.debug("Rolled back {} ({} writes undone): {}", operation, writes, ex.getMessage());
                throw ex;
            } finally {
                currentUnit.remove();
            }
            events.forEach(applicationEventPublisher::publishEvent);
            return result;
        } finally {
            ledgerLock.unlock();
        }
    }

    /**
     * Executes {@code work} atomically for its side effects only.
     */
    public void run(String operation, Runnable work) {
        execute(operation, () -> {
            work.run();
            return null;
        });
    }

    /**
     * Evaluates a read-only query against committed state. Takes the ledger lock so a unit in
     * flight on another thread is never observed half-applied. Inside a running unit the query
     * sees that unit's own writes. Writes from {@code query} are rejected by the containers.
     */
    public <T> T read(String query, Supplier<T> work) {
        if (currentUnit.get() != null || ledgerLock.isHeldByCurrentThread()) {
            return work.get();
        }
        ledgerLock.lock();
        try {
            log.trace("Read {}", query);
            return work.get();
        } finally {
            ledgerLock.unlock();
        }
    }

    /**
     * Raises an event from inside a unit. Buffered until commit; published immediately when no
     * unit is active.
     */
    public void raise(ApplicationEvent event) {
        UnitOfWork unit = currentUnit.get();
        if (unit == null) {
            applicationEventPublisher.publishEvent(event);
            return;
        }
        unit.enqueueEvent(event);
    }

    public boolean isInTransaction() {
        return currentUnit.get() != null;
    }

    UnitOfWork requireActiveUnit() {
        UnitOfWork unit = currentUnit.get();
        if (unit == null) {
            throw new IllegalStateException("Ledger state can only be written inside a ledger operation");
        }
        return unit;
    }
}
