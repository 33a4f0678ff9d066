package com.bitcred.event;

import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Base class of every event the ledger emits after a committed operation.
 *
 * <p>{@link #getLedgerTimestamp()} is the operation's logical time in epoch seconds (the single
 * clock read of that operation), not the wall-clock creation time {@link #getTimestamp()}
 * inherited from {@link ApplicationEvent}.
 */
public abstract class LedgerEvent extends ApplicationEvent {

    private final long ledgerTimestamp;

    protected LedgerEvent(Object source, long ledgerTimestamp) {
        super(source);
        this.ledgerTimestamp = ledgerTimestamp;
    }

    public long getLedgerTimestamp() {
        return ledgerTimestamp;
    }

    /** Indexer-facing event name, e.g. {@code ScoreRegistered}. */
    public abstract String getName();

    /** Indexer-facing fields in declaration order. */
    public abstract Map<String, Object> getPayload();
}
