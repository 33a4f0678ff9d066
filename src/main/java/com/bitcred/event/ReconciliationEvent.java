package com.bitcred.event;

import com.bitcred.domain.model.ReconciliationResult;
import org.springframework.context.ApplicationEvent;

/**
 * Published after every pool reconciliation run, scheduled or manual. Not a ledger event:
 * it changes no state and is not journaled for indexers.
 */
public class ReconciliationEvent extends ApplicationEvent {

    private final ReconciliationResult result;

    public ReconciliationEvent(Object source, ReconciliationResult result) {
        super(source);
        this.result = result;
    }

    public ReconciliationResult getResult() {
        return result;
    }
}
