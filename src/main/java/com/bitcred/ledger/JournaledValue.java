package com.bitcred.ledger;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Single-cell counterpart of {@link JournaledMap}, used for singleton state such as pool totals.
 */
public class JournaledValue<T> {

    private final LedgerTransactionManager transactionManager;
    private volatile T value;

    public JournaledValue(LedgerTransactionManager transactionManager, T initialValue) {
        this.transactionManager = transactionManager;
        this.value = Objects.requireNonNull(initialValue, "initialValue");
    }

    public T get() {
        return value;
    }

    public void set(T newValue) {
        UnitOfWork unit = transactionManager.requireActiveUnit();
        T previous = value;
        value = Objects.requireNonNull(newValue, "newValue");
        unit.recordUndo(() -> value = previous);
    }

    public T update(UnaryOperator<T> updater) {
        T updated = updater.apply(value);
        set(updated);
        return updated;
    }
}
