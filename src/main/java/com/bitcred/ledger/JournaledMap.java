package com.bitcred.ledger;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Key-value ledger storage whose writes are undone when the enclosing operation fails.
 *
 * <p>Values must be immutable: rollback restores the previous reference, it does not copy.
 * Reads are allowed anywhere and treat a null key as absent; writes only inside
 * {@link LedgerTransactionManager#execute}.
 */
public class JournaledMap<K, V> {

    private final Map<K, V> entries = new ConcurrentHashMap<>();
    private final LedgerTransactionManager transactionManager;

    public JournaledMap(LedgerTransactionManager transactionManager) {
        this.transactionManager = transactionManager;
    }

    public Optional<V> get(K key) {
        return key == null ? Optional.empty() : Optional.ofNullable(entries.get(key));
    }

    public V getOrDefault(K key, V defaultValue) {
        return key == null ? defaultValue : entries.getOrDefault(key, defaultValue);
    }

    public boolean containsKey(K key) {
        return key != null && entries.containsKey(key);
    }

    public void put(K key, V value) {
        UnitOfWork unit = transactionManager.requireActiveUnit();
        V previous = entries.put(key, value);
        unit.recordUndo(() -> {
            if (previous == null) {
                entries.remove(key);
            } else {
                entries.put(key, previous);
            }
        });
    }

    public void remove(K key) {
        UnitOfWork unit = transactionManager.requireActiveUnit();
        V previous = entries.remove(key);
        if (previous != null) {
            unit.recordUndo(() -> entries.put(key, previous));
        }
    }

    public List<V> values() {
        return List.copyOf(entries.values());
    }

    public Map<K, V> snapshot() {
        return Map.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }
}
