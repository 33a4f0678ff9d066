package com.bitcred.observability;

import com.bitcred.event.LedgerEvent;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Bounded in-memory feed of committed ledger events for indexers.
 *
 * <p>Each event gets a sequence number starting at 1. When the capacity is reached the oldest
 * entry is dropped; sequence numbers keep increasing so a consumer can detect the gap.
 */
@Component
public class LedgerEventJournal {

    private static final Logger log = LoggerFactory.getLogger(LedgerEventJournal.class);

    private final int capacity;
    private final Deque<Entry> entries = new ArrayDeque<>();
    private long nextSequence = 1;

    public LedgerEventJournal(
            @org.springframework.beans.factory.annotation.Value("${bitcred.events.journal-capacity:1000}")
                    int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Journal capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    @EventListener
    @Order(10)
    public synchronized void onLedgerEvent(LedgerEvent event) {
        Entry entry = Entry.builder()
                .sequence(nextSequence++)
                .name(event.getName())
                .ledgerTimestamp(event.getLedgerTimestamp())
                .payload(event.getPayload())
                .recordedAt(Instant.ofEpochMilli(event.getTimestamp()))
                .build();
        if (entries.size() == capacity) {
            entries.removeFirst();
        }
        entries.addLast(entry);
        log.debug("Journaled #{} {}", entry.getSequence(), entry.getName());
    }

    /**
     * Returns up to {@code limit} most recent entries, oldest first.
     */
    public synchronized List<Entry> recent(int limit) {
        int size = Math.max(0, Math.min(limit, entries.size()));
        List<Entry> all = new ArrayList<>(entries);
        return List.copyOf(all.subList(all.size() - size, all.size()));
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized long getLastSequence() {
        return nextSequence - 1;
    }

    @Value
    @Builder
    public static class Entry {
        long sequence;
        String name;
        long ledgerTimestamp;
        Map<String, Object> payload;
        Instant recordedAt;
    }
}
