package com.bitcred.api.controller;

import com.bitcred.observability.LedgerEventJournal;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Indexer feed: GET /api/events?limit=N returns the N most recent committed ledger events,
 * oldest first.
 */
@RestController
@RequestMapping("/api/events")
public class LedgerEventsController {

    private static final int MAX_LIMIT = 1000;

    private final LedgerEventJournal ledgerEventJournal;

    public LedgerEventsController(LedgerEventJournal ledgerEventJournal) {
        this.ledgerEventJournal = ledgerEventJournal;
    }

    @GetMapping
    public ResponseEntity<List<LedgerEventJournal.Entry>> recentEvents(
            @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(ledgerEventJournal.recent(Math.min(Math.max(limit, 0), MAX_LIMIT)));
    }
}
