package com.bitcred.event;

import java.util.Map;

/**
 * Published when the registry admin approves or revokes a scorer.
 */
public class ScorerEvent extends LedgerEvent {

    private final ScorerEventType eventType;
    private final String scorer;

    public ScorerEvent(Object source, ScorerEventType eventType, String scorer, long timestamp) {
        super(source, timestamp);
        this.eventType = eventType;
        this.scorer = scorer;
    }

    public ScorerEventType getEventType() {
        return eventType;
    }

    public String getScorer() {
        return scorer;
    }

    @Override
    public String getName() {
        return eventType == ScorerEventType.APPROVED ? "ScorerApproved" : "ScorerRevoked";
    }

    @Override
    public Map<String, Object> getPayload() {
        return Map.of("scorer", scorer);
    }
}
