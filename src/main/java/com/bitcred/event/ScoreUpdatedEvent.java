package com.bitcred.event;

import java.util.LinkedHashMap;
import java.util.Map;

public class ScoreUpdatedEvent extends LedgerEvent {

    private final String scoreId;
    private final int oldScore;
    private final int newScore;

    public ScoreUpdatedEvent(Object source, String scoreId, int oldScore, int newScore, long timestamp) {
        super(source, timestamp);
        this.scoreId = scoreId;
        this.oldScore = oldScore;
        this.newScore = newScore;
    }

    public String getScoreId() {
        return scoreId;
    }

    public int getOldScore() {
        return oldScore;
    }

    public int getNewScore() {
        return newScore;
    }

    @Override
    public String getName() {
        return "ScoreUpdated";
    }

    @Override
    public Map<String, Object> getPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", scoreId);
        payload.put("old_score", oldScore);
        payload.put("new_score", newScore);
        payload.put("timestamp", getLedgerTimestamp());
        return payload;
    }
}
