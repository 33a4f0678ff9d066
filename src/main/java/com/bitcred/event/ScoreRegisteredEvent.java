package com.bitcred.event;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Published when a score is registered for the first time. Carries the derived tier and ratio
 * so indexers need not reimplement the tier table.
 */
public class ScoreRegisteredEvent extends LedgerEvent {

    private final String scoreId;
    private final String owner;
    private final int score;
    private final int tier;
    private final int ratioBps;

    public ScoreRegisteredEvent(
            Object source, String scoreId, String owner, int score, int tier, int ratioBps, long timestamp) {
        super(source, timestamp);
        this.scoreId = scoreId;
        this.owner = owner;
        this.score = score;
        this.tier = tier;
        this.ratioBps = ratioBps;
    }

    public String getScoreId() {
        return scoreId;
    }

    public String getOwner() {
        return owner;
    }

    public int getScore() {
        return score;
    }

    public int getTier() {
        return tier;
    }

    public int getRatioBps() {
        return ratioBps;
    }

    @Override
    public String getName() {
        return "ScoreRegistered";
    }

    @Override
    public Map<String, Object> getPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", scoreId);
        payload.put("owner", owner);
        payload.put("score", score);
        payload.put("tier", tier);
        payload.put("ratio", ratioBps);
        payload.put("timestamp", getLedgerTimestamp());
        return payload;
    }
}
