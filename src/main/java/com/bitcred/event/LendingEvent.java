package com.bitcred.event;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Published after a committed deposit, borrow, repayment, withdrawal or liquidity top-up.
 *
 * <p>{@code scoreId} is only set for {@link LendingEventType#COLLATERAL_DEPOSITED} and
 * {@code ratioBps} only for {@link LendingEventType#BORROWED}.
 */
public class LendingEvent extends LedgerEvent {

    private final LendingEventType eventType;
    private final String user;
    private final BigInteger amount;
    private final String scoreId;
    private final Integer ratioBps;

    public LendingEvent(
            Object source,
            LendingEventType eventType,
            String user,
            BigInteger amount,
            String scoreId,
            Integer ratioBps,
            long timestamp) {
        super(source, timestamp);
        this.eventType = eventType;
        this.user = user;
        this.amount = amount;
        this.scoreId = scoreId;
        this.ratioBps = ratioBps;
    }

    public LendingEvent(Object source, LendingEventType eventType, String user, BigInteger amount, long timestamp) {
        this(source, eventType, user, amount, null, null, timestamp);
    }

    public LendingEventType getEventType() {
        return eventType;
    }

    public String getUser() {
        return user;
    }

    public BigInteger getAmount() {
        return amount;
    }

    public String getScoreId() {
        return scoreId;
    }

    public Integer getRatioBps() {
        return ratioBps;
    }

    @Override
    public String getName() {
        return eventType.getEventName();
    }

    @Override
    public Map<String, Object> getPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(eventType == LendingEventType.LIQUIDITY_ADDED ? "provider" : "user", user);
        payload.put("amount", amount);
        if (scoreId != null) {
            payload.put("id", scoreId);
        }
        if (ratioBps != null) {
            payload.put("ratio", ratioBps);
        }
        return payload;
    }
}
