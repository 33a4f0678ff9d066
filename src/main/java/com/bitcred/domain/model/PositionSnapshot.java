package com.bitcred.domain.model;

import java.math.BigInteger;
import lombok.Builder;
import lombok.Value;

/**
 * Read-only view of a position evaluated at one instant: stored fields plus the derived
 * accrued debt, borrow capacity and health factor.
 */
@Value
@Builder
public class PositionSnapshot {

    String user;
    BigInteger collateral;

    /** Stored principal, interest not included. */
    BigInteger principal;

    /** Principal plus interest accrued up to {@link #evaluatedAt}. */
    BigInteger totalDebt;

    BigInteger maxBorrow;
    BigInteger healthFactor;
    int cachedRatioBps;
    String linkedScoreId;
    long borrowTimestamp;
    boolean liquidatable;
    long evaluatedAt;
}
