package com.bitcred.domain.model;

import java.math.BigInteger;
import lombok.Builder;
import lombok.Value;

/**
 * A borrower's collateral and debt in the lending pool.
 *
 * <p>{@code principal} excludes interest accrued since {@code borrowTimestamp}; the accrued
 * figure is computed on read. {@code borrowTimestamp} is 0 exactly when principal is 0.
 *
 * <p>{@code cachedRatioBps} is the ratio observed by the last deposit or borrow. It is for
 * display only; capacity checks always re-read the live ratio.
 */
@Value
@Builder(toBuilder = true)
public class Position {

    String user;

    @Builder.Default
    BigInteger collateral = BigInteger.ZERO;

    @Builder.Default
    BigInteger principal = BigInteger.ZERO;

    /** Epoch seconds principal was last touched, 0 when no principal is outstanding. */
    long borrowTimestamp;

    /** Score identifier of the most recent deposit, null before the first deposit. */
    String linkedScoreId;

    int cachedRatioBps;

    public static Position empty(String user) {
        return Position.builder().user(user).build();
    }

    public boolean hasLinkedScore() {
        return linkedScoreId != null;
    }
}
