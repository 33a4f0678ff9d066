package com.bitcred.domain.model;

import java.math.BigInteger;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * Result of comparing per-position sums against pool aggregates.
 *
 * <p>{@code principalDrift} is {@code totalBorrowed - sum(principal)}. It is non-zero whenever
 * interest has been settled into principal, so it is reported but never counts as a mismatch.
 * Only a collateral difference does.
 */
@Data
@Builder
public class ReconciliationResult {

    private Instant timestamp;
    private String trigger;
    private int positionCount;

    private BigInteger sumCollateral;
    private BigInteger totalCollateral;

    private BigInteger sumPrincipal;
    private BigInteger sumAccruedDebt;
    private BigInteger totalBorrowed;
    private BigInteger principalDrift;

    private long durationMs;

    public boolean isCollateralMatched() {
        return sumCollateral != null && sumCollateral.equals(totalCollateral);
    }

    public BigInteger getCollateralDifference() {
        if (sumCollateral == null || totalCollateral == null) {
            return BigInteger.ZERO;
        }
        return totalCollateral.subtract(sumCollateral);
    }
}
