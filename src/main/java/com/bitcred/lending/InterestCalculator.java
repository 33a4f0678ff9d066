package com.bitcred.lending;

import java.math.BigInteger;

/**
 * Fixed-point arithmetic for debt accrual, borrow capacity and health factor.
 *
 * <p>All results are floored integers. Rates and ratios are in basis points.
 */
public final class InterestCalculator {

    public static final BigInteger BPS = BigInteger.valueOf(10_000);
    public static final long SECONDS_PER_YEAR = 31_536_000L;

    /** Reported health factor when a position carries no debt. */
    public static final BigInteger HEALTHY_SENTINEL = BigInteger.valueOf(99_999);

    private static final BigInteger YEAR_BPS = BPS.multiply(BigInteger.valueOf(SECONDS_PER_YEAR));

    private InterestCalculator() {}

    /**
     * Simple interest on {@code principal} since {@code borrowTimestamp}.
     * A zero timestamp means nothing accrues. A clock behind the timestamp counts as zero elapsed.
     */
    public static BigInteger accruedDebt(BigInteger principal, long borrowTimestamp, int rateBps, long now) {
        if (borrowTimestamp == 0 || principal.signum() == 0) {
            return principal;
        }
        long elapsed = Math.max(0L, now - borrowTimestamp);
        BigInteger interest = principal
                .multiply(BigInteger.valueOf(rateBps))
                .multiply(BigInteger.valueOf(elapsed))
                .divide(YEAR_BPS);
        return principal.add(interest);
    }

    public static BigInteger maxBorrow(BigInteger collateral, int ratioBps) {
        requirePositiveRatio(ratioBps);
        return collateral.multiply(BPS).divide(BigInteger.valueOf(ratioBps));
    }

    public static BigInteger healthFactor(BigInteger collateral, BigInteger debt) {
        if (debt.signum() == 0) {
            return HEALTHY_SENTINEL;
        }
        return collateral.multiply(BPS).divide(debt);
    }

    public static boolean isLiquidatable(BigInteger healthFactor, int thresholdBps) {
        return healthFactor.compareTo(BigInteger.valueOf(thresholdBps)) < 0;
    }

    /** Collateral plus bonus, capped at the collateral that actually exists. */
    public static BigInteger seizeAmount(BigInteger collateral, int bonusBps) {
        BigInteger withBonus = collateral.add(collateral.multiply(BigInteger.valueOf(bonusBps)).divide(BPS));
        return collateral.min(withBonus);
    }

    static void requirePositiveRatio(int ratioBps) {
        if (ratioBps <= 0) {
            throw new IllegalStateException("Collateral ratio must be positive, got " + ratioBps);
        }
    }
}
