package com.bitcred.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Score bands and the collateral ratio each one unlocks.
 *
 * <p>Ratios are basis points of the borrowed amount that must be held as collateral
 * (10000 = 100%). Thresholds are inclusive lower bounds evaluated best tier first.
 */
@Getter
@RequiredArgsConstructor
public enum ScoreTier {

    /** No registration (score sentinel 0). */
    UNREGISTERED(0, 0, 15000),

    /** 800-850. */
    TIER_1(1, 800, 11000),

    /** 750-799. */
    TIER_2(2, 750, 11500),

    /** 700-749. */
    TIER_3(3, 700, 12000),

    /** 650-699. */
    TIER_4(4, 650, 13000);

    public static final int MIN_SCORE = 650;
    public static final int MAX_SCORE = 850;

    private final int level;
    private final int minScore;
    private final int collateralRatioBps;

    /**
     * Classifies a stored score. Zero maps to {@link #UNREGISTERED}; any other value below the
     * tier 1-3 thresholds lands in {@link #TIER_4}, matching the registry's range check which
     * keeps stored scores within 650-850.
     */
    public static ScoreTier forScore(int score) {
        if (score == 0) {
            return UNREGISTERED;
        }
        if (score >= TIER_1.minScore) {
            return TIER_1;
        }
        if (score >= TIER_2.minScore) {
            return TIER_2;
        }
        if (score >= TIER_3.minScore) {
            return TIER_3;
        }
        return TIER_4;
    }

    public static boolean isInRange(int score) {
        return score >= MIN_SCORE && score <= MAX_SCORE;
    }
}
