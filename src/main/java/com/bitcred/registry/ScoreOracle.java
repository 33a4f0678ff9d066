package com.bitcred.registry;

/**
 * Read-only view of the score registry consumed by the lending pool.
 */
public interface ScoreOracle {

    /**
     * @return the registered score, or 0 when the identifier was never registered
     */
    int getScore(String scoreId);

    /**
     * @return the collateral ratio in basis points; the default 15000 for unregistered identifiers
     */
    int getCollateralRatio(String scoreId);
}
