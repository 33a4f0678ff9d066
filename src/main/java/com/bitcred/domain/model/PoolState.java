package com.bitcred.domain.model;

import java.math.BigInteger;
import lombok.Builder;
import lombok.Value;

/**
 * Pool-wide aggregates. {@code totalCollateral} and {@code totalBorrowed} track the sums of the
 * matching position fields; {@code availableLiquidity} is borrow-token balance free to lend and
 * is never mixed with collateral.
 */
@Value
@Builder(toBuilder = true)
public class PoolState {

    @Builder.Default
    BigInteger totalCollateral = BigInteger.ZERO;

    @Builder.Default
    BigInteger totalBorrowed = BigInteger.ZERO;

    @Builder.Default
    BigInteger availableLiquidity = BigInteger.ZERO;

    int interestRateBps;

    public static PoolState initial(int interestRateBps) {
        return PoolState.builder().interestRateBps(interestRateBps).build();
    }
}
