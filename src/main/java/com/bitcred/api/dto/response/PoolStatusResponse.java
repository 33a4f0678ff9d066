package com.bitcred.api.dto.response;

import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for pool aggregates. Token symbols, accounts and position count are set after
 * mapping since they are not part of {@link com.bitcred.domain.model.PoolState}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PoolStatusResponse {

    private BigInteger totalCollateral;
    private BigInteger totalBorrowed;
    private BigInteger availableLiquidity;
    private int interestRateBps;

    private String collateralSymbol;
    private String borrowSymbol;
    private String poolAccount;
    private String admin;
    private int positionCount;
}
