package com.bitcred.api.dto.response;

import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PositionResponse {

    private String user;
    private BigInteger collateral;
    private BigInteger principal;
    private BigInteger totalDebt;
    private BigInteger maxBorrow;
    private BigInteger healthFactor;
    private int cachedRatioBps;
    private String linkedScoreId;
    private long borrowTimestamp;
    private boolean liquidatable;
    private long evaluatedAt;
}
