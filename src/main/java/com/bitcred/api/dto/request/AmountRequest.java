package com.bitcred.api.dto.request;

import jakarta.validation.constraints.NotNull;
import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO carrying a single token amount (borrow, repay, withdraw, add liquidity).
 * Positivity is checked by the ledger so a zero amount reports INVALID_AMOUNT.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AmountRequest {

    @NotNull
    private BigInteger amount;
}
