package com.bitcred.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for depositing collateral against a registered score.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DepositCollateralRequest {

    /** Collateral token amount in base units. */
    @NotNull
    private BigInteger amount;

    @NotBlank
    private String scoreId;
}
