package com.bitcred.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for setting a simulated token allowance from the caller to a spender. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApproveRequest {

    @NotBlank
    private String spender;

    @NotNull
    private BigInteger amount;
}
