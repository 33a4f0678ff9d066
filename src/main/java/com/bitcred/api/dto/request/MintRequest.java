package com.bitcred.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for minting simulated tokens. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MintRequest {

    @NotBlank
    private String account;

    @NotNull
    private BigInteger amount;
}
