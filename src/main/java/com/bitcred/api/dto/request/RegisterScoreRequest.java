package com.bitcred.api.dto.request;

import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for registering a score. Either {@code scoreId} or {@code btcAddress} must be
 * given; an address is hashed into an identifier before it reaches the registry.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterScoreRequest {

    /** Registry identifier (0x-prefixed hash). Takes precedence over btcAddress. */
    private String scoreId;

    /** Raw Bitcoin address, hashed server-side when scoreId is absent. */
    private String btcAddress;

    @NotNull
    private Integer score;

    /** Opaque proof elements, recorded but not verified. */
    private List<String> proof;
}
