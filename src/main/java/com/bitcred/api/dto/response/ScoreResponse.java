package com.bitcred.api.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for a registry record. Unregistered identifiers come back with score 0,
 * tier 0, ratio 15000 and owner 0x0 rather than 404, matching the registry's read semantics.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreResponse {

    private String scoreId;
    private int score;
    private int tier;
    private int collateralRatioBps;
    private String owner;
    private long lastUpdated;
    private boolean registered;
}
