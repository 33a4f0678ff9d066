package com.bitcred.domain.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Registry entry for one hashed Bitcoin address.
 *
 * <p>A stored record always has a non-zero score; score 0 is how the registry represents an
 * identifier that was never registered. The owner is fixed at registration; score and
 * lastUpdated change on every accepted update.
 */
@Value
@Builder
@With
public class ScoreRecord {

    /** Opaque identifier (felt hex of the hashed Bitcoin address). */
    String scoreId;

    int score;

    /** Account that registered the score. */
    String owner;

    /** Epoch seconds of registration or the last accepted update. */
    long lastUpdated;
}
