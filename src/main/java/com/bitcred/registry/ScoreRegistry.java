package com.bitcred.registry;

import com.bitcred.auth.AccessControl;
import com.bitcred.domain.enums.ScoreTier;
import com.bitcred.domain.model.ScoreRecord;
import com.bitcred.event.EventPublisherHelper;
import com.bitcred.exception.BusinessException;
import com.bitcred.exception.ErrorCode;
import com.bitcred.exception.UnauthorizedException;
import com.bitcred.exception.ValidationException;
import com.bitcred.ledger.JournaledMap;
import com.bitcred.ledger.LedgerTransactionManager;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps hashed Bitcoin addresses to credibility scores and the collateral tier they unlock.
 *
 * <p>Record lifecycle:
 * <ul>
 *   <li><b>Unregistered</b> (score 0) to <b>Registered</b> via {@link #registerScore}, one way</li>
 *   <li><b>Registered</b> to itself via {@link #updateScore}, at most once per 30-day cooldown</li>
 * </ul>
 * Records are never deleted; score 0 is the only representation of "no record".
 *
 * <p>Authorization: registration needs an approved scorer. Updates accept either the record owner
 * or an approved scorer. Scorer approval is admin-only.
 *
 * <p>Every public mutation runs as one {@link LedgerTransactionManager} unit and reads the clock
 * once.
 */
public class ScoreRegistry implements ScoreOracle {

    private static final Logger log = LoggerFactory.getLogger(ScoreRegistry.class);

    /** 30 days. */
    public static final long UPDATE_COOLDOWN_SECONDS = 2_592_000L;

    /** Owner reported for identifiers that were never registered. */
    public static final String ZERO_ACCOUNT = "0x0";

    private final Clock clock;
    private final LedgerTransactionManager transactionManager;
    private final EventPublisherHelper eventPublisherHelper;
    private final AccessControl accessControl;
    private final JournaledMap<String, ScoreRecord> records;

    public ScoreRegistry(
            String admin,
            Clock clock,
            LedgerTransactionManager transactionManager,
            EventPublisherHelper eventPublisherHelper) {
        this.clock = clock;
        this.transactionManager = transactionManager;
        this.eventPublisherHelper = eventPublisherHelper;
        this.accessControl = new AccessControl(admin, transactionManager);
        this.records = new JournaledMap<>(transactionManager);
        transactionManager.run("initializeRegistry", accessControl::bootstrap);
        log.info("Score registry initialized: admin={}", admin);
    }

    // ========================
    // MUTATIONS
    // ========================

    /**
     * Registers a score for an identifier that has none yet.
     *
     * <p>Checks, in order: score within 650-850, caller is an approved scorer, identifier not yet
     * registered.
     *
     * @param proof opaque proof payload, accepted for later verification and not interpreted here
     * @return the stored record
     */
    public ScoreRecord registerScore(String caller, String scoreId, int score, List<String> proof) {
        return transactionManager.execute("registerScore", () -> {
            requireScoreId(scoreId);
            requireInRange(score);
            if (!accessControl.isApprovedScorer(caller)) {
                throw new UnauthorizedException(ErrorCode.NOT_AUTHORIZED, "Caller is not an approved scorer");
            }
            if (getScore(scoreId) != 0) {
                throw new BusinessException(
                        ErrorCode.ALREADY_REGISTERED, "Score already registered for " + scoreId, Map.of("id", scoreId));
            }

            long now = clock.instant().getEpochSecond();
            ScoreRecord scoreRecord = ScoreRecord.builder()
                    .scoreId(scoreId)
                    .score(score)
                    .owner(caller)
                    .lastUpdated(now)
                    .build();
            records.put(scoreId, scoreRecord);
            eventPublisherHelper.publishScoreRegistered(this, scoreId, caller, score, now);

            log.info(
                    "Score registered: id={}, score={}, tier={}, owner={}, proofElements={}",
                    scoreId,
                    score,
                    ScoreTier.forScore(score).getLevel(),
                    caller,
                    proof == null ? 0 : proof.size());
            return scoreRecord;
        });
    }

    /**
     * Replaces the score of a registered identifier. Owner stays unchanged.
     *
     * <p>Checks, in order: score within 650-850, identifier registered, caller is the owner or
     * an approved scorer, at least {@link #UPDATE_COOLDOWN_SECONDS} elapsed since the last update.
     */
    public ScoreRecord updateScore(String caller, String scoreId, int newScore, List<String> proof) {
        return transactionManager.execute("updateScore", () -> {
            requireScoreId(scoreId);
            requireInRange(newScore);
            ScoreRecord existing = records.get(scoreId)
                    .filter(r -> r.getScore() != 0)
                    .orElseThrow(() -> new BusinessException(
                            ErrorCode.NOT_REGISTERED, "No score registered for " + scoreId, Map.of("id", scoreId)));

            if (!existing.getOwner().equals(caller) && !accessControl.isApprovedScorer(caller)) {
                throw new UnauthorizedException(
                        ErrorCode.NOT_AUTHORIZED, "Caller is neither the score owner nor an approved scorer");
            }

            long now = clock.instant().getEpochSecond();
            long eligibleAt = existing.getLastUpdated() + UPDATE_COOLDOWN_SECONDS;
            if (now < eligibleAt) {
                throw new BusinessException(
                        ErrorCode.COOLDOWN_ACTIVE,
                        "Score update cooldown active for " + scoreId,
                        Map.of("id", scoreId, "eligibleAt", eligibleAt, "remainingSeconds", eligibleAt - now));
            }

            ScoreRecord updated = existing.withScore(newScore).withLastUpdated(now);
            records.put(scoreId, updated);
            eventPublisherHelper.publishScoreUpdated(this, scoreId, existing.getScore(), newScore, now);

            log.info(
                    "Score updated: id={}, {} -> {}, by={}, proofElements={}",
                    scoreId,
                    existing.getScore(),
                    newScore,
                    caller,
                    proof == null ? 0 : proof.size());
            return updated;
        });
    }

    public void approveScorer(String caller, String account) {
        transactionManager.run("approveScorer", () -> {
            accessControl.requireAdmin(caller);
            requireAccount(account);
            accessControl.approve(account);
            eventPublisherHelper.publishScorerApproved(this, account, clock.instant().getEpochSecond());
            log.info("Scorer approved: {}", account);
        });
    }

    public void revokeScorer(String caller, String account) {
        transactionManager.run("revokeScorer", () -> {
            accessControl.requireAdmin(caller);
            requireAccount(account);
            accessControl.revoke(account);
            eventPublisherHelper.publishScorerRevoked(this, account, clock.instant().getEpochSecond());
            log.info("Scorer revoked: {}", account);
        });
    }

    // ========================
    // QUERIES
    // ========================

    @Override
    public int getScore(String scoreId) {
        return transactionManager.read("getScore", () -> records.get(scoreId).map(ScoreRecord::getScore).orElse(0));
    }

    public String getOwner(String scoreId) {
        return transactionManager.read(
                "getOwner", () -> records.get(scoreId).map(ScoreRecord::getOwner).orElse(ZERO_ACCOUNT));
    }

    public long getLastUpdated(String scoreId) {
        return transactionManager.read(
                "getLastUpdated", () -> records.get(scoreId).map(ScoreRecord::getLastUpdated).orElse(0L));
    }

    @Override
    public int getCollateralRatio(String scoreId) {
        return ScoreTier.forScore(getScore(scoreId)).getCollateralRatioBps();
    }

    /**
     * @return 0 for unregistered identifiers, otherwise 1 (best) to 4
     */
    public int getScoreTier(String scoreId) {
        return ScoreTier.forScore(getScore(scoreId)).getLevel();
    }

    public Optional<ScoreRecord> findRecord(String scoreId) {
        return transactionManager.read("findRecord", () -> records.get(scoreId));
    }

    public boolean isApprovedScorer(String account) {
        return transactionManager.read("isApprovedScorer", () -> accessControl.isApprovedScorer(account));
    }

    public String getAdmin() {
        return accessControl.getAdmin();
    }

    public int getRegisteredCount() {
        return transactionManager.read("getRegisteredCount", records::size);
    }

    // ========================
    // INTERNALS
    // ========================

    private static void requireInRange(int score) {
        if (!ScoreTier.isInRange(score)) {
            throw new ValidationException(
                    ErrorCode.INVALID_RANGE,
                    "Score must be between " + ScoreTier.MIN_SCORE + " and " + ScoreTier.MAX_SCORE,
                    Map.of("score", score));
        }
    }

    private static void requireScoreId(String scoreId) {
        if (scoreId == null || scoreId.isBlank()) {
            throw new ValidationException(ErrorCode.VALIDATION_ERROR, "Score identifier is required");
        }
    }

    private static void requireAccount(String account) {
        if (account == null || account.isBlank()) {
            throw new ValidationException(ErrorCode.VALIDATION_ERROR, "Account is required");
        }
    }
}
