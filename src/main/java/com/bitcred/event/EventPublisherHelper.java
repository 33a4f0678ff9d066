package com.bitcred.event;

import com.bitcred.domain.enums.ScoreTier;
import com.bitcred.ledger.LedgerTransactionManager;
import java.math.BigInteger;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods for every ledger event.
 *
 * <p>Events are handed to {@link LedgerTransactionManager#raise}, which buffers them until the
 * running operation commits. Listeners therefore only ever see committed state changes.
 */
@Component
public class EventPublisherHelper {

    private final LedgerTransactionManager transactionManager;

    public EventPublisherHelper(LedgerTransactionManager transactionManager) {
        this.transactionManager = transactionManager;
    }

    // ---- Registry ----

    public void publishScoreRegistered(Object source, String scoreId, String owner, int score, long timestamp) {
        ScoreTier tier = ScoreTier.forScore(score);
        transactionManager.raise(new ScoreRegisteredEvent(
                source, scoreId, owner, score, tier.getLevel(), tier.getCollateralRatioBps(), timestamp));
    }

    public void publishScoreUpdated(Object source, String scoreId, int oldScore, int newScore, long timestamp) {
        transactionManager.raise(new ScoreUpdatedEvent(source, scoreId, oldScore, newScore, timestamp));
    }

    public void publishScorerApproved(Object source, String scorer, long timestamp) {
        transactionManager.raise(new ScorerEvent(source, ScorerEventType.APPROVED, scorer, timestamp));
    }

    public void publishScorerRevoked(Object source, String scorer, long timestamp) {
        transactionManager.raise(new ScorerEvent(source, ScorerEventType.REVOKED, scorer, timestamp));
    }

    // ---- Lending ----

    public void publishCollateralDeposited(
            Object source, String user, BigInteger amount, String scoreId, long timestamp) {
        transactionManager.raise(new LendingEvent(
                source, LendingEventType.COLLATERAL_DEPOSITED, user, amount, scoreId, null, timestamp));
    }

    public void publishBorrowed(Object source, String user, BigInteger amount, int ratioBps, long timestamp) {
        transactionManager.raise(
                new LendingEvent(source, LendingEventType.BORROWED, user, amount, null, ratioBps, timestamp));
    }

    public void publishRepaid(Object source, String user, BigInteger amount, long timestamp) {
        transactionManager.raise(new LendingEvent(source, LendingEventType.REPAID, user, amount, timestamp));
    }

    public void publishCollateralWithdrawn(Object source, String user, BigInteger amount, long timestamp) {
        transactionManager.raise(
                new LendingEvent(source, LendingEventType.COLLATERAL_WITHDRAWN, user, amount, timestamp));
    }

    public void publishLiquidityAdded(Object source, String provider, BigInteger amount, long timestamp) {
        transactionManager.raise(
                new LendingEvent(source, LendingEventType.LIQUIDITY_ADDED, provider, amount, timestamp));
    }

    public void publishLiquidated(
            Object source,
            String user,
            String liquidator,
            BigInteger debtRepaid,
            BigInteger collateralSeized,
            long timestamp) {
        transactionManager.raise(
                new LiquidationEvent(source, user, liquidator, debtRepaid, collateralSeized, timestamp));
    }
}
