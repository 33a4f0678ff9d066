package com.bitcred.reconciliation;

import com.bitcred.domain.model.PoolState;
import com.bitcred.domain.model.Position;
import com.bitcred.domain.model.ReconciliationResult;
import com.bitcred.event.ReconciliationEvent;
import com.bitcred.ledger.LedgerTransactionManager;
import com.bitcred.lending.InterestCalculator;
import com.bitcred.lending.LendingPool;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Checks that pool aggregates agree with the positions they summarize.
 *
 * <p>Runs on a fixed schedule ({@code bitcred.reconciliation.interval-ms}) and on manual API
 * trigger. Positions and pool state are read under the ledger lock so the comparison sees a
 * single committed state. Every run publishes a {@link ReconciliationEvent}.
 *
 * <ul>
 *   <li>{@code sum(collateral) != totalCollateral}: mismatch, logged at WARN</li>
 *   <li>{@code sum(principal) != totalBorrowed}: expected once interest has been settled into
 *       principal, reported as drift at DEBUG</li>
 * </ul>
 */
@Service
public class PoolReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(PoolReconciliationService.class);

    private final LendingPool lendingPool;
    private final LedgerTransactionManager transactionManager;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    public PoolReconciliationService(
            LendingPool lendingPool,
            LedgerTransactionManager transactionManager,
            ApplicationEventPublisher applicationEventPublisher,
            Clock clock) {
        this.lendingPool = lendingPool;
        this.transactionManager = transactionManager;
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
    }

    @Scheduled(
            fixedRateString = "${bitcred.reconciliation.interval-ms:60000}",
            initialDelayString = "${bitcred.reconciliation.interval-ms:60000}")
    public void scheduledReconciliation() {
        reconcile("SCHEDULED");
    }

    /**
     * Triggered manually via API. Returns result for the response body.
     */
    public ReconciliationResult manualReconcile() {
        return reconcile("MANUAL");
    }

    public ReconciliationResult reconcile(String trigger) {
        long startTime = System.currentTimeMillis();
        log.debug("Pool reconciliation started: trigger={}", trigger);

        ReconciliationResult result = transactionManager.read("reconcile", () -> snapshot(trigger));
        result.setDurationMs(System.currentTimeMillis() - startTime);

        if (!result.isCollateralMatched()) {
            log.warn(
                    "Pool reconciliation mismatch: trigger={}, sum(collateral)={}, totalCollateral={}, difference={}",
                    trigger,
                    result.getSumCollateral(),
                    result.getTotalCollateral(),
                    result.getCollateralDifference());
        } else {
            log.info(
                    "Pool reconciliation completed: trigger={}, positions={}, collateral={}, principalDrift={}",
                    trigger,
                    result.getPositionCount(),
                    result.getTotalCollateral(),
                    result.getPrincipalDrift());
        }
        if (result.getPrincipalDrift().signum() != 0) {
            log.debug(
                    "Principal drift {}: sum(principal)={}, totalBorrowed={}",
                    result.getPrincipalDrift(),
                    result.getSumPrincipal(),
                    result.getTotalBorrowed());
        }

        applicationEventPublisher.publishEvent(new ReconciliationEvent(this, result));
        return result;
    }

    private ReconciliationResult snapshot(String trigger) {
        Instant now = clock.instant();
        long epochSeconds = now.getEpochSecond();
        List<Position> positions = lendingPool.getStoredPositions();
        PoolState pool = lendingPool.getPoolState();

        BigInteger sumCollateral = BigInteger.ZERO;
        BigInteger sumPrincipal = BigInteger.ZERO;
        BigInteger sumAccrued = BigInteger.ZERO;
        for (Position position : positions) {
            sumCollateral = sumCollateral.add(position.getCollateral());
            sumPrincipal = sumPrincipal.add(position.getPrincipal());
            sumAccrued = sumAccrued.add(InterestCalculator.accruedDebt(
                    position.getPrincipal(), position.getBorrowTimestamp(), pool.getInterestRateBps(), epochSeconds));
        }

        return ReconciliationResult.builder()
                .timestamp(now)
                .trigger(trigger)
                .positionCount(positions.size())
                .sumCollateral(sumCollateral)
                .totalCollateral(pool.getTotalCollateral())
                .sumPrincipal(sumPrincipal)
                .sumAccruedDebt(sumAccrued)
                .totalBorrowed(pool.getTotalBorrowed())
                .principalDrift(pool.getTotalBorrowed().subtract(sumPrincipal))
                .build();
    }
}
