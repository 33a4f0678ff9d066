package com.bitcred.observability;

import com.bitcred.event.LendingEvent;
import com.bitcred.event.LendingEventType;
import com.bitcred.event.LiquidationEvent;
import com.bitcred.event.ReconciliationEvent;
import com.bitcred.event.ScoreRegisteredEvent;
import com.bitcred.event.ScoreUpdatedEvent;
import com.bitcred.lending.LendingPool;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Registers and updates Micrometer metrics for the ledger.
 *
 * <ul>
 *   <li><b>ledger.scores.registered</b> / <b>ledger.scores.updated</b> (counters)</li>
 *   <li><b>ledger.loans.borrowed</b> / <b>ledger.loans.repaid</b> (counters, one per operation)</li>
 *   <li><b>ledger.liquidations</b> (counter)</li>
 *   <li><b>ledger.reconciliation.mismatches</b> (counter)</li>
 *   <li><b>ledger.pool.available.liquidity</b>, <b>ledger.pool.total.borrowed</b>,
 *       <b>ledger.pool.total.collateral</b> (gauges over {@link LendingPool})</li>
 * </ul>
 *
 * <p>Gauges are polled by Micrometer on scrape. Counters move only on committed events, since
 * ledger events are published after commit.
 */
@Service
public class LedgerMetricsService {

    private static final Logger log = LoggerFactory.getLogger(LedgerMetricsService.class);

    private final Counter scoresRegisteredCounter;
    private final Counter scoresUpdatedCounter;
    private final Counter loansBorrowedCounter;
    private final Counter loansRepaidCounter;
    private final Counter liquidationsCounter;
    private final Counter reconciliationMismatchCounter;

    public LedgerMetricsService(MeterRegistry meterRegistry, LendingPool lendingPool) {
        this.scoresRegisteredCounter = Counter.builder("ledger.scores.registered")
                .description("Scores registered in the registry")
                .register(meterRegistry);

        this.scoresUpdatedCounter = Counter.builder("ledger.scores.updated")
                .description("Score updates accepted after cooldown")
                .register(meterRegistry);

        this.loansBorrowedCounter = Counter.builder("ledger.loans.borrowed")
                .description("Committed borrow operations")
                .register(meterRegistry);

        this.loansRepaidCounter = Counter.builder("ledger.loans.repaid")
                .description("Committed repay operations")
                .register(meterRegistry);

        this.liquidationsCounter = Counter.builder("ledger.liquidations")
                .description("Positions liquidated")
                .register(meterRegistry);

        this.reconciliationMismatchCounter = Counter.builder("ledger.reconciliation.mismatches")
                .description("Reconciliation runs where collateral sums disagreed with the pool")
                .register(meterRegistry);

        meterRegistry.gauge("ledger.pool.available.liquidity", lendingPool, pool -> pool.getAvailableLiquidity()
                .doubleValue());
        meterRegistry.gauge("ledger.pool.total.borrowed", lendingPool, pool -> pool.getPoolState()
                .getTotalBorrowed()
                .doubleValue());
        meterRegistry.gauge("ledger.pool.total.collateral", lendingPool, pool -> pool.getPoolState()
                .getTotalCollateral()
                .doubleValue());
    }

    @EventListener
    @Order(20)
    public void onScoreRegistered(ScoreRegisteredEvent event) {
        scoresRegisteredCounter.increment();
    }

    @EventListener
    @Order(20)
    public void onScoreUpdated(ScoreUpdatedEvent event) {
        scoresUpdatedCounter.increment();
    }

    @EventListener
    @Order(20)
    public void onLendingEvent(LendingEvent event) {
        if (event.getEventType() == LendingEventType.BORROWED) {
            loansBorrowedCounter.increment();
        } else if (event.getEventType() == LendingEventType.REPAID) {
            loansRepaidCounter.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onLiquidation(LiquidationEvent event) {
        liquidationsCounter.increment();
    }

    @EventListener
    @Order(20)
    public void onReconciliationEvent(ReconciliationEvent event) {
        if (!event.getResult().isCollateralMatched()) {
            reconciliationMismatchCounter.increment();
            log.warn("Reconciliation mismatch counted: difference={}", event.getResult().getCollateralDifference());
        }
    }
}
