package com.bitcred.config;

import com.bitcred.auth.CallerAccountFilter;
import com.bitcred.event.EventPublisherHelper;
import com.bitcred.ledger.LedgerTransactionManager;
import com.bitcred.lending.LendingPool;
import com.bitcred.registry.ScoreRegistry;
import com.bitcred.simulator.SimulatedToken;
import com.bitcred.simulator.SimulatedTokenRegistry;
import java.time.Clock;
import java.util.List;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the ledger components from application.properties.
 *
 * <p>Both tokens are {@link SimulatedToken}s; the pool gets gateways bound to its own account.
 *
 * <p>Configured admin and pool accounts are validated and canonicalized like caller accounts.
 *
 * <p>Properties prefix: {@code bitcred.*}
 */
@Configuration
public class LedgerConfig {

    @Bean
    public Clock ledgerClock() {
        return Clock.systemUTC();
    }

    @Bean
    public ScoreRegistry scoreRegistry(
            @Value("${bitcred.registry.admin:0xad}") String admin,
            Clock ledgerClock,
            LedgerTransactionManager transactionManager,
            EventPublisherHelper eventPublisherHelper) {
        return new ScoreRegistry(
                CallerAccountFilter.parseAccount(admin), ledgerClock, transactionManager, eventPublisherHelper);
    }

    @Bean
    public SimulatedToken collateralToken(
            @Value("${bitcred.tokens.collateral-symbol:WBTC}") String symbol,
            LedgerTransactionManager transactionManager) {
        return new SimulatedToken(symbol, transactionManager);
    }

    @Bean
    public SimulatedToken borrowToken(
            @Value("${bitcred.tokens.borrow-symbol:USDC}") String symbol,
            LedgerTransactionManager transactionManager) {
        return new SimulatedToken(symbol, transactionManager);
    }

    @Bean
    public SimulatedTokenRegistry simulatedTokenRegistry(
            @Qualifier("collateralToken") SimulatedToken collateralToken,
            @Qualifier("borrowToken") SimulatedToken borrowToken) {
        return new SimulatedTokenRegistry(List.of(collateralToken, borrowToken));
    }

    @Bean
    public LendingPool lendingPool(
            @Value("${bitcred.pool.admin:0xad}") String admin,
            @Value("${bitcred.pool.account:0xfeed}") String poolAccount,
            @Value("${bitcred.pool.interest-rate-bps:500}") int interestRateBps,
            ScoreRegistry scoreRegistry,
            @Qualifier("collateralToken") SimulatedToken collateralToken,
            @Qualifier("borrowToken") SimulatedToken borrowToken,
            Clock ledgerClock,
            LedgerTransactionManager transactionManager,
            EventPublisherHelper eventPublisherHelper) {
        String pool = CallerAccountFilter.parseAccount(poolAccount);
        return new LendingPool(
                CallerAccountFilter.parseAccount(admin),
                pool,
                scoreRegistry,
                collateralToken.gatewayFor(pool),
                borrowToken.gatewayFor(pool),
                interestRateBps,
                ledgerClock,
                transactionManager,
                eventPublisherHelper);
    }
}
