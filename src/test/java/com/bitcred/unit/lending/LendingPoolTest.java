package com.bitcred.unit.lending;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.bitcred.domain.model.PoolState;
import com.bitcred.domain.model.PositionSnapshot;
import com.bitcred.event.EventPublisherHelper;
import com.bitcred.event.LedgerEvent;
import com.bitcred.event.LendingEvent;
import com.bitcred.event.LendingEventType;
import com.bitcred.event.LiquidationEvent;
import com.bitcred.exception.BaseException;
import com.bitcred.exception.ErrorCategory;
import com.bitcred.exception.ErrorCode;
import com.bitcred.exception.TokenTransferException;
import com.bitcred.ledger.LedgerTransactionManager;
import com.bitcred.lending.InterestCalculator;
import com.bitcred.lending.LendingPool;
import com.bitcred.registry.ScoreOracle;
import com.bitcred.support.MutableClock;
import com.bitcred.support.RecordingEventPublisher;
import com.bitcred.token.TokenGateway;
import java.math.BigInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Tests for LendingPool with a mocked score oracle and mocked token gateways.
 *
 * <p>Covers validation order, capacity and liquidity checks, interest settlement, repayment
 * edge cases, liquidation and atomic rollback when a token transfer is rejected.
 */
@ExtendWith(MockitoExtension.class)
class LendingPoolTest {

    private static final String ADMIN = "0xad";
    private static final String POOL = "0xfeed";
    private static final String USER = "0xbeef";
    private static final String LIQUIDATOR = "0x11c";
    private static final String SCORE_ID = "0x1234";
    private static final long T0 = 1_700_000_000L;
    private static final long YEAR = InterestCalculator.SECONDS_PER_YEAR;

    @Mock
    private ScoreOracle scoreOracle;

    @Mock
    private TokenGateway collateralToken;

    @Mock
    private TokenGateway borrowToken;

    private MutableClock clock;
    private RecordingEventPublisher publisher;
    private LendingPool lendingPool;

    @BeforeEach
    void setUp() {
        lenient().when(collateralToken.getSymbol()).thenReturn("WBTC");
        lenient().when(borrowToken.getSymbol()).thenReturn("USDC");
        clock = new MutableClock(T0);
        publisher = new RecordingEventPublisher();
        LedgerTransactionManager transactionManager = new LedgerTransactionManager(publisher);
        lendingPool = new LendingPool(
                ADMIN,
                POOL,
                scoreOracle,
                collateralToken,
                borrowToken,
                500,
                clock,
                transactionManager,
                new EventPublisherHelper(transactionManager));
    }

    private static BigInteger big(long value) {
        return BigInteger.valueOf(value);
    }

    private static ErrorCode codeOf(Throwable throwable) {
        return ((BaseException) throwable).getErrorCode();
    }

    /** Tier 1 score (ratio 11000), 11000 collateral, 50000 liquidity. */
    private void fundAndDeposit() {
        lenient().when(scoreOracle.getScore(SCORE_ID)).thenReturn(820);
        lenient().when(scoreOracle.getCollateralRatio(SCORE_ID)).thenReturn(11000);
        lenient().when(borrowToken.transferFrom(anyString(), eq(POOL), any())).thenReturn(true);
        lenient().when(borrowToken.transfer(anyString(), any())).thenReturn(true);
        lenient().when(collateralToken.transferFrom(anyString(), eq(POOL), any())).thenReturn(true);
        lenient().when(collateralToken.transfer(anyString(), any())).thenReturn(true);

        lendingPool.addLiquidity(ADMIN, big(50_000));
        lendingPool.depositCollateral(USER, big(11_000), SCORE_ID);
        publisher.clear();
    }

    @Nested
    @DisplayName("Deposit collateral")
    class DepositCollateral {

        @Test
        @DisplayName("Zero and negative amounts fail with INVALID_AMOUNT before any collaborator call")
        void invalidAmount() {
            assertThatThrownBy(() -> lendingPool.depositCollateral(USER, BigInteger.ZERO, SCORE_ID))
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.INVALID_AMOUNT));
            assertThatThrownBy(() -> lendingPool.depositCollateral(USER, big(-1), SCORE_ID))
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.INVALID_AMOUNT));

            verify(scoreOracle, never()).getScore(anyString());
        }

        @Test
        @DisplayName("Identifier without a registered score fails with NO_VALID_SCORE")
        void noValidScore() {
            when(scoreOracle.getScore(SCORE_ID)).thenReturn(0);

            assertThatThrownBy(() -> lendingPool.depositCollateral(USER, big(100), SCORE_ID))
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.NO_VALID_SCORE));
            verify(collateralToken, never()).transferFrom(anyString(), anyString(), any());
        }

        @Test
        @DisplayName("Successful deposit links the score, caches the ratio and updates totals")
        void success() {
            when(scoreOracle.getScore(SCORE_ID)).thenReturn(760);
            when(scoreOracle.getCollateralRatio(SCORE_ID)).thenReturn(11500);
            when(collateralToken.transferFrom(USER, POOL, big(1000))).thenReturn(true);

            lendingPool.depositCollateral(USER, big(1000), SCORE_ID);

            PositionSnapshot position = lendingPool.getPosition(USER);
            assertThat(position.getCollateral()).isEqualTo(big(1000));
            assertThat(position.getLinkedScoreId()).isEqualTo(SCORE_ID);
            assertThat(position.getCachedRatioBps()).isEqualTo(11500);
            assertThat(lendingPool.getPoolState().getTotalCollateral()).isEqualTo(big(1000));
            assertThat(publisher.eventsOfType(LendingEvent.class))
                    .singleElement()
                    .satisfies(event -> {
                        assertThat(event.getEventType()).isEqualTo(LendingEventType.COLLATERAL_DEPOSITED);
                        assertThat(event.getPayload()).containsEntry("id", SCORE_ID);
                    });
        }

        @Test
        @DisplayName("Rejected token pull leaves no trace")
        void transferRejected() {
            when(scoreOracle.getScore(SCORE_ID)).thenReturn(760);
            when(scoreOracle.getCollateralRatio(SCORE_ID)).thenReturn(11500);
            when(collateralToken.transferFrom(USER, POOL, big(1000))).thenReturn(false);

            assertThatThrownBy(() -> lendingPool.depositCollateral(USER, big(1000), SCORE_ID))
                    .isInstanceOf(TokenTransferException.class)
                    .satisfies(e -> assertThat(((BaseException) e).getCategory()).isEqualTo(ErrorCategory.COLLABORATOR));

            assertThat(lendingPool.getCollateral(USER)).isZero();
            assertThat(lendingPool.getPoolState().getTotalCollateral()).isZero();
            assertThat(lendingPool.getStoredPositions()).isEmpty();
            assertThat(publisher.getEvents()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Borrow")
    class Borrow {

        @Test
        @DisplayName("Borrowing without a linked score fails with NO_SCORE_LINKED")
        void noScoreLinked() {
            assertThatThrownBy(() -> lendingPool.borrow(USER, big(1)))
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.NO_SCORE_LINKED));
        }

        @Test
        @DisplayName("Collateral 11000 at ratio 11000 allows exactly 10000")
        void capacityBoundary() {
            fundAndDeposit();

            assertThatThrownBy(() -> lendingPool.borrow(USER, big(10_001)))
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.EXCEEDS_CAPACITY));

            lendingPool.borrow(USER, big(10_000));

            assertThat(lendingPool.getBorrowed(USER)).isEqualTo(big(10_000));
            assertThat(lendingPool.getPosition(USER).getBorrowTimestamp()).isEqualTo(T0);
            PoolState pool = lendingPool.getPoolState();
            assertThat(pool.getTotalBorrowed()).isEqualTo(big(10_000));
            assertThat(pool.getAvailableLiquidity()).isEqualTo(big(40_000));
            assertThat(publisher.eventsOfType(LendingEvent.class))
                    .singleElement()
                    .satisfies(event -> assertThat(event.getPayload()).containsEntry("ratio", 11000));
        }

        @Test
        @DisplayName("Capacity uses the live ratio and refreshes the cached one")
        void liveRatio() {
            fundAndDeposit();
            when(scoreOracle.getCollateralRatio(SCORE_ID)).thenReturn(13000);

            assertThatThrownBy(() -> lendingPool.borrow(USER, big(8_462)))
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.EXCEEDS_CAPACITY));

            lendingPool.borrow(USER, big(8_461));

            assertThat(lendingPool.getPosition(USER).getCachedRatioBps()).isEqualTo(13000);
        }

        @Test
        @DisplayName("Borrow beyond pool liquidity fails with INSUFFICIENT_LIQUIDITY")
        void insufficientLiquidity() {
            when(scoreOracle.getScore(SCORE_ID)).thenReturn(820);
            when(scoreOracle.getCollateralRatio(SCORE_ID)).thenReturn(11000);
            when(collateralToken.transferFrom(USER, POOL, big(11_000))).thenReturn(true);
            lendingPool.depositCollateral(USER, big(11_000), SCORE_ID);

            assertThatThrownBy(() -> lendingPool.borrow(USER, big(100)))
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.INSUFFICIENT_LIQUIDITY));
        }

        @Test
        @DisplayName("Rejected payout rolls back principal and pool totals")
        void payoutRejected() {
            fundAndDeposit();
            when(borrowToken.transfer(USER, big(5_000))).thenReturn(false);

            assertThatThrownBy(() -> lendingPool.borrow(USER, big(5_000)))
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.TRANSFER_FAILED));

            assertThat(lendingPool.getBorrowed(USER)).isZero();
            assertThat(lendingPool.getPosition(USER).getBorrowTimestamp()).isZero();
            assertThat(lendingPool.getPoolState().getTotalBorrowed()).isZero();
            assertThat(lendingPool.getAvailableLiquidity()).isEqualTo(big(50_000));
            assertThat(publisher.getEvents()).isEmpty();
        }

        @Test
        @DisplayName("A second borrow settles accrued interest into principal")
        void settlesInterest() {
            fundAndDeposit();
            lendingPool.borrow(USER, big(1_000));
            clock.advanceSeconds(YEAR);

            assertThat(lendingPool.getTotalDebt(USER)).isEqualTo(big(1_050));

            lendingPool.borrow(USER, big(100));

            assertThat(lendingPool.getBorrowed(USER)).isEqualTo(big(1_150));
            assertThat(lendingPool.getPosition(USER).getBorrowTimestamp()).isEqualTo(T0 + YEAR);
            assertThat(lendingPool.getPoolState().getTotalBorrowed()).isEqualTo(big(1_100));
        }
    }

    @Nested
    @DisplayName("Repay")
    class Repay {

        @Test
        @DisplayName("Repaying without debt fails with NO_DEBT")
        void noDebt() {
            assertThatThrownBy(() -> lendingPool.repay(USER, big(10)))
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.NO_DEBT));
        }

        @Test
        @DisplayName("Zero amount fails with INVALID_AMOUNT")
        void zeroAmount() {
            assertThatThrownBy(() -> lendingPool.repay(USER, BigInteger.ZERO))
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.INVALID_AMOUNT));
        }

        @Test
        @DisplayName("Overpayment is capped at the accrued debt and clears the position")
        void overpayCapped() {
            fundAndDeposit();
            lendingPool.borrow(USER, big(1_000));
            clock.advanceSeconds(YEAR);

            BigInteger repaid = lendingPool.repay(USER, big(5_000));

            assertThat(repaid).isEqualTo(big(1_050));
            verify(borrowToken).transferFrom(USER, POOL, big(1_050));
            assertThat(lendingPool.getBorrowed(USER)).isZero();
            assertThat(lendingPool.getPosition(USER).getBorrowTimestamp()).isZero();
            assertThat(lendingPool.getTotalDebt(USER)).isZero();
            PoolState pool = lendingPool.getPoolState();
            assertThat(pool.getTotalBorrowed()).isZero();
            assertThat(pool.getAvailableLiquidity()).isEqualTo(big(50_050));
        }

        @Test
        @DisplayName("Partial repayment reduces principal and restarts accrual")
        void partialRepay() {
            fundAndDeposit();
            lendingPool.borrow(USER, big(1_000));
            clock.advanceSeconds(YEAR);

            lendingPool.repay(USER, big(400));

            assertThat(lendingPool.getBorrowed(USER)).isEqualTo(big(600));
            assertThat(lendingPool.getPosition(USER).getBorrowTimestamp()).isEqualTo(T0 + YEAR);
            assertThat(lendingPool.getPoolState().getTotalBorrowed()).isEqualTo(big(600));
        }

        @Test
        @DisplayName("Repayment covering stored principal but not interest still clears the position")
        void coversPrincipalOnly() {
            fundAndDeposit();
            lendingPool.borrow(USER, big(1_000));
            clock.advanceSeconds(YEAR);

            lendingPool.repay(USER, big(1_000));

            assertThat(lendingPool.getBorrowed(USER)).isZero();
            assertThat(lendingPool.getTotalDebt(USER)).isZero();
        }

        @Test
        @DisplayName("Rejected pull changes nothing")
        void pullRejected() {
            fundAndDeposit();
            lendingPool.borrow(USER, big(1_000));
            when(borrowToken.transferFrom(USER, POOL, big(500))).thenReturn(false);

            assertThatThrownBy(() -> lendingPool.repay(USER, big(500)))
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.TRANSFER_FAILED));

            assertThat(lendingPool.getBorrowed(USER)).isEqualTo(big(1_000));
            assertThat(lendingPool.getAvailableLiquidity()).isEqualTo(big(49_000));
        }
    }

    @Nested
    @DisplayName("Withdraw collateral")
    class WithdrawCollateral {

        @Test
        @DisplayName("Outstanding debt blocks withdrawal")
        void debtOutstanding() {
            fundAndDeposit();
            lendingPool.borrow(USER, big(1));

            assertThatThrownBy(() -> lendingPool.withdrawCollateral(USER, big(1)))
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.DEBT_OUTSTANDING));
        }

        @Test
        @DisplayName("Withdrawal above deposit fails with EXCEEDS_DEPOSITED")
        void exceedsDeposited() {
            fundAndDeposit();

            assertThatThrownBy(() -> lendingPool.withdrawCollateral(USER, big(11_001)))
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.EXCEEDS_DEPOSITED));
        }

        @Test
        @DisplayName("Debt-free withdrawal returns collateral and updates totals")
        void success() {
            fundAndDeposit();

            lendingPool.withdrawCollateral(USER, big(4_000));

            verify(collateralToken).transfer(USER, big(4_000));
            assertThat(lendingPool.getCollateral(USER)).isEqualTo(big(7_000));
            assertThat(lendingPool.getPoolState().getTotalCollateral()).isEqualTo(big(7_000));
            assertThat(publisher.eventsOfType(LendingEvent.class))
                    .extracting(LendingEvent::getEventType)
                    .containsExactly(LendingEventType.COLLATERAL_WITHDRAWN);
        }
    }

    @Nested
    @DisplayName("Liquidate")
    class Liquidate {

        @Test
        @DisplayName("A debt-free position reports 99999 and cannot be liquidated")
        void debtFreeHealthy() {
            fundAndDeposit();

            assertThat(lendingPool.getHealthFactor(USER)).isEqualTo(big(99_999));
            assertThatThrownBy(() -> lendingPool.liquidate(LIQUIDATOR, USER))
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.POSITION_HEALTHY));
        }

        @Test
        @DisplayName("Health factor exactly 10000 is not liquidatable")
        void thresholdNotLiquidatable() {
            fundAndDeposit();
            lendingPool.borrow(USER, big(10_000));
            clock.advanceSeconds(2 * YEAR);

            assertThat(lendingPool.getHealthFactor(USER)).isEqualTo(big(10_000));
            assertThatThrownBy(() -> lendingPool.liquidate(LIQUIDATOR, USER))
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.POSITION_HEALTHY));
        }

        @Test
        @DisplayName("Unhealthy position is closed: liquidator pays debt, receives collateral")
        void liquidates() {
            fundAndDeposit();
            lendingPool.borrow(USER, big(10_000));
            clock.advanceSeconds(3 * YEAR);
            publisher.clear();

            assertThat(lendingPool.getPosition(USER).isLiquidatable()).isTrue();

            BigInteger seized = lendingPool.liquidate(LIQUIDATOR, USER);

            assertThat(seized).isEqualTo(big(11_000));
            verify(borrowToken).transferFrom(LIQUIDATOR, POOL, big(11_500));
            verify(collateralToken).transfer(LIQUIDATOR, big(11_000));

            PositionSnapshot position = lendingPool.getPosition(USER);
            assertThat(position.getCollateral()).isZero();
            assertThat(position.getPrincipal()).isZero();
            assertThat(position.getBorrowTimestamp()).isZero();

            PoolState pool = lendingPool.getPoolState();
            assertThat(pool.getTotalCollateral()).isZero();
            assertThat(pool.getTotalBorrowed()).isZero();
            assertThat(pool.getAvailableLiquidity()).isEqualTo(big(51_500));

            assertThat(publisher.eventsOfType(LiquidationEvent.class))
                    .singleElement()
                    .satisfies(event -> assertThat(event.getPayload())
                            .containsEntry("liquidator", LIQUIDATOR)
                            .containsEntry("debt_repaid", big(11_500))
                            .containsEntry("collateral_seized", big(11_000)));
        }

        @Test
        @DisplayName("Rejected collateral payout rolls back the debt pull")
        void payoutRejected() {
            fundAndDeposit();
            lendingPool.borrow(USER, big(10_000));
            clock.advanceSeconds(3 * YEAR);
            when(collateralToken.transfer(LIQUIDATOR, big(11_000))).thenReturn(false);

            assertThatThrownBy(() -> lendingPool.liquidate(LIQUIDATOR, USER))
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.TRANSFER_FAILED));

            assertThat(lendingPool.getCollateral(USER)).isEqualTo(big(11_000));
            assertThat(lendingPool.getBorrowed(USER)).isEqualTo(big(10_000));
            assertThat(lendingPool.getAvailableLiquidity()).isEqualTo(big(40_000));
        }
    }

    @Nested
    @DisplayName("Add liquidity")
    class AddLiquidity {

        @Test
        @DisplayName("Only the admin can add liquidity")
        void adminOnly() {
            assertThatThrownBy(() -> lendingPool.addLiquidity(USER, big(100)))
                    .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.ADMIN_ONLY));
            verify(borrowToken, never()).transferFrom(anyString(), anyString(), any());
        }

        @Test
        @DisplayName("Admin top-up increases available liquidity and emits LiquidityAdded")
        void success() {
            when(borrowToken.transferFrom(ADMIN, POOL, big(700))).thenReturn(true);

            lendingPool.addLiquidity(ADMIN, big(700));

            assertThat(lendingPool.getAvailableLiquidity()).isEqualTo(big(700));
            assertThat(publisher.eventsOfType(LedgerEvent.class))
                    .singleElement()
                    .satisfies(event -> {
                        assertThat(event.getName()).isEqualTo("LiquidityAdded");
                        assertThat(event.getPayload()).containsEntry("provider", ADMIN);
                    });
        }
    }

    @Test
    @DisplayName("Max borrow is zero until a score is linked")
    void maxBorrowWithoutScore() {
        assertThat(lendingPool.getMaxBorrow(USER)).isZero();
        assertThat(lendingPool.getHealthFactor(USER)).isEqualTo(big(99_999));
        assertThat(lendingPool.getPosition(USER).isLiquidatable()).isFalse();
    }

    @Test
    @DisplayName("Reads do not change state")
    void readsIdempotent() {
        fundAndDeposit();
        lendingPool.borrow(USER, big(2_000));
        clock.advanceSeconds(YEAR / 2);

        BigInteger first = lendingPool.getTotalDebt(USER);
        lendingPool.getPosition(USER);
        lendingPool.getMaxBorrow(USER);

        assertThat(lendingPool.getTotalDebt(USER)).isEqualTo(first).isEqualTo(big(2_050));
        assertThat(lendingPool.getBorrowed(USER)).isEqualTo(big(2_000));
    }
}
