package com.bitcred.lending;

import com.bitcred.auth.AccessControl;
import com.bitcred.domain.enums.ScoreTier;
import com.bitcred.domain.model.PoolState;
import com.bitcred.domain.model.Position;
import com.bitcred.domain.model.PositionSnapshot;
import com.bitcred.event.EventPublisherHelper;
import com.bitcred.exception.BusinessException;
import com.bitcred.exception.ErrorCode;
import com.bitcred.exception.TokenTransferException;
import com.bitcred.exception.ValidationException;
import com.bitcred.ledger.JournaledMap;
import com.bitcred.ledger.JournaledValue;
import com.bitcred.ledger.LedgerTransactionManager;
import com.bitcred.registry.ScoreOracle;
import com.bitcred.token.TokenGateway;
import java.math.BigInteger;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Score-tiered collateralized lending ledger.
 *
 * <p>Each borrower has one {@link Position}; pool-wide aggregates live in {@link PoolState}.
 * Every mutation updates the position and the matching aggregate in the same
 * {@link LedgerTransactionManager} unit, so {@code sum(collateral) == totalCollateral} holds
 * after every committed operation.
 *
 * <p>Token movements go through two {@link TokenGateway}s acting as the pool account. A gateway
 * returning {@code false} raises {@link TokenTransferException}, which rolls back every write
 * made by the operation so far.
 *
 * <p>The collateral ratio is always re-read from the {@link ScoreOracle} for capacity decisions;
 * {@link Position#getCachedRatioBps()} is informational.
 */
public class LendingPool {

    private static final Logger log = LoggerFactory.getLogger(LendingPool.class);

    /** Health factor below this value makes a position liquidatable. */
    public static final int LIQUIDATION_THRESHOLD_BPS = 10_000;

    public static final int LIQUIDATION_BONUS_BPS = 500;

    private final String poolAccount;
    private final ScoreOracle scoreOracle;
    private final TokenGateway collateralToken;
    private final TokenGateway borrowToken;
    private final Clock clock;
    private final LedgerTransactionManager transactionManager;
    private final EventPublisherHelper eventPublisherHelper;
    private final AccessControl accessControl;

    private final JournaledMap<String, Position> positions;
    private final JournaledValue<PoolState> poolState;

    public LendingPool(
            String admin,
            String poolAccount,
            ScoreOracle scoreOracle,
            TokenGateway collateralToken,
            TokenGateway borrowToken,
            int interestRateBps,
            Clock clock,
            LedgerTransactionManager transactionManager,
            EventPublisherHelper eventPublisherHelper) {
        if (interestRateBps < 0) {
            throw new IllegalArgumentException("Interest rate must not be negative: " + interestRateBps);
        }
        this.poolAccount = poolAccount;
        this.scoreOracle = scoreOracle;
        this.collateralToken = collateralToken;
        this.borrowToken = borrowToken;
        this.clock = clock;
        this.transactionManager = transactionManager;
        this.eventPublisherHelper = eventPublisherHelper;
        this.accessControl = new AccessControl(admin, transactionManager);
        this.positions = new JournaledMap<>(transactionManager);
        this.poolState = new JournaledValue<>(transactionManager, PoolState.initial(interestRateBps));
        log.info(
                "Lending pool initialized: admin={}, account={}, collateral={}, borrow={}, rate={}bps",
                admin,
                poolAccount,
                collateralToken.getSymbol(),
                borrowToken.getSymbol(),
                interestRateBps);
    }

    // ========================
    // MUTATIONS
    // ========================

    /**
     * Pulls collateral from the caller and links the caller's position to {@code scoreId}.
     * The identifier must carry a registered score.
     */
    public Position depositCollateral(String caller, BigInteger amount, String scoreId) {
        return transactionManager.execute("depositCollateral", () -> {
            requirePositive(amount);
            int score = scoreOracle.getScore(scoreId);
            if (score < ScoreTier.MIN_SCORE) {
                throw new BusinessException(
                        ErrorCode.NO_VALID_SCORE,
                        "No valid score registered for " + scoreId,
                        Map.of("id", String.valueOf(scoreId), "score", score));
            }
            int ratioBps = readRatio(scoreId);
            long now = now();

            pull(collateralToken, caller, amount);

            Position position = positionOf(caller);
            Position updated = position.toBuilder()
                    .collateral(position.getCollateral().add(amount))
                    .linkedScoreId(scoreId)
                    .cachedRatioBps(ratioBps)
                    .build();
            positions.put(caller, updated);
            poolState.update(p -> p.toBuilder()
                    .totalCollateral(p.getTotalCollateral().add(amount))
                    .build());

            eventPublisherHelper.publishCollateralDeposited(this, caller, amount, scoreId, now);
            log.info("Collateral deposited: user={}, amount={}, id={}, ratio={}", caller, amount, scoreId, ratioBps);
            return updated;
        });
    }

    /**
     * Borrows against the caller's collateral at the live ratio. Interest accrued so far is
     * settled into principal before {@code amount} is added.
     */
    public Position borrow(String caller, BigInteger amount) {
        return transactionManager.execute("borrow", () -> {
            requirePositive(amount);
            Position position = positionOf(caller);
            if (!position.hasLinkedScore()) {
                throw new BusinessException(ErrorCode.NO_SCORE_LINKED, "No score linked to position of " + caller);
            }

            int ratioBps = readRatio(position.getLinkedScoreId());
            long now = now();
            PoolState pool = poolState.get();
            BigInteger maxBorrow = InterestCalculator.maxBorrow(position.getCollateral(), ratioBps);
            BigInteger currentDebt = accrued(position, pool, now);

            if (currentDebt.add(amount).compareTo(maxBorrow) > 0) {
                throw new BusinessException(
                        ErrorCode.EXCEEDS_CAPACITY,
                        "Borrow exceeds capacity",
                        Map.of("requested", amount, "currentDebt", currentDebt, "maxBorrow", maxBorrow));
            }
            if (amount.compareTo(pool.getAvailableLiquidity()) > 0) {
                throw new BusinessException(
                        ErrorCode.INSUFFICIENT_LIQUIDITY,
                        "Insufficient pool liquidity",
                        Map.of("requested", amount, "available", pool.getAvailableLiquidity()));
            }

            Position updated = position.toBuilder()
                    .principal(currentDebt.add(amount))
                    .borrowTimestamp(now)
                    .cachedRatioBps(ratioBps)
                    .build();
            positions.put(caller, updated);
            poolState.set(pool.toBuilder()
                    .totalBorrowed(pool.getTotalBorrowed().add(amount))
                    .availableLiquidity(pool.getAvailableLiquidity().subtract(amount))
                    .build());

            push(borrowToken, caller, amount);

            eventPublisherHelper.publishBorrowed(this, caller, amount, ratioBps, now);
            log.info(
                    "Borrowed: user={}, amount={}, principal={}, ratio={}",
                    caller,
                    amount,
                    updated.getPrincipal(),
                    ratioBps);
            return updated;
        });
    }

    /**
     * Repays up to the accrued debt; any excess over the debt is not pulled.
     *
     * <p>If the repaid amount covers the stored principal the position is cleared, including any
     * interest accrued on top of it. Otherwise the principal shrinks and the accrual restarts now.
     *
     * @return the amount actually pulled from the caller
     */
    public BigInteger repay(String caller, BigInteger amount) {
        return transactionManager.execute("repay", () -> {
            requirePositive(amount);
            Position position = positionOf(caller);
            long now = now();
            PoolState pool = poolState.get();
            BigInteger totalDebt = accrued(position, pool, now);
            if (totalDebt.signum() == 0) {
                throw new BusinessException(ErrorCode.NO_DEBT, "No outstanding debt for " + caller);
            }

            BigInteger repayAmount = amount.min(totalDebt);
            pull(borrowToken, caller, repayAmount);

            Position updated;
            if (repayAmount.compareTo(position.getPrincipal()) >= 0) {
                updated = position.toBuilder()
                        .principal(BigInteger.ZERO)
                        .borrowTimestamp(0L)
                        .build();
            } else {
                updated = position.toBuilder()
                        .principal(position.getPrincipal().subtract(repayAmount))
                        .borrowTimestamp(now)
                        .build();
            }
            positions.put(caller, updated);
            poolState.set(pool.toBuilder()
                    .totalBorrowed(pool.getTotalBorrowed().subtract(repayAmount.min(pool.getTotalBorrowed())))
                    .availableLiquidity(pool.getAvailableLiquidity().add(repayAmount))
                    .build());

            eventPublisherHelper.publishRepaid(this, caller, repayAmount, now);
            log.info("Repaid: user={}, amount={}, remainingPrincipal={}", caller, repayAmount, updated.getPrincipal());
            return repayAmount;
        });
    }

    /**
     * Returns collateral to the caller. Only allowed once the position carries no debt.
     */
    public Position withdrawCollateral(String caller, BigInteger amount) {
        return transactionManager.execute("withdrawCollateral", () -> {
            requirePositive(amount);
            Position position = positionOf(caller);
            long now = now();
            BigInteger totalDebt = accrued(position, poolState.get(), now);
            if (totalDebt.signum() != 0) {
                throw new BusinessException(
                        ErrorCode.DEBT_OUTSTANDING,
                        "Debt must be repaid before withdrawing collateral",
                        Map.of("totalDebt", totalDebt));
            }
            if (amount.compareTo(position.getCollateral()) > 0) {
                throw new BusinessException(
                        ErrorCode.EXCEEDS_DEPOSITED,
                        "Withdrawal exceeds deposited collateral",
                        Map.of("requested", amount, "deposited", position.getCollateral()));
            }

            push(collateralToken, caller, amount);

            Position updated = position.toBuilder()
                    .collateral(position.getCollateral().subtract(amount))
                    .build();
            positions.put(caller, updated);
            poolState.update(p -> p.toBuilder()
                    .totalCollateral(p.getTotalCollateral().subtract(amount))
                    .build());

            eventPublisherHelper.publishCollateralWithdrawn(this, caller, amount, now);
            log.info("Collateral withdrawn: user={}, amount={}", caller, amount);
            return updated;
        });
    }

    /**
     * Closes an unhealthy position. Anyone may call. The liquidator pays the full accrued debt
     * and receives the collateral plus bonus, capped at the collateral held.
     *
     * @return the amount of collateral seized
     */
    public BigInteger liquidate(String caller, String user) {
        return transactionManager.execute("liquidate", () -> {
            Position position = positionOf(user);
            long now = now();
            PoolState pool = poolState.get();
            BigInteger totalDebt = accrued(position, pool, now);
            BigInteger collateral = position.getCollateral();
            BigInteger healthFactor = InterestCalculator.healthFactor(collateral, totalDebt);
            if (!InterestCalculator.isLiquidatable(healthFactor, LIQUIDATION_THRESHOLD_BPS)) {
                throw new BusinessException(
                        ErrorCode.POSITION_HEALTHY,
                        "Position of " + user + " is not liquidatable",
                        Map.of("user", user, "healthFactor", healthFactor));
            }

            pull(borrowToken, caller, totalDebt);
            BigInteger seized = InterestCalculator.seizeAmount(collateral, LIQUIDATION_BONUS_BPS);
            push(collateralToken, caller, seized);

            positions.put(user, position.toBuilder()
                    .collateral(BigInteger.ZERO)
                    .principal(BigInteger.ZERO)
                    .borrowTimestamp(0L)
                    .build());
            poolState.set(pool.toBuilder()
                    .totalCollateral(pool.getTotalCollateral().subtract(collateral))
                    .totalBorrowed(pool.getTotalBorrowed().subtract(totalDebt.min(pool.getTotalBorrowed())))
                    .availableLiquidity(pool.getAvailableLiquidity().add(totalDebt))
                    .build());

            eventPublisherHelper.publishLiquidated(this, user, caller, totalDebt, seized, now);
            log.warn(
                    "Position liquidated: user={}, liquidator={}, debtRepaid={}, seized={}, healthFactor={}",
                    user,
                    caller,
                    totalDebt,
                    seized,
                    healthFactor);
            return seized;
        });
    }

    /** Admin funds the pool with borrow token. */
    public PoolState addLiquidity(String caller, BigInteger amount) {
        return transactionManager.execute("addLiquidity", () -> {
            accessControl.requireAdmin(caller);
            requirePositive(amount);
            long now = now();

            pull(borrowToken, caller, amount);
            PoolState updated = poolState.update(p -> p.toBuilder()
                    .availableLiquidity(p.getAvailableLiquidity().add(amount))
                    .build());

            eventPublisherHelper.publishLiquidityAdded(this, caller, amount, now);
            log.info("Liquidity added: amount={}, available={}", amount, updated.getAvailableLiquidity());
            return updated;
        });
    }

    // ========================
    // QUERIES
    // ========================

    public BigInteger getCollateral(String user) {
        return transactionManager.read("getCollateral", () -> positionOf(user).getCollateral());
    }

    /** Stored principal, without interest accrued since the last touch. */
    public BigInteger getBorrowed(String user) {
        return transactionManager.read("getBorrowed", () -> positionOf(user).getPrincipal());
    }

    public BigInteger getTotalDebt(String user) {
        return transactionManager.read("getTotalDebt", () -> accrued(positionOf(user), poolState.get(), now()));
    }

    /**
     * Borrow capacity at the live ratio. Zero while the position has no linked score.
     */
    public BigInteger getMaxBorrow(String user) {
        return transactionManager.read("getMaxBorrow", () -> {
            Position position = positionOf(user);
            if (!position.hasLinkedScore()) {
                return BigInteger.ZERO;
            }
            return InterestCalculator.maxBorrow(position.getCollateral(), readRatio(position.getLinkedScoreId()));
        });
    }

    public BigInteger getHealthFactor(String user) {
        return transactionManager.read("getHealthFactor", () -> {
            Position position = positionOf(user);
            return InterestCalculator.healthFactor(
                    position.getCollateral(), accrued(position, poolState.get(), now()));
        });
    }

    public PositionSnapshot getPosition(String user) {
        return transactionManager.read("getPosition", () -> snapshot(positionOf(user), now()));
    }

    public List<PositionSnapshot> getPositions() {
        return transactionManager.read("getPositions", () -> {
            long now = now();
            return positions.values().stream().map(p -> snapshot(p, now)).toList();
        });
    }

    /** Raw stored positions, used by reconciliation. */
    public List<Position> getStoredPositions() {
        return transactionManager.read("getStoredPositions", positions::values);
    }

    public BigInteger getAvailableLiquidity() {
        return transactionManager.read("getAvailableLiquidity", () -> poolState.get().getAvailableLiquidity());
    }

    public PoolState getPoolState() {
        return transactionManager.read("getPoolState", poolState::get);
    }

    public String getAdmin() {
        return accessControl.getAdmin();
    }

    public String getPoolAccount() {
        return poolAccount;
    }

    public String getCollateralSymbol() {
        return collateralToken.getSymbol();
    }

    public String getBorrowSymbol() {
        return borrowToken.getSymbol();
    }

    // ========================
    // INTERNALS
    // ========================

    private PositionSnapshot snapshot(Position position, long now) {
        BigInteger totalDebt = accrued(position, poolState.get(), now);
        BigInteger healthFactor = InterestCalculator.healthFactor(position.getCollateral(), totalDebt);
        BigInteger maxBorrow = position.hasLinkedScore()
                ? InterestCalculator.maxBorrow(position.getCollateral(), readRatio(position.getLinkedScoreId()))
                : BigInteger.ZERO;
        return PositionSnapshot.builder()
                .user(position.getUser())
                .collateral(position.getCollateral())
                .principal(position.getPrincipal())
                .totalDebt(totalDebt)
                .maxBorrow(maxBorrow)
                .healthFactor(healthFactor)
                .cachedRatioBps(position.getCachedRatioBps())
                .linkedScoreId(position.getLinkedScoreId())
                .borrowTimestamp(position.getBorrowTimestamp())
                .liquidatable(InterestCalculator.isLiquidatable(healthFactor, LIQUIDATION_THRESHOLD_BPS))
                .evaluatedAt(now)
                .build();
    }

    private Position positionOf(String user) {
        return positions.get(user).orElseGet(() -> Position.empty(user));
    }

    private static BigInteger accrued(Position position, PoolState pool, long now) {
        return InterestCalculator.accruedDebt(
                position.getPrincipal(), position.getBorrowTimestamp(), pool.getInterestRateBps(), now);
    }

    private int readRatio(String scoreId) {
        int ratioBps = scoreOracle.getCollateralRatio(scoreId);
        InterestCalculator.requirePositiveRatio(ratioBps);
        return ratioBps;
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }

    private void pull(TokenGateway token, String from, BigInteger amount) {
        if (!token.transferFrom(from, poolAccount, amount)) {
            log.warn("Token pull rejected: token={}, from={}, amount={}", token.getSymbol(), from, amount);
            throw new TokenTransferException(token.getSymbol(), from, poolAccount, amount);
        }
    }

    private void push(TokenGateway token, String to, BigInteger amount) {
        if (!token.transfer(to, amount)) {
            log.warn("Token push rejected: token={}, to={}, amount={}", token.getSymbol(), to, amount);
            throw new TokenTransferException(token.getSymbol(), poolAccount, to, amount);
        }
    }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException(
                    ErrorCode.INVALID_AMOUNT,
                    "Amount must be positive",
                    Map.of("amount", String.valueOf(amount)));
        }
    }
}
