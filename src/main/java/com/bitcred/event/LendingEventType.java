package com.bitcred.event;

/**
 * Kind of position or pool change carried by a {@link LendingEvent}.
 */
public enum LendingEventType {

    /** Collateral pulled from the borrower; carries the linked score identifier. */
    COLLATERAL_DEPOSITED("CollateralDeposited"),

    /** Borrow token sent to the borrower; carries the live ratio used for the capacity check. */
    BORROWED("Borrowed"),

    /** Borrow token pulled from the borrower against accrued debt. */
    REPAID("Repaid"),

    /** Collateral returned to a debt-free borrower. */
    COLLATERAL_WITHDRAWN("CollateralWithdrawn"),

    /** Admin funded the pool's lendable liquidity. */
    LIQUIDITY_ADDED("LiquidityAdded");

    private final String eventName;

    LendingEventType(String eventName) {
        this.eventName = eventName;
    }

    public String getEventName() {
        return eventName;
    }
}
