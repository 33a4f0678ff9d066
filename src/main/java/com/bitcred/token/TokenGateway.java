package com.bitcred.token;

import java.math.BigInteger;

/**
 * Transfer capability of a fungible token, bound to the account that invokes it (the pool).
 *
 * <p>A {@code false} return means the token rejected the movement; the caller must abort the
 * whole ledger operation.
 */
public interface TokenGateway {

    /** Token symbol, used in logs and error details. */
    String getSymbol();

    /** Moves {@code amount} from the bound account to {@code to}. */
    boolean transfer(String to, BigInteger amount);

    /** Moves {@code amount} from {@code from} to {@code to}, spending the bound account's allowance. */
    boolean transferFrom(String from, String to, BigInteger amount);
}
