package com.bitcred.simulator;

import com.bitcred.exception.ErrorCode;
import com.bitcred.exception.ValidationException;
import com.bitcred.ledger.JournaledMap;
import com.bitcred.ledger.LedgerTransactionManager;
import com.bitcred.token.TokenGateway;
import java.math.BigInteger;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory fungible token used in place of an external token contract.
 *
 * <p>Balances and allowances are journaled, so a transfer made inside a ledger operation that
 * later fails is undone together with the ledger writes. Transfers never throw on insufficient
 * funds; they return {@code false} and leave state untouched, the way a token collaborator
 * reports rejection.
 */
public class SimulatedToken {

    private static final Logger log = LoggerFactory.getLogger(SimulatedToken.class);

    private final String symbol;
    private final LedgerTransactionManager transactionManager;
    private final JournaledMap<String, BigInteger> balances;

    /** Keyed by {@code owner|spender}. */
    private final JournaledMap<String, BigInteger> allowances;

    public SimulatedToken(String symbol, LedgerTransactionManager transactionManager) {
        this.symbol = symbol;
        this.transactionManager = transactionManager;
        this.balances = new JournaledMap<>(transactionManager);
        this.allowances = new JournaledMap<>(transactionManager);
    }

    public String getSymbol() {
        return symbol;
    }

    public void mint(String account, BigInteger amount) {
        requireNonNegative(amount);
        transactionManager.run("mint", () -> {
            balances.put(account, balanceOf(account).add(amount));
            log.info("Minted {} {} to {}", amount, symbol, account);
        });
    }

    /** Sets, not adds to, the allowance of {@code spender} over {@code owner}'s balance. */
    public void approve(String owner, String spender, BigInteger amount) {
        requireNonNegative(amount);
        transactionManager.run("approve", () -> {
            allowances.put(allowanceKey(owner, spender), amount);
            log.debug("Approved {} {} for spender {} by {}", amount, symbol, spender, owner);
        });
    }

    public BigInteger balanceOf(String account) {
        return transactionManager.read("balanceOf", () -> balances.getOrDefault(account, BigInteger.ZERO));
    }

    public BigInteger allowance(String owner, String spender) {
        return transactionManager.read(
                "allowance", () -> allowances.getOrDefault(allowanceKey(owner, spender), BigInteger.ZERO));
    }

    public Map<String, BigInteger> balances() {
        return transactionManager.read("balances", balances::snapshot);
    }

    /**
     * Transfer capability acting as {@code account}: {@code transfer} spends its balance,
     * {@code transferFrom} spends allowances granted to it.
     */
    public TokenGateway gatewayFor(String account) {
        return new TokenGateway() {
            @Override
            public String getSymbol() {
                return symbol;
            }

            @Override
            public boolean transfer(String to, BigInteger amount) {
                return move(account, to, amount, null);
            }

            @Override
            public boolean transferFrom(String from, String to, BigInteger amount) {
                return move(from, to, amount, account);
            }
        };
    }

    private boolean move(String from, String to, BigInteger amount, String spender) {
        if (amount == null || amount.signum() < 0) {
            return false;
        }
        return transactionManager.execute("transfer", () -> {
            BigInteger fromBalance = balanceOf(from);
            if (fromBalance.compareTo(amount) < 0) {
                log.debug("{} transfer rejected: balance {} of {} below {}", symbol, fromBalance, from, amount);
                return false;
            }
            if (spender != null) {
                BigInteger allowed = allowance(from, spender);
                if (allowed.compareTo(amount) < 0) {
                    log.debug("{} transfer rejected: allowance {} of {} for {} below {}",
                            symbol, allowed, from, spender, amount);
                    return false;
                }
                allowances.put(allowanceKey(from, spender), allowed.subtract(amount));
            }
            balances.put(from, fromBalance.subtract(amount));
            balances.put(to, balanceOf(to).add(amount));
            return true;
        });
    }

    private static String allowanceKey(String owner, String spender) {
        return owner + "|" + spender;
    }

    private static void requireNonNegative(BigInteger amount) {
        if (amount == null || amount.signum() < 0) {
            throw new ValidationException(ErrorCode.INVALID_AMOUNT, "Amount must not be negative");
        }
    }
}
