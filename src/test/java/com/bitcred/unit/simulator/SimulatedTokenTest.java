package com.bitcred.unit.simulator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.bitcred.exception.BusinessException;
import com.bitcred.exception.ValidationException;
import com.bitcred.ledger.LedgerTransactionManager;
import com.bitcred.simulator.SimulatedToken;
import com.bitcred.simulator.SimulatedTokenRegistry;
import com.bitcred.support.RecordingEventPublisher;
import com.bitcred.token.TokenGateway;
import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SimulatedTokenTest {

    private static final String ALICE = "0xa";
    private static final String BOB = "0xb";
    private static final String POOL = "0xfeed";

    private LedgerTransactionManager transactionManager;
    private SimulatedToken token;

    @BeforeEach
    void setUp() {
        transactionManager = new LedgerTransactionManager(new RecordingEventPublisher());
        token = new SimulatedToken("USDC", transactionManager);
        token.mint(ALICE, BigInteger.valueOf(1_000));
    }

    @Test
    @DisplayName("transfer moves the bound account's balance")
    void transfer() {
        TokenGateway alice = token.gatewayFor(ALICE);

        assertThat(alice.transfer(BOB, BigInteger.valueOf(300))).isTrue();

        assertThat(token.balanceOf(ALICE)).isEqualTo(BigInteger.valueOf(700));
        assertThat(token.balanceOf(BOB)).isEqualTo(BigInteger.valueOf(300));
    }

    @Test
    @DisplayName("transfer beyond balance returns false and changes nothing")
    void transferInsufficient() {
        assertThat(token.gatewayFor(BOB).transfer(ALICE, BigInteger.ONE)).isFalse();
        assertThat(token.balanceOf(ALICE)).isEqualTo(BigInteger.valueOf(1_000));
    }

    @Test
    @DisplayName("transferFrom spends the spender's allowance")
    void transferFromSpendsAllowance() {
        token.approve(ALICE, POOL, BigInteger.valueOf(500));
        TokenGateway pool = token.gatewayFor(POOL);

        assertThat(pool.transferFrom(ALICE, POOL, BigInteger.valueOf(400))).isTrue();
        assertThat(pool.transferFrom(ALICE, POOL, BigInteger.valueOf(101))).isFalse();

        assertThat(token.allowance(ALICE, POOL)).isEqualTo(BigInteger.valueOf(100));
        assertThat(token.balanceOf(POOL)).isEqualTo(BigInteger.valueOf(400));
    }

    @Test
    @DisplayName("transferFrom without allowance returns false")
    void transferFromWithoutAllowance() {
        assertThat(token.gatewayFor(POOL).transferFrom(ALICE, POOL, BigInteger.TEN)).isFalse();
        assertThat(token.balanceOf(ALICE)).isEqualTo(BigInteger.valueOf(1_000));
    }

    @Test
    @DisplayName("Token movements are undone when the enclosing operation fails")
    void rolledBackWithOperation() {
        token.approve(ALICE, POOL, BigInteger.valueOf(500));

        assertThatThrownBy(() -> transactionManager.run("failing", () -> {
                    token.gatewayFor(POOL).transferFrom(ALICE, POOL, BigInteger.valueOf(500));
                    throw new IllegalStateException("later step failed");
                }))
                .isInstanceOf(IllegalStateException.class);

        assertThat(token.balanceOf(ALICE)).isEqualTo(BigInteger.valueOf(1_000));
        assertThat(token.balanceOf(POOL)).isZero();
        assertThat(token.allowance(ALICE, POOL)).isEqualTo(BigInteger.valueOf(500));
    }

    @Test
    @DisplayName("Negative mint is rejected")
    void negativeMint() {
        assertThatThrownBy(() -> token.mint(ALICE, BigInteger.valueOf(-1))).isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Registry resolves symbols case-insensitively and rejects unknown ones")
    void registryLookup() {
        SimulatedTokenRegistry registry = new SimulatedTokenRegistry(List.of(token));

        assertThat(registry.get("usdc")).isSameAs(token);
        assertThat(registry.symbols()).containsExactly("USDC");
        assertThatThrownBy(() -> registry.get("DOGE")).isInstanceOf(BusinessException.class);
    }
}
