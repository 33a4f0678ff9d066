package com.bitcred.unit.lending;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.bitcred.lending.InterestCalculator;
import java.math.BigInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class InterestCalculatorTest {

    private static final long T0 = 1_700_000_000L;

    @Nested
    @DisplayName("Accrued debt")
    class AccruedDebt {

        @Test
        @DisplayName("1000 at 500 bps for one year accrues to 1050")
        void oneYear() {
            BigInteger debt = InterestCalculator.accruedDebt(
                    BigInteger.valueOf(1000), T0, 500, T0 + InterestCalculator.SECONDS_PER_YEAR);

            assertThat(debt).isEqualTo(BigInteger.valueOf(1050));
        }

        @Test
        @DisplayName("Interest is floored")
        void floored() {
            // 1000 * 500 * 1 / 315360000000 < 1
            assertThat(InterestCalculator.accruedDebt(BigInteger.valueOf(1000), T0, 500, T0 + 1))
                    .isEqualTo(BigInteger.valueOf(1000));
        }

        @Test
        @DisplayName("Zero timestamp means no interest")
        void zeroTimestamp() {
            assertThat(InterestCalculator.accruedDebt(BigInteger.valueOf(1000), 0L, 500, T0))
                    .isEqualTo(BigInteger.valueOf(1000));
        }

        @Test
        @DisplayName("Large principals do not overflow")
        void largePrincipal() {
            BigInteger principal = BigInteger.TEN.pow(30);

            BigInteger debt =
                    InterestCalculator.accruedDebt(principal, T0, 500, T0 + InterestCalculator.SECONDS_PER_YEAR);

            assertThat(debt).isEqualTo(principal.add(principal.divide(BigInteger.valueOf(20))));
        }
    }

    @Test
    @DisplayName("Max borrow is collateral * 10000 / ratio, floored")
    void maxBorrow() {
        assertThat(InterestCalculator.maxBorrow(BigInteger.valueOf(11000), 11000)).isEqualTo(BigInteger.valueOf(10000));
        assertThat(InterestCalculator.maxBorrow(BigInteger.valueOf(100), 13000)).isEqualTo(BigInteger.valueOf(76));
    }

    @Test
    @DisplayName("Non-positive ratio is rejected")
    void nonPositiveRatio() {
        assertThatThrownBy(() -> InterestCalculator.maxBorrow(BigInteger.ONE, 0))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Health factor is 99999 without debt, otherwise collateral * 10000 / debt")
    void healthFactor() {
        assertThat(InterestCalculator.healthFactor(BigInteger.valueOf(500), BigInteger.ZERO))
                .isEqualTo(BigInteger.valueOf(99999));
        assertThat(InterestCalculator.healthFactor(BigInteger.valueOf(11000), BigInteger.valueOf(10000)))
                .isEqualTo(BigInteger.valueOf(11000));
        assertThat(InterestCalculator.isLiquidatable(BigInteger.valueOf(9999), 10000)).isTrue();
        assertThat(InterestCalculator.isLiquidatable(BigInteger.valueOf(10000), 10000)).isFalse();
    }

    @Test
    @DisplayName("Seized collateral never exceeds collateral held")
    void seizeCapped() {
        assertThat(InterestCalculator.seizeAmount(BigInteger.valueOf(1000), 500)).isEqualTo(BigInteger.valueOf(1000));
        assertThat(InterestCalculator.seizeAmount(BigInteger.ZERO, 500)).isEqualTo(BigInteger.ZERO);
    }
}
