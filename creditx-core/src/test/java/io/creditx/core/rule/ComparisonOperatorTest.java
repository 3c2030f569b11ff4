package io.creditx.core.rule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ComparisonOperatorTest {

    @Test
    void shouldCompareAgainstThreshold() {
        assertThat(ComparisonOperator.GT.test(61, 60)).isTrue();
        assertThat(ComparisonOperator.GT.test(60, 60)).isFalse();
        assertThat(ComparisonOperator.GTE.test(0.8, 0.8)).isTrue();
        assertThat(ComparisonOperator.LT.test(1.5, 2)).isTrue();
        assertThat(ComparisonOperator.LTE.test(60, 60)).isTrue();
        assertThat(ComparisonOperator.EQ.test(3, 3)).isTrue();
        assertThat(ComparisonOperator.EQ.test(3.0001, 3)).isFalse();
    }

    @Test
    void shouldTreatNegativeZeroAsEqualToZero() {
        assertThat(ComparisonOperator.EQ.test(-0.0, 0.0)).isTrue();
        assertThat(ComparisonOperator.EQ.test(0.0, -0.0)).isTrue();
    }

    @Test
    void shouldParseNamesAndSymbols() {
        assertThat(ComparisonOperator.parse(">=")).isEqualTo(ComparisonOperator.GTE);
        assertThat(ComparisonOperator.parse("lte")).isEqualTo(ComparisonOperator.LTE);
        assertThat(ComparisonOperator.parse(" == ")).isEqualTo(ComparisonOperator.EQ);
    }

    @Test
    void shouldRejectUnknownOperator() {
        assertThatThrownBy(() -> ComparisonOperator.parse("=>"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("=>");
    }
}
