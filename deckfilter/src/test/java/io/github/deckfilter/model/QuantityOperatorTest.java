package io.github.deckfilter.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class QuantityOperatorTest {

  @Test
  void fromSymbol_parsesWireSymbols() {
    assertThat(QuantityOperator.fromSymbol(">=")).isEqualTo(QuantityOperator.GTE);
    assertThat(QuantityOperator.fromSymbol(" = ")).isEqualTo(QuantityOperator.EQ);
    assertThat(QuantityOperator.fromSymbol("ANY")).isEqualTo(QuantityOperator.ANY);
    assertThat(QuantityOperator.fromSymbol(null)).isEqualTo(QuantityOperator.NONE);
  }

  @Test
  void fromSymbol_unknown_throws() {
    assertThatThrownBy(() -> QuantityOperator.fromSymbol("~"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("~");
  }

  @Test
  void matches_comparesTotalCopies() {
    assertThat(QuantityOperator.EQ.matches(2, 2)).isTrue();
    assertThat(QuantityOperator.LT.matches(0, 2)).isTrue();
    assertThat(QuantityOperator.LTE.matches(3, 2)).isFalse();
    assertThat(QuantityOperator.GT.matches(3, 2)).isTrue();
    assertThat(QuantityOperator.GTE.matches(1, 2)).isFalse();
  }

  @Test
  void matches_presenceOperators() {
    assertThat(QuantityOperator.ANY.matches(1, null)).isTrue();
    assertThat(QuantityOperator.ANY.matches(0, 4)).isFalse();
    assertThat(QuantityOperator.NONE.matches(0, null)).isTrue();
    assertThat(QuantityOperator.GTE.matches(1, null)).isTrue();
  }
}
