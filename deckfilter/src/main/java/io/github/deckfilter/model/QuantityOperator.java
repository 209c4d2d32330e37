package io.github.deckfilter.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/**
 * Copy count operators of an include filter.
 */
public enum QuantityOperator {
  EQ("="),
  LT("<"),
  LTE("<="),
  GT(">"),
  GTE(">="),
  /**
   * At least one copy.
   */
  ANY("any"),
  /**
   * No copies at all.
   */
  NONE("");

  private final String symbol;

  QuantityOperator(final String symbol) {
    this.symbol = symbol;
  }

  /**
   * Wire symbol.
   *
   * @return the symbol
   */
  @JsonValue
  public String symbol() {
    return symbol;
  }

  /**
   * Parse a wire symbol. {@code null} maps to {@link #NONE}, matching a blank selection.
   *
   * @param symbol the symbol
   * @return the quantity operator
   */
  @JsonCreator
  public static QuantityOperator fromSymbol(final String symbol) {
    final String value = symbol == null ? "" : symbol.trim().toLowerCase();
    return Arrays.stream(values())
        .filter(op -> op.symbol.equals(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown quantity operator: " + symbol));
  }

  /**
   * True for the operators that compare against a literal count.
   *
   * @return true if comparison
   */
  public boolean isComparison() {
    return this != ANY && this != NONE;
  }

  /**
   * Test a deck's total copies of a card.
   *
   * @param deckCount the copies in the deck, 0 when absent
   * @param expected  the literal count, may be null
   * @return true if the deck satisfies the operator
   */
  public boolean matches(final int deckCount, final Integer expected) {
    switch (this) {
      case ANY:
        return deckCount > 0;
      case NONE:
        return deckCount == 0;
      default:
        break;
    }
    if (expected == null) {
      return deckCount > 0;
    }
    switch (this) {
      case EQ:
        return deckCount == expected;
      case LT:
        return deckCount < expected;
      case LTE:
        return deckCount <= expected;
      case GT:
        return deckCount > expected;
      case GTE:
        return deckCount >= expected;
      default:
        throw new IllegalStateException("Unhandled operator " + this);
    }
  }
}
