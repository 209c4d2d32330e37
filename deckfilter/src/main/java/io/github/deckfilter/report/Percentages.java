package io.github.deckfilter.report;

/**
 * Two decimal percentage arithmetic shared by every report producer.
 */
public final class Percentages {

  private static final double EPSILON = Math.ulp(1.0);

  private Percentages() {
    // Utility
  }

  /**
   * Rounds half up to two decimals. A machine epsilon is added first so values such as 1.005
   * round the way a reader expects.
   *
   * @param value the value
   * @return the rounded value
   */
  public static double round2(final double value) {
    return Math.round((value + EPSILON) * 100) / 100.0;
  }

  /**
   * {@code round2(part / whole * 100)}, zero for an empty whole.
   *
   * @param part  the part
   * @param whole the whole
   * @return the percentage
   */
  public static double percent(final int part, final int whole) {
    if (whole == 0) {
      return 0;
    }
    return round2((double) part / whole * 100);
  }
}
