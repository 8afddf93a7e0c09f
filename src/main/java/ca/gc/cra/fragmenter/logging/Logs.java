package ca.gc.cra.fragmenter.logging;

/**
 * <strong>What:</strong> Helpers that keep record text out of logs in bulk.
 * <p><strong>Why:</strong> Input rows can carry long free text; diagnostics only need a short preview.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to at most {@code maxCodePoints} code points, never splitting a surrogate pair.
   *
   * @param value string to shorten; {@code null} results in {@code "<null>"}
   * @param maxCodePoints number of code points to keep; must be positive
   * @return the original value when short enough, otherwise the prefix followed by
   *     {@code "… (truncated, X of Y)"}
   * @throws IllegalArgumentException if {@code maxCodePoints} is not positive
   */
  public static String truncate(String value, int maxCodePoints) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxCodePoints <= 0) {
      throw new IllegalArgumentException("maxCodePoints must be positive");
    }
    int total = value.codePointCount(0, value.length());
    if (total <= maxCodePoints) {
      return value;
    }
    int end = value.offsetByCodePoints(0, maxCodePoints);
    return value.substring(0, end) + "… (truncated, " + maxCodePoints + " of " + total + ")";
  }
}
