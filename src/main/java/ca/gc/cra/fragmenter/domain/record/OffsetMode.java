package ca.gc.cra.fragmenter.domain.record;

import java.util.Locale;

/**
 * Strategy used to locate a fragment inside its source text.
 *
 * @since 0.1.0
 */
public enum OffsetMode {
  /** Search from the start of the text for every fragment; repeated text maps to its first occurrence. */
  FIRST_OCCURRENCE,
  /** Search forward from the end of the previously located fragment. */
  FORWARD;

  /**
   * Parses a configuration value.
   *
   * @param raw {@code first}, {@code forward}, or an enum name; blank yields {@link #FORWARD}
   * @return parsed mode
   * @throws IllegalArgumentException if the value is not recognized
   */
  public static OffsetMode fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      return FORWARD;
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    return switch (normalized) {
      case "FIRST", "FIRST_OCCURRENCE" -> FIRST_OCCURRENCE;
      case "FORWARD" -> FORWARD;
      default -> throw new IllegalArgumentException("offsetMode must be 'first' or 'forward' (was " + raw + ")");
    };
  }
}
