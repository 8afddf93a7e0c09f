package ca.gc.cra.fragmenter.domain.text;

/**
 * <strong>What:</strong> Inclusive character-length window that every emitted fragment must fit.
 * <p><strong>Why:</strong> Corpus builders need fragments long enough to carry meaning yet short enough
 * for downstream model context limits.</p>
 * <p><strong>Role:</strong> Domain value object shared by {@link Segmenter} and record fragmentation.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share.</p>
 *
 * @param minLength minimum fragment length in code points; must be positive
 * @param maxLength maximum fragment length in code points; must be {@code >= minLength}
 * @since 0.1.0
 */
public record LengthWindow(int minLength, int maxLength) {
  /** Default minimum fragment length. */
  public static final int DEFAULT_MIN_LENGTH = 30;
  /** Default maximum fragment length. */
  public static final int DEFAULT_MAX_LENGTH = 250;

  /**
   * Validates window bounds.
   *
   * @throws IllegalArgumentException if a bound is not positive or {@code minLength > maxLength}
   */
  public LengthWindow {
    if (minLength <= 0) {
      throw new IllegalArgumentException("minLength must be positive (was " + minLength + ")");
    }
    if (maxLength <= 0) {
      throw new IllegalArgumentException("maxLength must be positive (was " + maxLength + ")");
    }
    if (minLength > maxLength) {
      throw new IllegalArgumentException(
          "minLength must not exceed maxLength (was " + minLength + " > " + maxLength + ")");
    }
  }

  /**
   * Returns the default 30..250 window.
   *
   * @return default window
   */
  public static LengthWindow defaults() {
    return new LengthWindow(DEFAULT_MIN_LENGTH, DEFAULT_MAX_LENGTH);
  }

  /**
   * Indicates whether a length meets the minimum.
   *
   * @param length candidate length in code points
   * @return {@code true} when {@code length >= minLength}
   */
  public boolean meetsMinimum(int length) {
    return length >= minLength;
  }

  /**
   * Indicates whether a length lies inside the window.
   *
   * @param length candidate length in code points
   * @return {@code true} when {@code minLength <= length <= maxLength}
   */
  public boolean contains(int length) {
    return length >= minLength && length <= maxLength;
  }
}
