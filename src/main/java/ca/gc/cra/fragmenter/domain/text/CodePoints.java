package ca.gc.cra.fragmenter.domain.text;

/**
 * Code-point helpers so lengths and offsets count characters rather than UTF-16 units.
 *
 * @since 0.1.0
 */
public final class CodePoints {
  private CodePoints() {
    // Utility
  }

  /**
   * Counts code points in the supplied text.
   *
   * @param text text to measure; must not be {@code null}
   * @return number of code points
   */
  public static int length(CharSequence text) {
    return Character.codePointCount(text, 0, text.length());
  }

  /**
   * Returns the substring covering code points {@code [start, end)}.
   *
   * @param text source text
   * @param start first code point index, inclusive
   * @param end last code point index, exclusive; clamped to the text length
   * @return substring for the requested code point range
   */
  public static String slice(String text, int start, int end) {
    int total = length(text);
    int from = Math.min(start, total);
    int to = Math.min(end, total);
    int beginIndex = text.offsetByCodePoints(0, from);
    int endIndex = text.offsetByCodePoints(beginIndex, to - from);
    return text.substring(beginIndex, endIndex);
  }

  /**
   * Tests whether a code point counts as space when trimming. Covers {@link Character#isWhitespace(int)}
   * plus the no-break spaces ({@code U+00A0}, {@code U+2007}, {@code U+202F}) and {@code U+0085}.
   *
   * @param codePoint code point to test
   * @return {@code true} for any space, separator, or line break
   */
  public static boolean isSpace(int codePoint) {
    return Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint) || codePoint == 0x85;
  }

  /**
   * Removes leading and trailing code points matching {@link #isSpace(int)}.
   *
   * @param text text to trim; must not be {@code null}
   * @return trimmed text, possibly empty
   */
  public static String strip(String text) {
    int start = 0;
    int end = text.length();
    while (start < end) {
      int cp = text.codePointAt(start);
      if (!isSpace(cp)) {
        break;
      }
      start += Character.charCount(cp);
    }
    while (end > start) {
      int cp = text.codePointBefore(end);
      if (!isSpace(cp)) {
        break;
      }
      end -= Character.charCount(cp);
    }
    return text.substring(start, end);
  }

  /**
   * Converts a UTF-16 index into a code point index.
   *
   * @param text source text
   * @param charIndex UTF-16 index returned by {@link String#indexOf(String)}
   * @return code point index of the same position
   */
  public static int toCodePointIndex(String text, int charIndex) {
    return text.codePointCount(0, charIndex);
  }
}
