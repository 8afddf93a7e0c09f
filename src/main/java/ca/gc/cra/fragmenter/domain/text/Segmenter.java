package ca.gc.cra.fragmenter.domain.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Splits free-form text into length-bounded, sentence-aligned fragments.
 * <p><strong>Why:</strong> Corpus preparation needs fragments that respect sentence and phrase boundaries
 * while fitting a fixed {@link LengthWindow}.</p>
 * <p><strong>Role:</strong> Pure domain function; no I/O, no concurrency, no logging.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Split text into sentences on sentence-final delimiters.</li>
 *   <li>Keep sentences that already fit the window, drop those below the minimum.</li>
 *   <li>Pack over-long sentences into phrases greedily, falling back to fixed-width slicing.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Linear in the text length per pass; allocates one builder per sentence.</p>
 *
 * @implNote Lengths are measured in code points. The greedy merge drops an accumulator that is still
 * below the minimum when the next phrase would overflow the maximum; output counts depend on this.
 * @since 0.1.0
 */
public final class Segmenter {
  /** Characters that end a sentence-level unit. */
  public static final String SENTENCE_DELIMITERS = "。！？；…";
  /** Characters that end a phrase inside an over-long sentence. */
  public static final String PHRASE_DELIMITERS = "，、：；";

  private Segmenter() {
    // Utility
  }

  /**
   * Segments text using explicit bounds.
   *
   * @param text source text; {@code null} yields no fragments
   * @param minLength minimum fragment length in code points
   * @param maxLength maximum fragment length in code points
   * @return fragments in source order; never {@code null}
   * @throws IllegalArgumentException if the bounds do not form a valid {@link LengthWindow}
   */
  public static List<String> segment(String text, int minLength, int maxLength) {
    return segment(text, new LengthWindow(minLength, maxLength));
  }

  /**
   * Segments text into fragments that fit the supplied window.
   *
   * <p>Sentences inside the window are emitted verbatim (trimmed). Longer sentences are split into
   * phrases and greedily re-packed; when packing yields nothing the sentence is sliced into
   * {@code maxLength}-wide windows and slices shorter than the minimum are dropped.</p>
   *
   * @param text source text; {@code null} yields no fragments
   * @param window length bounds; must not be {@code null}
   * @return fragments in sentence order, phrase order preserved within a sentence
   */
  public static List<String> segment(String text, LengthWindow window) {
    Objects.requireNonNull(window, "window");
    if (text == null || text.isEmpty()) {
      return List.of();
    }
    List<String> fragments = new ArrayList<>();
    for (String sentence : splitSentences(text)) {
      int length = CodePoints.length(sentence);
      if (!window.meetsMinimum(length)) {
        continue;
      }
      if (length <= window.maxLength()) {
        fragments.add(sentence);
        continue;
      }
      fragments.addAll(packSentence(sentence, window));
    }
    return List.copyOf(fragments);
  }

  /**
   * Splits text into trimmed, non-blank sentences.
   *
   * @param text source text; must not be {@code null}
   * @return sentences in order of appearance
   */
  public static List<String> splitSentences(String text) {
    List<String> sentences = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    text.codePoints().forEach(cp -> {
      current.appendCodePoint(cp);
      if (SENTENCE_DELIMITERS.indexOf(cp) >= 0) {
        String sentence = CodePoints.strip(current.toString());
        if (!sentence.isEmpty()) {
          sentences.add(sentence);
          current.setLength(0);
        }
      }
    });
    String trailing = CodePoints.strip(current.toString());
    if (!trailing.isEmpty()) {
      sentences.add(trailing);
    }
    return sentences;
  }

  /**
   * Splits a sentence into phrases. A phrase closes at a phrase delimiter only once its trimmed length
   * reaches the minimum; shorter runs keep accumulating into the next phrase.
   *
   * @param sentence sentence to split; must not be {@code null}
   * @param minLength minimum phrase length in code points
   * @return trimmed phrases, each at least {@code minLength} long
   */
  public static List<String> splitPhrases(String sentence, int minLength) {
    List<String> phrases = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    sentence.codePoints().forEach(cp -> {
      current.appendCodePoint(cp);
      if (PHRASE_DELIMITERS.indexOf(cp) >= 0) {
        String phrase = CodePoints.strip(current.toString());
        if (!phrase.isEmpty() && CodePoints.length(phrase) >= minLength) {
          phrases.add(phrase);
          current.setLength(0);
        }
      }
    });
    String trailing = CodePoints.strip(current.toString());
    if (!trailing.isEmpty() && CodePoints.length(trailing) >= minLength) {
      phrases.add(trailing);
    }
    return phrases;
  }

  /**
   * Cuts text into consecutive {@code maxLength}-wide slices, keeping slices that meet the minimum.
   *
   * @param text text to slice; must not be {@code null}
   * @param window length bounds
   * @return slices in order; only the last one may be shorter than {@code maxLength}
   */
  public static List<String> sliceFixedWidth(String text, LengthWindow window) {
    List<String> slices = new ArrayList<>();
    int total = CodePoints.length(text);
    for (int start = 0; start < total; start += window.maxLength()) {
      String slice = CodePoints.slice(text, start, start + window.maxLength());
      if (window.meetsMinimum(CodePoints.length(slice))) {
        slices.add(slice);
      }
    }
    return slices;
  }

  private static List<String> packSentence(String sentence, LengthWindow window) {
    List<String> pieces = new ArrayList<>();
    for (String phrase : splitPhrases(sentence, window.minLength())) {
      if (CodePoints.length(phrase) > window.maxLength()) {
        pieces.addAll(sliceFixedWidth(phrase, window));
      } else {
        pieces.add(phrase);
      }
    }

    List<String> merged = greedyMerge(pieces, window);
    if (merged.isEmpty() && window.meetsMinimum(CodePoints.length(sentence))) {
      return sliceFixedWidth(sentence, window);
    }
    return merged;
  }

  private static List<String> greedyMerge(List<String> pieces, LengthWindow window) {
    List<String> merged = new ArrayList<>();
    StringBuilder accumulator = new StringBuilder();
    int accumulatedLength = 0;
    for (String piece : pieces) {
      int pieceLength = CodePoints.length(piece);
      if (accumulatedLength + pieceLength <= window.maxLength()) {
        accumulator.append(piece);
        accumulatedLength += pieceLength;
        continue;
      }
      if (accumulatedLength > 0 && window.meetsMinimum(accumulatedLength)) {
        merged.add(accumulator.toString());
      }
      // an accumulator below the minimum is dropped here
      accumulator.setLength(0);
      accumulator.append(piece);
      accumulatedLength = pieceLength;
    }
    if (accumulatedLength > 0 && window.meetsMinimum(accumulatedLength)) {
      merged.add(accumulator.toString());
    }
    return merged;
  }
}
