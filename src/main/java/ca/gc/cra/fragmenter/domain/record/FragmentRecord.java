package ca.gc.cra.fragmenter.domain.record;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> One fragment of a source record, carrying the source fields plus offset metadata.
 * <p><strong>Role:</strong> Domain output value created once per (record, fragment) pair.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share across threads.</p>
 *
 * @param source record the fragment came from
 * @param textField name of the field whose value is replaced by {@code text}
 * @param text fragment text
 * @param originalIndex position of {@code source} within its batch
 * @param fragmentIndex 0-based position among the fragments of {@code source}
 * @param originalTextLength length of the untrimmed source text in code points
 * @param fragmentLength length of {@code text} in code points
 * @param sourceType constant tag describing how the fragment was produced
 * @param fragmentStart code point offset of the fragment in the source text, or {@code -1} when unresolved
 * @param fragmentEnd {@code fragmentStart + fragmentLength}, or {@code -1} when unresolved
 * @since 0.1.0
 */
public record FragmentRecord(
    InputRecord source,
    String textField,
    String text,
    int originalIndex,
    int fragmentIndex,
    int originalTextLength,
    int fragmentLength,
    String sourceType,
    int fragmentStart,
    int fragmentEnd) {

  public static final String ORIGINAL_INDEX = "original_index";
  public static final String FRAGMENT_INDEX = "fragment_index";
  public static final String ORIGINAL_TEXT_LENGTH = "original_text_length";
  public static final String FRAGMENT_LENGTH = "fragment_length";
  public static final String SOURCE_TYPE = "source_type";
  public static final String FRAGMENT_START = "fragment_start";
  public static final String FRAGMENT_END = "fragment_end";

  /** Offset reported when a fragment cannot be located in its source text. */
  public static final int UNRESOLVED_OFFSET = -1;

  /**
   * Validates required references.
   *
   * @throws NullPointerException if a reference component is {@code null}
   */
  public FragmentRecord {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(textField, "textField");
    Objects.requireNonNull(text, "text");
    Objects.requireNonNull(sourceType, "sourceType");
  }

  /**
   * Indicates whether the fragment offsets point into the source text.
   *
   * @return {@code false} when the fragment could not be located
   */
  public boolean offsetResolved() {
    return fragmentStart != UNRESOLVED_OFFSET;
  }

  /**
   * Materializes the output row: source fields in their original order with the text field replaced,
   * followed by the metadata fields. Metadata keys already present in the source are overwritten in place.
   *
   * @return unmodifiable ordered field map
   */
  public Map<String, Object> fields() {
    Map<String, Object> fields = new LinkedHashMap<>(source.fields());
    fields.put(textField, text);
    fields.put(ORIGINAL_INDEX, originalIndex);
    fields.put(FRAGMENT_INDEX, fragmentIndex);
    fields.put(ORIGINAL_TEXT_LENGTH, originalTextLength);
    fields.put(FRAGMENT_LENGTH, fragmentLength);
    fields.put(SOURCE_TYPE, sourceType);
    fields.put(FRAGMENT_START, fragmentStart);
    fields.put(FRAGMENT_END, fragmentEnd);
    return Collections.unmodifiableMap(fields);
  }
}
