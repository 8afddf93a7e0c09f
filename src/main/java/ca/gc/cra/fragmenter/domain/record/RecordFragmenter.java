package ca.gc.cra.fragmenter.domain.record;

import ca.gc.cra.fragmenter.domain.text.CodePoints;
import ca.gc.cra.fragmenter.domain.text.Segmenter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Turns one {@link InputRecord} into its {@link FragmentRecord}s.
 * <p><strong>Why:</strong> Keeps every non-text column of the source row while making each fragment
 * traceable to its position in the original text.</p>
 * <p><strong>Role:</strong> Domain service invoked by batch workers, one record at a time.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Skip records whose text field is missing, not a string, or shorter than the minimum once trimmed.</li>
 *   <li>Segment the text with {@link Segmenter}.</li>
 *   <li>Locate each fragment in the untrimmed text and attach offset metadata.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; one instance may serve all workers concurrently.</p>
 *
 * @implNote Offsets come from substring search. With {@link OffsetMode#FIRST_OCCURRENCE} a fragment whose
 * text repeats earlier in the source points at the earlier occurrence. Fragments assembled from phrases
 * whose separating whitespace was trimmed cannot be found and report {@link FragmentRecord#UNRESOLVED_OFFSET}.
 * @since 0.1.0
 */
public final class RecordFragmenter {
  private final FragmenterSettings settings;

  /**
   * Creates a fragmenter.
   *
   * @param settings field, window, tag, and offset settings; must not be {@code null}
   */
  public RecordFragmenter(FragmenterSettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Returns the settings applied by this fragmenter.
   *
   * @return settings
   */
  public FragmenterSettings settings() {
    return settings;
  }

  /**
   * Fragments a single record.
   *
   * @param originalIndex position of the record within its batch
   * @param record record to fragment; must not be {@code null}
   * @return fragments in order; empty when the record has no usable text
   */
  public List<FragmentRecord> fragment(int originalIndex, InputRecord record) {
    Objects.requireNonNull(record, "record");
    Optional<String> maybeText = record.stringField(settings.textField());
    if (maybeText.isEmpty()) {
      return List.of();
    }
    String text = maybeText.get();
    if (!settings.window().meetsMinimum(CodePoints.length(CodePoints.strip(text)))) {
      return List.of();
    }

    List<String> fragments = Segmenter.segment(text, settings.window());
    if (fragments.isEmpty()) {
      return List.of();
    }

    int originalTextLength = CodePoints.length(text);
    OffsetLocator locator = new OffsetLocator(text, settings.offsetMode());
    List<FragmentRecord> results = new ArrayList<>(fragments.size());
    for (int i = 0; i < fragments.size(); i++) {
      String fragment = fragments.get(i);
      int fragmentLength = CodePoints.length(fragment);
      int start = locator.locate(fragment);
      int end = start == FragmentRecord.UNRESOLVED_OFFSET
          ? FragmentRecord.UNRESOLVED_OFFSET
          : start + fragmentLength;
      results.add(new FragmentRecord(
          record,
          settings.textField(),
          fragment,
          originalIndex,
          i,
          originalTextLength,
          fragmentLength,
          settings.sourceType(),
          start,
          end));
    }
    return List.copyOf(results);
  }

  private static final class OffsetLocator {
    private final String text;
    private final OffsetMode mode;
    private int cursor;

    private OffsetLocator(String text, OffsetMode mode) {
      this.text = text;
      this.mode = mode;
    }

    int locate(String fragment) {
      int from = mode == OffsetMode.FORWARD ? cursor : 0;
      int charIndex = text.indexOf(fragment, from);
      if (charIndex < 0) {
        return FragmentRecord.UNRESOLVED_OFFSET;
      }
      cursor = charIndex + fragment.length();
      return CodePoints.toCodePointIndex(text, charIndex);
    }
  }
}
