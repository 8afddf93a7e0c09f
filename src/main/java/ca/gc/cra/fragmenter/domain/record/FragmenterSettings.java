package ca.gc.cra.fragmenter.domain.record;

import ca.gc.cra.fragmenter.domain.text.LengthWindow;
import java.util.Objects;

/**
 * Per-record fragmentation settings.
 *
 * @param textField name of the field holding the text to split
 * @param window fragment length bounds
 * @param sourceType tag written to every fragment's {@code source_type}
 * @param offsetMode how fragment offsets are located in the source text
 * @since 0.1.0
 */
public record FragmenterSettings(
    String textField, LengthWindow window, String sourceType, OffsetMode offsetMode) {
  public static final String DEFAULT_TEXT_FIELD = "text";
  public static final String DEFAULT_SOURCE_TYPE = "sentence_fragment";

  /**
   * Validates settings.
   *
   * @throws IllegalArgumentException if the text field or source type is blank
   */
  public FragmenterSettings {
    Objects.requireNonNull(textField, "textField");
    Objects.requireNonNull(window, "window");
    Objects.requireNonNull(sourceType, "sourceType");
    offsetMode = Objects.requireNonNullElse(offsetMode, OffsetMode.FORWARD);
    if (textField.isBlank()) {
      throw new IllegalArgumentException("textField must not be blank");
    }
    if (sourceType.isBlank()) {
      throw new IllegalArgumentException("sourceType must not be blank");
    }
  }

  /**
   * Returns defaults: field {@code text}, window 30..250, forward offsets.
   *
   * @return default settings
   */
  public static FragmenterSettings defaults() {
    return withWindow(LengthWindow.defaults());
  }

  /**
   * Returns default settings with a custom window.
   *
   * @param window length bounds
   * @return settings using the default field, tag, and offset mode
   */
  public static FragmenterSettings withWindow(LengthWindow window) {
    return new FragmenterSettings(DEFAULT_TEXT_FIELD, window, DEFAULT_SOURCE_TYPE, OffsetMode.FORWARD);
  }
}
