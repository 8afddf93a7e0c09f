package ca.gc.cra.fragmenter.domain.record;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> One input row: an ordered mapping from field name to value.
 * <p><strong>Why:</strong> The field set is open; every field except the text field must reach the output
 * verbatim and in its original order.</p>
 * <p><strong>Role:</strong> Domain value object produced by record sources and consumed by
 * {@link RecordFragmenter}.</p>
 * <p><strong>Thread-safety:</strong> The field map is an unmodifiable ordered copy; safe to hand to worker
 * threads. Nested list/map values are shared as supplied.</p>
 *
 * @since 0.1.0
 */
public final class InputRecord {
  private final Map<String, Object> fields;

  private InputRecord(Map<String, Object> fields) {
    this.fields = fields;
  }

  /**
   * Creates a record from an ordered field map. {@code null} values are kept.
   *
   * @param fields field values in column order; must not be {@code null}
   * @return immutable record
   * @throws NullPointerException if {@code fields} or any field name is {@code null}
   */
  public static InputRecord of(Map<String, ?> fields) {
    Objects.requireNonNull(fields, "fields");
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : fields.entrySet()) {
      copy.put(Objects.requireNonNull(entry.getKey(), "field name"), entry.getValue());
    }
    return new InputRecord(Collections.unmodifiableMap(copy));
  }

  /**
   * Returns the ordered, unmodifiable field map.
   *
   * @return field map in original column order
   */
  public Map<String, Object> fields() {
    return fields;
  }

  /**
   * Returns a field value.
   *
   * @param name field name
   * @return value or {@code null} when absent or null-valued
   */
  public Object get(String name) {
    return fields.get(name);
  }

  /**
   * Returns the named field when it holds a string.
   *
   * @param name field name
   * @return string value, or empty when missing or not a string
   */
  public Optional<String> stringField(String name) {
    return fields.get(name) instanceof String value ? Optional.of(value) : Optional.empty();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    return other instanceof InputRecord that && fields.equals(that.fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public String toString() {
    return "InputRecord" + fields.keySet();
  }
}
