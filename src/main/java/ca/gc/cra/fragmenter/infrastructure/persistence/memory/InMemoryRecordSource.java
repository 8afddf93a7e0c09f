package ca.gc.cra.fragmenter.infrastructure.persistence.memory;

import ca.gc.cra.fragmenter.application.port.RecordSource;
import ca.gc.cra.fragmenter.domain.record.InputRecord;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Record source backed by an immutable list.
 *
 * @since 0.1.0
 */
public final class InMemoryRecordSource implements RecordSource {
  private final List<InputRecord> records;

  /**
   * Creates a source over a fixed record list.
   *
   * @param records records in order; copied
   */
  public InMemoryRecordSource(List<InputRecord> records) {
    this.records = List.copyOf(Objects.requireNonNull(records, "records"));
  }

  @Override
  public Iterator<InputRecord> iterate() {
    return records.iterator();
  }
}
