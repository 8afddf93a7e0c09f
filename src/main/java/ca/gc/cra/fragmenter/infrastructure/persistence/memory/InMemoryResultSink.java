package ca.gc.cra.fragmenter.infrastructure.persistence.memory;

import ca.gc.cra.fragmenter.application.port.ResultSink;
import ca.gc.cra.fragmenter.domain.record.FragmentRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Result sink collecting fragments in memory, keeping each write call as a separate batch.
 * <p>Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class InMemoryResultSink implements ResultSink {
  private final List<List<FragmentRecord>> batches = new ArrayList<>();
  private int flushes;

  @Override
  public void write(List<FragmentRecord> fragments) {
    batches.add(List.copyOf(Objects.requireNonNull(fragments, "fragments")));
  }

  @Override
  public void flush() {
    flushes++;
  }

  /**
   * Returns the fragments of every write call, in call order.
   *
   * @return immutable view of written batches
   */
  public List<List<FragmentRecord>> batches() {
    return List.copyOf(batches);
  }

  /**
   * Returns all written fragments as one flat list.
   *
   * @return fragments in write order
   */
  public List<FragmentRecord> fragments() {
    List<FragmentRecord> all = new ArrayList<>();
    batches.forEach(all::addAll);
    return all;
  }

  /**
   * Returns how many times {@link #flush()} was called.
   *
   * @return flush count
   */
  public int flushes() {
    return flushes;
  }
}
