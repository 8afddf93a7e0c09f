package ca.gc.cra.fragmenter.application.port;

import ca.gc.cra.fragmenter.domain.record.InputRecord;
import java.io.IOException;
import java.util.Iterator;

/**
 * <strong>What:</strong> Input port yielding the records to fragment.
 * <p><strong>Why:</strong> Decouples the batch pipeline from the tabular store the deployment reads from.</p>
 * <p><strong>Role:</strong> Input port implemented by adapters such as {@code NdjsonRecordSource}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Yield a finite sequence of records in a stable order.</li>
 *   <li>Allow the sequence to be iterated again from the start.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Consumed from the orchestrating thread only.</p>
 * <p><strong>Performance:</strong> Implementations may stream; the orchestrator pulls one batch at a time.</p>
 * <p><strong>Observability:</strong> Read failures surface as {@link IOException}s, or as
 * {@link java.io.UncheckedIOException}s thrown from the iterator.</p>
 *
 * @since 0.1.0
 */
public interface RecordSource extends AutoCloseable {
  /**
   * Starts a new pass over the records.
   *
   * @return iterator over records in source order; may throw {@link java.io.UncheckedIOException} while advancing
   * @throws IOException if the underlying store cannot be opened
   *
   * <p><strong>Concurrency:</strong> Single consumer.</p>
   */
  Iterator<InputRecord> iterate() throws IOException;

  /**
   * Releases resources held by open iterations.
   *
   * @throws IOException if closing fails
   */
  @Override
  default void close() throws IOException {}
}
