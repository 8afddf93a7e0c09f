package ca.gc.cra.fragmenter.application.port;

import ca.gc.cra.fragmenter.domain.record.FragmentRecord;
import java.io.IOException;
import java.util.List;

/**
 * <strong>What:</strong> Output port persisting fragment records.
 * <p><strong>Why:</strong> Lets the pipeline hand finished batches to files, tables, or memory without
 * knowing the store.</p>
 * <p><strong>Role:</strong> Output port implemented by adapters such as {@code NdjsonResultSink}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Append fragments in the order received; successive writes form one flat sequence.</li>
 *   <li>Flush and release resources on close.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Called from the orchestrating thread only.</p>
 * <p><strong>Observability:</strong> Write failures propagate as {@link IOException}; no retries.</p>
 *
 * @since 0.1.0
 */
public interface ResultSink extends AutoCloseable {
  /**
   * Appends a batch of fragment records.
   *
   * @param fragments fragments in output order; must not be {@code null}, may be empty
   * @throws IOException if the store rejects the write
   */
  void write(List<FragmentRecord> fragments) throws IOException;

  /**
   * Flushes buffered output.
   *
   * @throws IOException if flushing fails
   */
  default void flush() throws IOException {}

  /**
   * Flushes and releases the sink.
   *
   * @throws IOException if closing fails
   */
  @Override
  default void close() throws IOException {}
}
