package ca.gc.cra.fragmenter.infrastructure.persistence.ndjson;

import ca.gc.cra.fragmenter.application.port.ResultSink;
import ca.gc.cra.fragmenter.domain.record.FragmentRecord;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes fragment records as UTF-8 NDJSON, one object per line, source fields first and fragment metadata
 * after.
 * <p>The file is created on construction. Without overwrite an existing file is rejected.</p>
 * <p>Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class NdjsonResultSink implements ResultSink {
  private static final Logger log = LoggerFactory.getLogger(NdjsonResultSink.class);

  private final Path file;
  private final JsonLines json = new JsonLines();
  private final BufferedWriter writer;
  private long written;
  private boolean closed;

  /**
   * Opens a sink.
   *
   * @param file output file; parent directories are created
   * @param allowOverwrite whether an existing file may be truncated
   * @throws java.nio.file.FileAlreadyExistsException if the file exists and overwrite is not allowed
   * @throws IOException if the file cannot be opened
   */
  public NdjsonResultSink(Path file, boolean allowOverwrite) throws IOException {
    this.file = Objects.requireNonNull(file, "file");
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    OpenOption[] options = allowOverwrite
        ? new OpenOption[] {StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE}
        : new OpenOption[] {StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE};
    this.writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8, options);
  }

  @Override
  public void write(List<FragmentRecord> fragments) throws IOException {
    Objects.requireNonNull(fragments, "fragments");
    if (closed) {
      throw new IOException("sink is closed: " + file);
    }
    for (FragmentRecord fragment : fragments) {
      writer.write(json.writeObject(fragment.fields()));
      writer.write('\n');
    }
    written += fragments.size();
  }

  @Override
  public void flush() throws IOException {
    if (!closed) {
      writer.flush();
    }
  }

  /**
   * Returns the number of fragments written so far.
   *
   * @return fragment count
   */
  public long written() {
    return written;
  }

  /**
   * Returns the output path.
   *
   * @return file path
   */
  public Path file() {
    return file;
  }

  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    writer.close();
    log.info("Wrote {} fragments to {}", written, file);
  }
}
