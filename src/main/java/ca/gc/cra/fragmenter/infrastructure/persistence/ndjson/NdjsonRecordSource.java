package ca.gc.cra.fragmenter.infrastructure.persistence.ndjson;

import ca.gc.cra.fragmenter.application.port.RecordSource;
import ca.gc.cra.fragmenter.domain.record.InputRecord;
import ca.gc.cra.fragmenter.logging.Logs;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads records from a UTF-8 newline-delimited JSON file, one object per line.
 * <p>A leading byte-order mark is ignored, as are blank lines. Records are parsed lazily as the iterator
 * advances; a malformed line surfaces as an {@link UncheckedIOException} naming the line number.</p>
 * <p>Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class NdjsonRecordSource implements RecordSource {
  private static final Logger log = LoggerFactory.getLogger(NdjsonRecordSource.class);
  private static final char BOM = '\uFEFF';

  private final Path file;
  private final JsonLines json = new JsonLines();
  private final List<BufferedReader> openReaders = new ArrayList<>();

  /**
   * Creates a source over an NDJSON file.
   *
   * @param file input file; opened on each {@link #iterate()}
   */
  public NdjsonRecordSource(Path file) {
    this.file = Objects.requireNonNull(file, "file");
  }

  @Override
  public Iterator<InputRecord> iterate() throws IOException {
    BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
    openReaders.add(reader);
    log.debug("Reading records from {}", file);
    return new LineIterator(reader);
  }

  @Override
  public void close() throws IOException {
    IOException failure = null;
    for (BufferedReader reader : openReaders) {
      try {
        reader.close();
      } catch (IOException ex) {
        if (failure == null) {
          failure = ex;
        } else {
          failure.addSuppressed(ex);
        }
      }
    }
    openReaders.clear();
    if (failure != null) {
      throw failure;
    }
  }

  private final class LineIterator implements Iterator<InputRecord> {
    private final BufferedReader reader;
    private long lineNumber;
    private InputRecord next;
    private boolean finished;

    private LineIterator(BufferedReader reader) {
      this.reader = reader;
    }

    @Override
    public boolean hasNext() {
      if (next == null && !finished) {
        next = advance();
      }
      return next != null;
    }

    @Override
    public InputRecord next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      InputRecord result = next;
      next = null;
      return result;
    }

    private InputRecord advance() {
      try {
        String line;
        while ((line = reader.readLine()) != null) {
          lineNumber++;
          if (lineNumber == 1 && !line.isEmpty() && line.charAt(0) == BOM) {
            line = line.substring(1);
          }
          if (line.isBlank()) {
            continue;
          }
          try {
            return InputRecord.of(json.parseObject(line));
          } catch (IOException ex) {
            throw new IOException(
                file + ":" + lineNumber + ": " + ex.getMessage() + " [" + Logs.truncate(line, 80) + "]", ex);
          }
        }
        finished = true;
        return null;
      } catch (IOException ex) {
        finished = true;
        throw new UncheckedIOException(ex);
      }
    }
  }
}
