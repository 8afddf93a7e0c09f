package ca.gc.cra.fragmenter.infrastructure.persistence.ndjson;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.fragmenter.domain.record.InputRecord;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NdjsonRecordSourceTest {
  @TempDir Path tempDir;

  private Path write(String content) throws Exception {
    Path file = tempDir.resolve("records.ndjson");
    Files.writeString(file, content, StandardCharsets.UTF_8);
    return file;
  }

  private static List<InputRecord> readAll(NdjsonRecordSource source) throws Exception {
    List<InputRecord> records = new ArrayList<>();
    source.iterate().forEachRemaining(records::add);
    return records;
  }

  @Test
  void readsObjectsInFileOrderKeepingFieldOrder() throws Exception {
    Path file = write("{\"id\":1,\"text\":\"今天天氣很好。\",\"lang\":\"zh\"}\n"
        + "{\"id\":2,\"text\":\"我們出去玩。\",\"score\":0.5,\"ok\":true,\"note\":null}\n");

    try (NdjsonRecordSource source = new NdjsonRecordSource(file)) {
      List<InputRecord> records = readAll(source);

      assertEquals(2, records.size());
      assertEquals(List.of("id", "text", "lang"), new ArrayList<>(records.get(0).fields().keySet()));
      assertEquals(1, records.get(0).get("id"));
      assertEquals("今天天氣很好。", records.get(0).get("text"));
      assertEquals(new BigDecimal("0.5"), records.get(1).get("score"));
      assertEquals(Boolean.TRUE, records.get(1).get("ok"));
      assertTrue(records.get(1).fields().containsKey("note"));
      assertNull(records.get(1).get("note"));
    }
  }

  @Test
  void skipsBlankLinesAndLeadingByteOrderMark() throws Exception {
    Path file = write("\uFEFF{\"text\":\"一\"}\n\n   \n{\"text\":\"二\"}");

    try (NdjsonRecordSource source = new NdjsonRecordSource(file)) {
      List<InputRecord> records = readAll(source);

      assertEquals(2, records.size());
      assertEquals(List.of("text"), new ArrayList<>(records.get(0).fields().keySet()));
      assertEquals("二", records.get(1).get("text"));
    }
  }

  @Test
  void nestedValuesArePreserved() throws Exception {
    Path file = write("{\"meta\":{\"source\":\"web\"},\"tags\":[\"a\",\"b\"]}\n");

    try (NdjsonRecordSource source = new NdjsonRecordSource(file)) {
      InputRecord record = readAll(source).get(0);

      assertEquals(Map.of("source", "web"), record.get("meta"));
      assertEquals(List.of("a", "b"), record.get("tags"));
    }
  }

  @Test
  void malformedLineReportsFileAndLineNumber() throws Exception {
    Path file = write("{\"text\":\"ok\"}\n{\"text\": broken\n");

    try (NdjsonRecordSource source = new NdjsonRecordSource(file)) {
      Iterator<InputRecord> iterator = source.iterate();
      assertTrue(iterator.hasNext());
      iterator.next();

      UncheckedIOException ex = assertThrows(UncheckedIOException.class, iterator::hasNext);
      assertTrue(ex.getCause().getMessage().contains(":2:"), ex.getCause().getMessage());
    }
  }

  @Test
  void nonObjectLineIsRejected() throws Exception {
    Path file = write("[1,2,3]\n");

    try (NdjsonRecordSource source = new NdjsonRecordSource(file)) {
      Iterator<InputRecord> iterator = source.iterate();

      assertThrows(UncheckedIOException.class, iterator::hasNext);
    }
  }

  @Test
  void emptyFileYieldsNoRecords() throws Exception {
    Path file = write("");

    try (NdjsonRecordSource source = new NdjsonRecordSource(file)) {
      assertFalse(source.iterate().hasNext());
    }
  }
}
