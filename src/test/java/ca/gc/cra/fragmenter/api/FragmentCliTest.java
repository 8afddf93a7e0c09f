package ca.gc.cra.fragmenter.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.fragmenter.application.port.ClockPort;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class FragmentCliTest {
  private static final ClockPort FIXED_CLOCK = () -> 1_700_000_000_000L;

  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(FragmentCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    if (logger != null && appender != null) {
      logger.detachAppender(appender);
    }
    CliPrinter.clearTestWriter();
    System.clearProperty("otel.metrics.exporter");
    System.clearProperty("otel.exporter.otlp.endpoint");
    System.clearProperty("otel.resource.attributes");
  }

  private Path input() throws Exception {
    Path file = tempDir.resolve("records.ndjson");
    Files.writeString(file, String.join("\n",
        "{\"id\":1,\"text\":\"今天天氣很好。我們出去玩。\",\"lang\":\"zh\"}",
        "{\"id\":2,\"text\":\"短。\",\"lang\":\"zh\"}",
        "{\"id\":3,\"text\":\"明天會下雨嗎？\",\"lang\":\"zh\"}",
        ""), StandardCharsets.UTF_8);
    return file;
  }

  private boolean logged(Level level, String fragment) {
    return appender.list.stream()
        .anyMatch(event -> event.getLevel() == level && event.getFormattedMessage().contains(fragment));
  }

  @Test
  void fragmentsInputIntoExplicitOutputFile() throws Exception {
    Path in = input();
    Path out = tempDir.resolve("out/fragments.ndjson");

    ExitCode code = FragmentCli.run(new String[] {
        "in=" + in, "out=" + out, "minLength=5", "maxLength=250", "workers=2", "batchSize=2"}, FIXED_CLOCK);

    assertEquals(ExitCode.SUCCESS, code);
    List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);
    assertEquals(3, lines.size());
    assertTrue(lines.get(0).startsWith("{\"id\":1,\"text\":\"今天天氣很好。\",\"lang\":\"zh\",\"original_index\":0"),
        lines.get(0));
    assertTrue(lines.get(1).contains("\"text\":\"我們出去玩。\""), lines.get(1));
    assertTrue(lines.get(1).contains("\"fragment_start\":7,\"fragment_end\":13"), lines.get(1));
    assertTrue(lines.get(2).contains("\"id\":3"), lines.get(2));
    assertTrue(lines.get(2).contains("\"original_index\":0"), lines.get(2));
    String printed = buffer.toString();
    assertTrue(printed.contains("Fragmentation complete."), printed);
    assertTrue(printed.contains(" Fragments   : 3"), printed);
    assertTrue(printed.contains(" Batches     : 2"), printed);
  }

  @Test
  void directoryOutputReceivesTimestampedFile() throws Exception {
    Path in = input();
    Path outDir = tempDir.resolve("split");

    ExitCode code = FragmentCli.run(new String[] {"in=" + in, "out=" + outDir, "minLength=5"}, FIXED_CLOCK);

    assertEquals(ExitCode.SUCCESS, code);
    List<Path> files;
    try (Stream<Path> listing = Files.list(outDir)) {
      files = listing.toList();
    }
    assertEquals(1, files.size());
    assertTrue(files.get(0).getFileName().toString().matches("sentence_fragments_\\d{8}_\\d{6}\\.ndjson"),
        files.get(0).toString());
  }

  @Test
  void resolveOutputFileKeepsExplicitFileNames() {
    Path explicit = tempDir.resolve("custom.JSONL");

    assertEquals(explicit, FragmentCli.resolveOutputFile(explicit, FIXED_CLOCK));
    Path resolved = FragmentCli.resolveOutputFile(tempDir, FIXED_CLOCK);
    assertEquals(tempDir, resolved.getParent());
    assertTrue(resolved.getFileName().toString().startsWith(FragmentCli.OUTPUT_PREFIX));
  }

  @Test
  void dryRunPrintsPlanAndWritesNothing() throws Exception {
    Path in = input();
    Path out = tempDir.resolve("dry/fragments.ndjson");

    ExitCode code = FragmentCli.run(new String[] {"in=" + in, "out=" + out, "--dry-run"}, FIXED_CLOCK);

    assertEquals(ExitCode.SUCCESS, code);
    String printed = buffer.toString();
    assertTrue(printed.contains("Fragment dry-run: no records will be read."), printed);
    assertTrue(printed.contains(" Length window     : 30..250"), printed);
    assertFalse(Files.exists(out));
  }

  @Test
  void missingInputReturnsInvalidArgs() {
    ExitCode code = FragmentCli.run(new String[] {"out=" + tempDir.resolve("x.ndjson")}, FIXED_CLOCK);

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: fragment"));
    assertTrue(logged(Level.ERROR, "Invalid fragment arguments"));
  }

  @Test
  void malformedArgumentReturnsInvalidArgs() {
    ExitCode code = FragmentCli.run(new String[] {"bogus"}, FIXED_CLOCK);

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(logged(Level.ERROR, "Invalid argument"));
  }

  @Test
  void invertedWindowIsRejectedBeforeReading() throws Exception {
    Path in = input();
    Path out = tempDir.resolve("never.ndjson");

    ExitCode code = FragmentCli.run(
        new String[] {"in=" + in, "out=" + out, "minLength=300", "maxLength=250"}, FIXED_CLOCK);

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(logged(Level.ERROR, "minLength must not exceed maxLength"));
    assertFalse(Files.exists(out));
  }

  @Test
  void nonexistentInputFileIsRejected() {
    ExitCode code = FragmentCli.run(
        new String[] {"in=" + tempDir.resolve("absent.ndjson"), "out=" + tempDir.resolve("o.ndjson")}, FIXED_CLOCK);

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(logged(Level.ERROR, "Invalid file path configuration"));
  }

  @Test
  void existingOutputRequiresAllowOverwrite() throws Exception {
    Path in = input();
    Path out = Files.writeString(tempDir.resolve("existing.ndjson"), "stale\n");

    ExitCode refused = FragmentCli.run(new String[] {"in=" + in, "out=" + out, "minLength=5"}, FIXED_CLOCK);
    assertEquals(ExitCode.INVALID_ARGS, refused);
    assertEquals(List.of("stale"), Files.readAllLines(out));

    ExitCode replaced = FragmentCli.run(
        new String[] {"in=" + in, "out=" + out, "minLength=5", "--allow-overwrite"}, FIXED_CLOCK);
    assertEquals(ExitCode.SUCCESS, replaced);
    assertEquals(3, Files.readAllLines(out, StandardCharsets.UTF_8).size());
  }

  @Test
  void yamlConfigSuppliesValuesAndCliWins() throws Exception {
    Path in = input();
    Path out = tempDir.resolve("yaml/fragments.ndjson");
    Path config = tempDir.resolve("fragmenter.yaml");
    Files.writeString(config, String.join("\n",
        "fragment:",
        "  minLength: 100",
        "  sourceType: from_yaml",
        ""));

    ExitCode code = FragmentCli.run(
        new String[] {"config=" + config, "in=" + in, "out=" + out, "minLength=5"}, FIXED_CLOCK);

    assertEquals(ExitCode.SUCCESS, code);
    List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);
    assertEquals(3, lines.size());
    assertTrue(lines.get(0).contains("\"source_type\":\"from_yaml\""), lines.get(0));
    assertTrue(logged(Level.WARN, "CLI overrides YAML for key: minLength"));
  }

  @Test
  void missingConfigFileIsRejected() {
    ExitCode code = FragmentCli.run(
        new String[] {"config=" + tempDir.resolve("absent.yaml"), "in=x"}, FIXED_CLOCK);

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(logged(Level.ERROR, "Configuration file does not exist"));
  }

  @Test
  void malformedInputLineIsAnIoError() throws Exception {
    Path in = Files.writeString(tempDir.resolve("broken.ndjson"), "{\"text\": nope\n");

    ExitCode code = FragmentCli.run(
        new String[] {"in=" + in, "out=" + tempDir.resolve("broken-out.ndjson")}, FIXED_CLOCK);

    assertEquals(ExitCode.IO_ERROR, code);
  }

  @Test
  void unknownSwitchIsRejectedBeforeAnyWork() throws Exception {
    Path in = input();
    Path out = tempDir.resolve("unknown/fragments.ndjson");

    ExitCode code = FragmentCli.run(new String[] {"in=" + in, "out=" + out, "--fast"}, FIXED_CLOCK);

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(logged(Level.ERROR, "Unknown option(s): --fast"));
    assertFalse(Files.exists(out));
  }

  @Test
  void helpPrintsUsage() {
    ExitCode code = FragmentCli.run(new String[] {"--help"}, FIXED_CLOCK);

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("in=PATH"));
  }
}
