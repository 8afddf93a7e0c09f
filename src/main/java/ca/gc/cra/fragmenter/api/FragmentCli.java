package ca.gc.cra.fragmenter.api;

import ca.gc.cra.fragmenter.application.pipeline.BatchOrchestrator;
import ca.gc.cra.fragmenter.application.pipeline.BatchSettings;
import ca.gc.cra.fragmenter.application.pipeline.RunSummary;
import ca.gc.cra.fragmenter.application.port.ClockPort;
import ca.gc.cra.fragmenter.application.port.MetricsPort;
import ca.gc.cra.fragmenter.config.ConfigMerger;
import ca.gc.cra.fragmenter.config.DefaultsForMode;
import ca.gc.cra.fragmenter.config.FragmentConfig;
import ca.gc.cra.fragmenter.config.YamlConfigLoader;
import ca.gc.cra.fragmenter.domain.record.FragmenterSettings;
import ca.gc.cra.fragmenter.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.fragmenter.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.fragmenter.infrastructure.persistence.ndjson.NdjsonRecordSource;
import ca.gc.cra.fragmenter.infrastructure.persistence.ndjson.NdjsonResultSink;
import ca.gc.cra.fragmenter.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.fragmenter.logging.LoggingConfigurator;
import ca.gc.cra.fragmenter.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for fragmenting the text column of an NDJSON record file.
 *
 * @since 0.1.0
 */
public final class FragmentCli {
  private static final Logger log = LoggerFactory.getLogger(FragmentCli.class);
  private static final DateTimeFormatter FILE_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss", Locale.ROOT).withZone(ZoneId.systemDefault());
  static final String OUTPUT_PREFIX = "sentence_fragments_";
  static final String OUTPUT_SUFFIX = ".ndjson";
  private static final String SUMMARY_USAGE =
      "usage: fragment in=PATH [out=DIR|FILE.ndjson] [minLength=N] [maxLength=N] [batchSize=N] "
          + "[workers=N] [taskTimeoutMs=N] [textField=NAME] [sourceType=TAG] [offsetMode=forward|first] "
          + "[config=PATH] [metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...] "
          + "[--dry-run] [--allow-overwrite]";
  private static final String HELP_TEXT = """
      Fragmenter: split long text fields into sentence-sized fragments

      Usage:
        fragment in=records.ndjson [options]

      Required:
        in=PATH                  NDJSON input, one JSON object per line

      Output:
        out=DIR|FILE             Directory for sentence_fragments_<yyyyMMdd_HHmmss>.ndjson (default split_output),
                                 or an explicit .ndjson/.jsonl file

      Fragmentation:
        minLength=N              Minimum fragment length in characters (default 30)
        maxLength=N              Maximum fragment length in characters (default 250)
        textField=NAME           Field holding the text to split (default text)
        sourceType=TAG           Value written to source_type (default sentence_fragment)
        offsetMode=forward|first How fragment_start is located (default forward)

      Execution:
        batchSize=N              Records loaded and processed per batch (default 100000)
        workers=N                Worker threads per batch (default: processors - 1, at least 1)
        taskTimeoutMs=N          Per-record timeout in milliseconds (default 60000)

      Global options:
        config=PATH              YAML file with common/fragment sections; CLI values win
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL         OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --dry-run                Validate configuration and print the plan without reading records
        --allow-overwrite        Replace an existing output file
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private FragmentCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the fragment CLI and returns a normalized exit code.
   *
   * @param args raw CLI arguments
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    return run(args, new SystemClockAdapter());
  }

  static ExitCode run(String[] args, ClockPort clock) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for fragment CLI");
    }

    if (!input.unknownFlags().isEmpty()) {
      log.error("Unknown option(s): {}", String.join(", ", input.unknownFlags()));
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String configPath = ConfigCliUtils.extractConfigPath(kv);
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, DefaultsForMode.FRAGMENT);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    Map<String, String> effective;
    FragmentConfig config;
    try {
      effective = ConfigMerger.buildEffectiveConfig(
          DefaultsForMode.FRAGMENT,
          yamlConfig,
          kv,
          DefaultsForMode.asFlatMap(DefaultsForMode.FRAGMENT),
          log::warn);
      TelemetryConfigurator.configureMetrics(effective);
      config = FragmentConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid fragment arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    boolean dryRun = input.dryRun() || ConfigCliUtils.parseBoolean(effective, "dryRun");
    boolean allowOverwrite = input.allowOverwrite() || ConfigCliUtils.parseBoolean(effective, "allowOverwrite");

    Path inputFile;
    Path outputFile;
    try {
      inputFile = Paths.validateReadableFile(config.input());
      Path resolved = resolveOutputFile(config.output(), clock).toAbsolutePath().normalize();
      Path parent = resolved.getParent();
      if (dryRun && parent != null && !Files.exists(parent)) {
        // dry runs never create directories; the directory is created on the real run
        outputFile = resolved;
      } else {
        outputFile = Paths.validateOutputFile(resolved, !dryRun, allowOverwrite);
      }
    } catch (IllegalArgumentException ex) {
      log.error("Invalid file path configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      printDryRunPlan(config, inputFile, outputFile, allowOverwrite);
      return ExitCode.SUCCESS;
    }

    OpenTelemetryMetricsAdapter otel = null;
    try {
      MetricsPort metrics;
      if ("otlp".equals(config.metricsExporter())) {
        otel = new OpenTelemetryMetricsAdapter();
        metrics = otel;
      } else {
        metrics = new NoOpMetricsAdapter();
      }
      BatchOrchestrator orchestrator =
          new BatchOrchestrator(config.fragmenterSettings(), config.batchSettings(), metrics);
      log.info(
          "Configured fragment pipeline: input={}, output={}, window={}..{}, batchSize={}, workers={}",
          inputFile,
          outputFile,
          config.fragmenterSettings().window().minLength(),
          config.fragmenterSettings().window().maxLength(),
          config.batchSettings().batchSize(),
          config.batchSettings().workerCount());
      RunSummary summary;
      Path written;
      try (NdjsonRecordSource source = new NdjsonRecordSource(inputFile);
          NdjsonResultSink sink = new NdjsonResultSink(outputFile, allowOverwrite)) {
        summary = orchestrator.run(source, sink);
        written = sink.file();
      }
      CliPrinter.printLines(
          "Fragmentation complete.",
          " Output file : " + written,
          " Records     : " + summary.records(),
          " Fragments   : " + summary.fragments(),
          " Batches     : " + summary.batches());
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Fragment pipeline I/O failure while processing {}", inputFile, ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Fragment pipeline configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Fragment pipeline interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in fragment pipeline", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      if (otel != null) {
        otel.close();
      }
    }
  }

  /**
   * Resolves the output file: an explicit {@code .ndjson}/{@code .jsonl} path is used as is, anything else is
   * treated as a directory receiving a timestamped file.
   */
  static Path resolveOutputFile(Path output, ClockPort clock) {
    Path fileName = output.getFileName();
    String name = fileName == null ? "" : fileName.toString().toLowerCase(Locale.ROOT);
    if (name.endsWith(".ndjson") || name.endsWith(".jsonl")) {
      return output;
    }
    String stamp = FILE_TIMESTAMP.format(Instant.ofEpochMilli(clock.nowMillis()));
    return output.resolve(OUTPUT_PREFIX + stamp + OUTPUT_SUFFIX);
  }

  private static void printDryRunPlan(
      FragmentConfig config, Path input, Path output, boolean allowOverwrite) {
    FragmenterSettings fragmenter = config.fragmenterSettings();
    BatchSettings batch = config.batchSettings();
    CliPrinter.printLines(
        "Fragment dry-run: no records will be read.",
        " Input file        : " + input,
        " Output file       : " + output,
        " Text field        : " + fragmenter.textField(),
        " Length window     : " + fragmenter.window().minLength() + ".." + fragmenter.window().maxLength(),
        " Source type       : " + fragmenter.sourceType(),
        " Offset mode       : " + fragmenter.offsetMode().name().toLowerCase(Locale.ROOT),
        " Batch size        : " + batch.batchSize(),
        " Workers           : " + batch.workerCount(),
        " Task timeout (ms) : " + batch.taskTimeout().toMillis(),
        " Metrics exporter  : " + config.metricsExporter(),
        " Allow overwrite   : " + allowOverwrite,
        " Re-run without --dry-run to fragment records.");
  }
}
