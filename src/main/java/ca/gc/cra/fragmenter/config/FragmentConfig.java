package ca.gc.cra.fragmenter.config;

import ca.gc.cra.fragmenter.application.pipeline.BatchSettings;
import ca.gc.cra.fragmenter.domain.record.FragmenterSettings;
import ca.gc.cra.fragmenter.domain.record.OffsetMode;
import ca.gc.cra.fragmenter.domain.text.LengthWindow;
import ca.gc.cra.fragmenter.validation.Numbers;
import ca.gc.cra.fragmenter.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Typed settings for one {@code fragment} CLI run.
 * <p><strong>Why:</strong> Converts the merged flat map into validated domain and pipeline settings before any
 * file is opened, so configuration errors surface as {@link IllegalArgumentException}s up front.</p>
 * <p><strong>Role:</strong> Adapter configuration aggregate consumed by the CLI.</p>
 * <p><strong>Thread-safety:</strong> Immutable once constructed.</p>
 *
 * @since 0.1.0
 * @see DefaultsForMode
 */
public final class FragmentConfig {
  static final int MAX_LENGTH_LIMIT = 1_000_000;
  static final int MAX_BATCH_SIZE = 10_000_000;
  static final int MAX_WORKERS = 1_024;
  static final int MAX_TASK_TIMEOUT_MS = 86_400_000;
  private static final int MAX_NAME_LENGTH = 256;

  private final Path input;
  private final Path output;
  private final FragmenterSettings fragmenterSettings;
  private final BatchSettings batchSettings;
  private final String metricsExporter;

  private FragmentConfig(
      Path input,
      Path output,
      FragmenterSettings fragmenterSettings,
      BatchSettings batchSettings,
      String metricsExporter) {
    this.input = Objects.requireNonNull(input, "input");
    this.output = Objects.requireNonNull(output, "output");
    this.fragmenterSettings = Objects.requireNonNull(fragmenterSettings, "fragmenterSettings");
    this.batchSettings = Objects.requireNonNull(batchSettings, "batchSettings");
    this.metricsExporter = Objects.requireNonNull(metricsExporter, "metricsExporter");
  }

  /**
   * Builds configuration from a flat key/value map, typically produced by {@link ConfigMerger}.
   * Missing optional keys fall back to {@link DefaultsForMode} values.
   *
   * @param args flat settings; must contain a non-blank {@code in}
   * @return validated configuration
   * @throws IllegalArgumentException if a value is missing, malformed, or out of range
   */
  public static FragmentConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    Map<String, String> defaults = DefaultsForMode.asFlatMap(DefaultsForMode.FRAGMENT);

    String rawInput = args.get("in");
    if (rawInput == null || rawInput.isBlank()) {
      throw new IllegalArgumentException("in is required (path to an NDJSON input file)");
    }
    Path input = toPath("in", rawInput);
    Path output = toPath("out", value(args, defaults, "out"));

    int minLength = Numbers.parseIntInRange("minLength", value(args, defaults, "minLength"), 1, MAX_LENGTH_LIMIT);
    int maxLength = Numbers.parseIntInRange("maxLength", value(args, defaults, "maxLength"), 1, MAX_LENGTH_LIMIT);
    LengthWindow window = new LengthWindow(minLength, maxLength);

    int batchSize = Numbers.parseIntInRange("batchSize", value(args, defaults, "batchSize"), 1, MAX_BATCH_SIZE);
    int workers = Numbers.parseIntInRange("workers", value(args, defaults, "workers"), 1, MAX_WORKERS);
    int timeoutMs = Numbers.parseIntInRange(
        "taskTimeoutMs", value(args, defaults, "taskTimeoutMs"), 1, MAX_TASK_TIMEOUT_MS);

    String textField = Strings.requireNonBlank("textField", value(args, defaults, "textField"));
    String sourceType = Strings.requireNonBlank("sourceType", value(args, defaults, "sourceType"));
    if (textField.length() > MAX_NAME_LENGTH || sourceType.length() > MAX_NAME_LENGTH) {
      throw new IllegalArgumentException("textField and sourceType must be at most " + MAX_NAME_LENGTH + " characters");
    }
    OffsetMode offsetMode = OffsetMode.fromString(value(args, defaults, "offsetMode"));

    String exporter = value(args, defaults, "metricsExporter").trim().toLowerCase(Locale.ROOT);
    if (!exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }

    return new FragmentConfig(
        input,
        output,
        new FragmenterSettings(textField, window, sourceType, offsetMode),
        new BatchSettings(batchSize, workers, Duration.ofMillis(timeoutMs)),
        exporter);
  }

  private static String value(Map<String, String> args, Map<String, String> defaults, String key) {
    String raw = args.get(key);
    if (raw == null || raw.isBlank()) {
      return defaults.get(key);
    }
    return raw.trim();
  }

  private static Path toPath(String name, String raw) {
    try {
      return Path.of(Strings.requireNonBlank(name, raw));
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + raw, ex);
    }
  }

  /**
   * Returns the NDJSON input file.
   *
   * @return input path as supplied
   */
  public Path input() {
    return input;
  }

  /**
   * Returns the output target: a {@code .ndjson}/{@code .jsonl} file, or a directory in which a timestamped file
   * is created.
   *
   * @return output path as supplied
   */
  public Path output() {
    return output;
  }

  /**
   * Returns per-record fragmentation settings.
   *
   * @return fragmenter settings
   */
  public FragmenterSettings fragmenterSettings() {
    return fragmenterSettings;
  }

  /**
   * Returns batch and worker settings.
   *
   * @return batch settings
   */
  public BatchSettings batchSettings() {
    return batchSettings;
  }

  /**
   * Returns the metrics exporter, {@code otlp} or {@code none}.
   *
   * @return normalized exporter name
   */
  public String metricsExporter() {
    return metricsExporter;
  }
}
