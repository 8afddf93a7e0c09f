package ca.gc.cra.fragmenter.config;

import ca.gc.cra.fragmenter.application.pipeline.BatchSettings;
import ca.gc.cra.fragmenter.domain.record.FragmenterSettings;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each fragmenter CLI mode.
 *
 * <p>The defaults are the single source of truth for optional YAML keys; any key absent here is reported
 * as unknown by {@link ConfigMerger}.</p>
 */
public final class DefaultsForMode {
  /** Mode name of the fragmentation command and its YAML section. */
  public static final String FRAGMENT = "fragment";
  /** Default output directory when {@code out} is not supplied. */
  public static final String DEFAULT_OUTPUT_DIRECTORY = "split_output";

  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target CLI mode; only {@code fragment} is supported
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException if the mode is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    if (!FRAGMENT.equals(normalized)) {
      throw new IllegalArgumentException("Unsupported mode: " + mode);
    }
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(buildFragmentDefaults());
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildFragmentDefaults() {
    FragmenterSettings fragmenter = FragmenterSettings.defaults();
    BatchSettings batch = BatchSettings.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("in", "");
    map.put("out", DEFAULT_OUTPUT_DIRECTORY);
    map.put("minLength", Integer.toString(fragmenter.window().minLength()));
    map.put("maxLength", Integer.toString(fragmenter.window().maxLength()));
    map.put("batchSize", Integer.toString(batch.batchSize()));
    map.put("workers", Integer.toString(batch.workerCount()));
    map.put("taskTimeoutMs", Long.toString(batch.taskTimeout().toMillis()));
    map.put("textField", fragmenter.textField());
    map.put("sourceType", fragmenter.sourceType());
    map.put("offsetMode", fragmenter.offsetMode().name().toLowerCase(Locale.ROOT));
    map.put("allowOverwrite", "false");
    map.put("dryRun", "false");
    return map;
  }
}
