package ca.gc.cra.fragmenter.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {
  private static final Map<String, String> ALIASES = Map.of(
      "batch.size", "batchSize",
      "worker.count", "workers",
      "workerCount", "workers",
      "task.timeoutMs", "taskTimeoutMs");

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI &gt; YAML &gt; defaults.
   *
   * @param mode active CLI mode
   * @param yaml optional YAML-derived settings for the mode
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn consumer invoked for CLI overrides of YAML keys and for unknown keys
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when the merged window is inverted
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = canonicalize(yaml.orElse(Map.of()));
    Map<String, String> cliCopy = canonicalize(cli == null ? Map.of() : cli);
    Consumer<String> sink = warn == null ? message -> {} : warn;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      if (yamlCopy.containsKey(entry.getKey())) {
        sink.accept("CLI overrides YAML for key: " + entry.getKey());
      }
      if (entry.getValue() != null) {
        merged.put(entry.getKey(), entry.getValue());
      }
    }
    if (!defaultsCopy.isEmpty()) {
      for (String key : merged.keySet()) {
        if (!defaultsCopy.containsKey(key)) {
          sink.accept("Ignoring unknown " + mode + " configuration key: " + key);
        }
      }
    }

    validate(merged);
    return Map.copyOf(merged);
  }

  private static Map<String, String> canonicalize(Map<String, String> source) {
    Map<String, String> result = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : source.entrySet()) {
      if (entry.getKey() == null) {
        continue;
      }
      result.put(ALIASES.getOrDefault(entry.getKey(), entry.getKey()), entry.getValue());
    }
    return result;
  }

  private static void validate(Map<String, String> effective) {
    Integer min = parseOrNull(effective.get("minLength"));
    Integer max = parseOrNull(effective.get("maxLength"));
    if (min != null && max != null && min > max) {
      throw new IllegalArgumentException(
          "minLength must not exceed maxLength (was " + min + " > " + max + ")");
    }
  }

  private static Integer parseOrNull(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return Integer.valueOf(value.trim());
    } catch (NumberFormatException ex) {
      // non-numeric values are rejected by FragmentConfig.fromMap
      return null;
    }
  }
}
