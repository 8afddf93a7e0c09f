package ca.gc.cra.fragmenter.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads fragmenter configuration from a YAML document and flattens it into the keys {@link ConfigMerger}
 * understands.
 *
 * <p>Only the {@code common} section and the section named after the mode are read; other top-level
 * sections are logged and ignored. Settings may be written flat or grouped under {@code batch},
 * {@code window}, {@code worker}, {@code task}, {@code otel}, or {@code metrics}; grouped keys are mapped
 * onto their flat names.</p>
 *
 * <p>Example:</p>
 * <pre>
 * common:
 *   metricsExporter: none
 * fragment:
 *   textField: text
 *   window:
 *     min: 30        # minLength
 *     max: 250       # maxLength
 *   batch:
 *     size: 50000    # batchSize
 *     workers: 4     # workers
 * </pre>
 */
public final class YamlConfigLoader {
  private static final Logger log = LoggerFactory.getLogger(YamlConfigLoader.class);
  private static final String COMMON = "common";
  private static final Map<String, String> GROUPED_KEYS = Map.ofEntries(
      Map.entry("batch.size", "batchSize"),
      Map.entry("batch.workers", "workers"),
      Map.entry("batch.taskTimeoutMs", "taskTimeoutMs"),
      Map.entry("worker.count", "workers"),
      Map.entry("task.timeoutMs", "taskTimeoutMs"),
      Map.entry("window.min", "minLength"),
      Map.entry("window.max", "maxLength"),
      Map.entry("window.minLength", "minLength"),
      Map.entry("window.maxLength", "maxLength"),
      Map.entry("otel.endpoint", "otelEndpoint"),
      Map.entry("otel.resourceAttributes", "otelResourceAttributes"),
      Map.entry("metrics.exporter", "metricsExporter"));

  private YamlConfigLoader() {}

  /**
   * Loads YAML from {@code path} and overlays the {@code mode} section on the {@code common} section.
   *
   * @param path location of the YAML configuration
   * @param mode CLI mode whose section is read (for example {@code fragment})
   * @return flat map of merged settings; empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid, a grouped key is not recognised,
   *     or one setting is given twice in the same section
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    String normalizedMode = mode.trim().toLowerCase(Locale.ROOT);
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return Optional.of(Map.of());
      }
      Map<String, Object> root = asMap(document, "root");

      Map<String, String> merged = new LinkedHashMap<>();
      Object commonSection = null;
      Object modeSection = null;
      for (Map.Entry<String, Object> entry : root.entrySet()) {
        String section = entry.getKey().trim().toLowerCase(Locale.ROOT);
        if (section.equals(COMMON)) {
          commonSection = entry.getValue();
        } else if (section.equals(normalizedMode)) {
          modeSection = entry.getValue();
        } else {
          log.warn("Ignoring YAML section '{}' in {}; expected {} or {}",
              entry.getKey(), path, COMMON, normalizedMode);
        }
      }
      if (commonSection != null) {
        merged.putAll(readSection(commonSection, COMMON));
      }
      if (modeSection != null) {
        merged.putAll(readSection(modeSection, normalizedMode));
      } else {
        log.debug("No '{}' section in {}; using common settings only", normalizedMode, path);
      }
      return Optional.of(Map.copyOf(merged));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }

  private static Map<String, String> readSection(Object node, String section) {
    Map<String, String> settings = new LinkedHashMap<>();
    flatten(asMap(node, section), "", section, settings);
    return settings;
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static void flatten(
      Map<String, Object> source, String prefix, String section, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey().trim();
      if (key.isEmpty()) {
        throw new IllegalArgumentException("YAML contains blank keys in section " + section);
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, section, target);
        continue;
      }
      if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML arrays are not supported for key " + composite);
      }
      String name = prefix.isEmpty() ? key : GROUPED_KEYS.get(composite);
      if (name == null) {
        throw new IllegalArgumentException(
            "Unsupported grouped key " + composite + " in section " + section + "; supported: "
                + new TreeSet<>(GROUPED_KEYS.keySet()));
      }
      String text = value == null ? "" : value.toString();
      if (target.putIfAbsent(name, text) != null) {
        throw new IllegalArgumentException("Setting " + name + " is given more than once in section " + section);
      }
    }
  }
}
