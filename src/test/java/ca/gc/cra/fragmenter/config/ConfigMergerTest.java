package ca.gc.cra.fragmenter.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  private static Map<String, String> defaults() {
    return DefaultsForMode.asFlatMap(DefaultsForMode.FRAGMENT);
  }

  @Test
  void cliOverridesYamlWhichOverridesDefaults() {
    List<String> warnings = new ArrayList<>();
    Map<String, String> yaml = Map.of("minLength", "10", "maxLength", "100");
    Map<String, String> cli = Map.of("maxLength", "120");

    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        DefaultsForMode.FRAGMENT, Optional.of(yaml), cli, defaults(), warnings::add);

    assertEquals("10", effective.get("minLength"));
    assertEquals("120", effective.get("maxLength"));
    assertEquals("100000", effective.get("batchSize"));
    assertTrue(warnings.contains("CLI overrides YAML for key: maxLength"), warnings.toString());
  }

  @Test
  void dottedAliasesAreCanonicalized() {
    Map<String, String> yaml = Map.of("batch.size", "500", "worker.count", "3", "task.timeoutMs", "1500");

    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        DefaultsForMode.FRAGMENT, Optional.of(yaml), Map.of("workerCount", "5"), defaults(), null);

    assertEquals("500", effective.get("batchSize"));
    assertEquals("5", effective.get("workers"));
    assertEquals("1500", effective.get("taskTimeoutMs"));
  }

  @Test
  void unknownKeysAreReportedButKept() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        DefaultsForMode.FRAGMENT, Optional.empty(), Map.of("colour", "blue"), defaults(), warnings::add);

    assertEquals("blue", effective.get("colour"));
    assertEquals(List.of("Ignoring unknown fragment configuration key: colour"), warnings);
  }

  @Test
  void invertedLengthWindowIsRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            DefaultsForMode.FRAGMENT, Optional.empty(), Map.of("minLength", "300"), defaults(), null));

    assertEquals("minLength must not exceed maxLength (was 300 > 250)", ex.getMessage());
  }

  @Test
  void nonNumericLengthsAreLeftForLaterValidation() {
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        DefaultsForMode.FRAGMENT, Optional.empty(), Map.of("minLength", "abc"), defaults(), null);

    assertEquals("abc", effective.get("minLength"));
  }
}
