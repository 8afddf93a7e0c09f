package ca.gc.cra.fragmenter.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.fragmenter.domain.record.OffsetMode;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FragmentConfigTest {

  private static Map<String, String> args(String... keyValues) {
    Map<String, String> map = new HashMap<>();
    map.put("in", "records.ndjson");
    for (int i = 0; i < keyValues.length; i += 2) {
      map.put(keyValues[i], keyValues[i + 1]);
    }
    return map;
  }

  @Test
  void defaultsApplyWhenOnlyInputGiven() {
    FragmentConfig config = FragmentConfig.fromMap(args());

    assertEquals(Path.of("records.ndjson"), config.input());
    assertEquals(Path.of("split_output"), config.output());
    assertEquals(30, config.fragmenterSettings().window().minLength());
    assertEquals(250, config.fragmenterSettings().window().maxLength());
    assertEquals("text", config.fragmenterSettings().textField());
    assertEquals(OffsetMode.FORWARD, config.fragmenterSettings().offsetMode());
    assertEquals(100_000, config.batchSettings().batchSize());
    assertEquals(Duration.ofSeconds(60), config.batchSettings().taskTimeout());
    assertEquals("none", config.metricsExporter());
  }

  @Test
  void explicitValuesAreParsed() {
    FragmentConfig config = FragmentConfig.fromMap(args(
        "out", "out/run.ndjson",
        "minLength", "5",
        "maxLength", " 80 ",
        "batchSize", "1000",
        "workers", "3",
        "taskTimeoutMs", "2500",
        "textField", "body",
        "sourceType", "zh_split",
        "offsetMode", "first",
        "metricsExporter", "OTLP"));

    assertEquals(Path.of("out/run.ndjson"), config.output());
    assertEquals(5, config.fragmenterSettings().window().minLength());
    assertEquals(80, config.fragmenterSettings().window().maxLength());
    assertEquals(1000, config.batchSettings().batchSize());
    assertEquals(3, config.batchSettings().workerCount());
    assertEquals(Duration.ofMillis(2500), config.batchSettings().taskTimeout());
    assertEquals("body", config.fragmenterSettings().textField());
    assertEquals("zh_split", config.fragmenterSettings().sourceType());
    assertEquals(OffsetMode.FIRST_OCCURRENCE, config.fragmenterSettings().offsetMode());
    assertEquals("otlp", config.metricsExporter());
  }

  @Test
  void blankValuesFallBackToDefaults() {
    FragmentConfig config = FragmentConfig.fromMap(args("minLength", "", "textField", "  "));

    assertEquals(30, config.fragmenterSettings().window().minLength());
    assertEquals("text", config.fragmenterSettings().textField());
  }

  @Test
  void inputIsRequired() {
    Map<String, String> map = new HashMap<>();

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> FragmentConfig.fromMap(map));

    assertTrue(ex.getMessage().startsWith("in is required"), ex.getMessage());
  }

  @Test
  void outOfRangeAndMalformedNumbersAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> FragmentConfig.fromMap(args("batchSize", "0")));
    assertThrows(IllegalArgumentException.class, () -> FragmentConfig.fromMap(args("workers", "5000")));
    assertThrows(IllegalArgumentException.class, () -> FragmentConfig.fromMap(args("minLength", "ten")));
    assertThrows(IllegalArgumentException.class, () -> FragmentConfig.fromMap(args("taskTimeoutMs", "-1")));
    assertThrows(IllegalArgumentException.class,
        () -> FragmentConfig.fromMap(args("minLength", "40", "maxLength", "20")));
  }

  @Test
  void unknownEnumsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> FragmentConfig.fromMap(args("offsetMode", "sideways")));
    assertThrows(IllegalArgumentException.class, () -> FragmentConfig.fromMap(args("metricsExporter", "prometheus")));
  }
}
