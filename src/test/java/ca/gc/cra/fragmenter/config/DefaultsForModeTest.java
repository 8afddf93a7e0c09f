package ca.gc.cra.fragmenter.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void fragmentDefaultsCoverEveryConfigurableKey() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("fragment");

    assertEquals("30", defaults.get("minLength"));
    assertEquals("250", defaults.get("maxLength"));
    assertEquals("100000", defaults.get("batchSize"));
    assertEquals("60000", defaults.get("taskTimeoutMs"));
    assertEquals("text", defaults.get("textField"));
    assertEquals("sentence_fragment", defaults.get("sourceType"));
    assertEquals("forward", defaults.get("offsetMode"));
    assertEquals("split_output", defaults.get("out"));
    assertEquals("none", defaults.get("metricsExporter"));
    assertTrue(Integer.parseInt(defaults.get("workers")) >= 1);
  }

  @Test
  void modeLookupIgnoresCase() {
    assertEquals(DefaultsForMode.asFlatMap("fragment"), DefaultsForMode.asFlatMap(" FRAGMENT "));
  }

  @Test
  void unsupportedModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
