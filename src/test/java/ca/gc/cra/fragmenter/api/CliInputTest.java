package ca.gc.cra.fragmenter.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;
import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesSwitchesFromKeyValueArguments() {
    CliInput input = CliInput.parse(new String[] {"in=a.ndjson", "--DRY-RUN", "-v", " ", "workers=2"});

    assertArrayEquals(new String[] {"in=a.ndjson", "workers=2"}, input.keyValueArgs());
    assertTrue(input.dryRun());
    assertTrue(input.verbose());
    assertFalse(input.help());
    assertFalse(input.allowOverwrite());
    assertEquals(Set.of(), input.unknownFlags());
  }

  @Test
  void recognisesHelpAliases() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertFalse(CliInput.parse(null).help());
  }

  @Test
  void recognisesOverwriteAliases() {
    assertTrue(CliInput.parse(new String[] {"--allow-overwrite"}).allowOverwrite());
    assertTrue(CliInput.parse(new String[] {"--Overwrite"}).allowOverwrite());
    assertTrue(CliInput.parse(new String[] {"--dryrun"}).dryRun());
  }

  @Test
  void unrecognisedSwitchesAreCollectedAsTyped() {
    CliInput input = CliInput.parse(new String[] {"--Fast", "-x", "--config=a.yaml"});

    assertEquals(Set.of("--Fast", "-x"), input.unknownFlags());
    assertArrayEquals(new String[] {"--config=a.yaml"}, input.keyValueArgs());
  }
}
