package ca.gc.cra.fragmenter.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {
  @TempDir Path tempDir;

  @Test
  void readableFileIsNormalized() throws Exception {
    Path file = Files.writeString(tempDir.resolve("in.ndjson"), "{}\n");

    Path validated = Paths.validateReadableFile(tempDir.resolve("sub/../in.ndjson"));

    assertEquals(file.toAbsolutePath().normalize(), validated);
  }

  @Test
  void missingOrDirectoryInputIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> Paths.validateReadableFile(tempDir.resolve("absent")));
    assertThrows(IllegalArgumentException.class, () -> Paths.validateReadableFile(tempDir));
    assertThrows(IllegalArgumentException.class, () -> Paths.validateReadableFile(null));
  }

  @Test
  void outputParentsAreCreatedOnRequest() {
    Path target = tempDir.resolve("a/b/out.ndjson");

    Path validated = Paths.validateOutputFile(target, true, false);

    assertTrue(Files.isDirectory(validated.getParent()));
  }

  @Test
  void missingParentIsRejectedWithoutCreation() {
    assertThrows(IllegalArgumentException.class,
        () -> Paths.validateOutputFile(tempDir.resolve("missing/out.ndjson"), false, false));
  }

  @Test
  void existingOutputNeedsOverwritePermission() throws Exception {
    Path existing = Files.writeString(tempDir.resolve("out.ndjson"), "old\n");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Paths.validateOutputFile(existing, true, false));

    assertTrue(ex.getMessage().contains("--allow-overwrite"), ex.getMessage());
    assertEquals(existing.toAbsolutePath().normalize(), Paths.validateOutputFile(existing, true, true));
  }

  @Test
  void directoryOutputIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> Paths.validateOutputFile(tempDir, true, true));
  }
}
