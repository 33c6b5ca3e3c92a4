package ca.gc.cra.rpx.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {
  @TempDir Path tempDir;

  @Test
  void modeSectionOverridesCommon() throws IOException {
    Path file = tempDir.resolve("rpx.yaml");
    Files.writeString(file, String.join("\n",
        "common:",
        "  port: 9002",
        "  nfft: 512",
        "serve:",
        "  port: 9443",
        "  defaultPermissions: [logs, admin]",
        "  sweep:",
        "    sampleRate: 2048000",
        ""));

    Map<String, String> values = YamlConfigLoader.load(file, "serve");

    assertEquals("9443", values.get("port"));
    assertEquals("512", values.get("nfft"));
    assertEquals("logs,admin", values.get("defaultPermissions"));
    assertEquals("2048000", values.get("sweep.sampleRate"));
  }

  @Test
  void otherModesAreIgnored() throws IOException {
    Path file = tempDir.resolve("rpx.yaml");
    Files.writeString(file, "replay:\n  port: 1\n");

    assertTrue(YamlConfigLoader.load(file, "serve").isEmpty());
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    Path file = tempDir.resolve("empty.yaml");
    Files.writeString(file, "");

    assertTrue(YamlConfigLoader.load(file, "serve").isEmpty());
  }

  @Test
  void missingFileIsIoError() {
    assertThrows(IOException.class, () -> YamlConfigLoader.load(tempDir.resolve("nope.yaml"), "serve"));
  }

  @Test
  void malformedYamlIsRejected() throws IOException {
    Path file = tempDir.resolve("bad.yaml");
    Files.writeString(file, "serve: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(file, "serve"));
  }

  @Test
  void scalarSectionIsRejected() throws IOException {
    Path file = tempDir.resolve("scalar.yaml");
    Files.writeString(file, "serve: 5\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(file, "serve"));
  }
}
