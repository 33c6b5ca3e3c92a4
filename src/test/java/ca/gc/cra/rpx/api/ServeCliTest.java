package ca.gc.cra.rpx.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ServeCliTest {
  private StringWriter output;

  @TempDir Path tempDir;

  @BeforeEach
  void captureOutput() {
    output = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(output, true));
  }

  @AfterEach
  void restoreOutput() {
    CliPrinter.clearTestWriter();
    System.clearProperty("otel.metrics.exporter");
  }

  @Test
  void helpPrintsUsage() {
    assertEquals(ExitCode.SUCCESS, ServeCli.run(new String[] {"--help"}));
    assertTrue(output.toString().contains("RPX telemetry server"));
  }

  @Test
  void dryRunPrintsPlanWithoutBinding() {
    ExitCode exit = ServeCli.run(new String[] {
        "port=9443", "path=/spectrum", "nfft=1024", "defaultPermissions=logs", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, exit);
    String plan = output.toString();
    assertTrue(plan.contains("ws://0.0.0.0:9443/spectrum"), plan);
    assertTrue(plan.contains("nfft             : 1024"), plan);
    assertTrue(plan.contains("Permissions      : logs"), plan);
  }

  @Test
  void invalidValueReturnsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, ServeCli.run(new String[] {"nfft=1000", "--dry-run"}));
    assertTrue(output.toString().startsWith("usage: serve"));
  }

  @Test
  void malformedArgumentReturnsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, ServeCli.run(new String[] {"nfft", "--dry-run"}));
  }

  @Test
  void unknownMetricsExporterIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS,
        ServeCli.run(new String[] {"metricsExporter=prometheus", "--dry-run"}));
  }

  @Test
  void missingConfigFileIsIoError() {
    String missing = tempDir.resolve("absent.yaml").toString();

    assertEquals(ExitCode.IO_ERROR, ServeCli.run(new String[] {"config=" + missing, "--dry-run"}));
  }

  @Test
  void malformedConfigFileIsConfigError() throws IOException {
    Path file = tempDir.resolve("bad.yaml");
    Files.writeString(file, "serve: [broken\n");

    assertEquals(ExitCode.CONFIG_ERROR, ServeCli.run(new String[] {"config=" + file, "--dry-run"}));
  }

  @Test
  void commandLineOverridesYaml() throws IOException {
    Path file = tempDir.resolve("rpx.yaml");
    Files.writeString(file, "common:\n  nfft: 256\nserve:\n  port: 9100\n  path: /yaml\n");
    Map<String, String> cli = new HashMap<>(Map.of("config", file.toString(), "port", "9200"));

    Map<String, String> merged = ServeCli.mergeWithYaml(cli);

    assertEquals("9200", merged.get("port"));
    assertEquals("/yaml", merged.get("path"));
    assertEquals("256", merged.get("nfft"));
    assertFalse(merged.containsKey("config"));
  }

  @Test
  void yamlValuesReachDryRunPlan() throws IOException {
    Path file = tempDir.resolve("rpx.yaml");
    Files.writeString(file, "serve:\n  port: 9100\n  source: sweep\n");

    assertEquals(ExitCode.SUCCESS, ServeCli.run(new String[] {"config=" + file, "--dry-run"}));
    assertTrue(output.toString().contains(":9100/"));
    assertTrue(output.toString().contains("Sample source    : SWEEP"));
  }
}
