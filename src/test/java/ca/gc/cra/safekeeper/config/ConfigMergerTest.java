package ca.gc.cra.safekeeper.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> defaults = Map.of("eventSink", "log", "metricsExporter", "otlp");
    Map<String, String> yaml = Map.of("eventSink", "none", "state", "/var/lib/ledger.yaml");
    Map<String, String> cli = Map.of("eventSink", "log", "caller", "0xabc");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "store",
        Optional.of(yaml),
        cli,
        defaults,
        warnings::add);

    assertEquals("log", merged.get("eventSink"));
    assertEquals("/var/lib/ledger.yaml", merged.get("state"));
    assertEquals("otlp", merged.get("metricsExporter"));
    assertEquals("0xabc", merged.get("caller"));
    assertEquals(List.of("CLI overrides YAML for key: eventSink"), warnings);
  }

  @Test
  void yamlOverridesDefaultsSilently() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "show",
        Optional.of(Map.of("metricsExporter", "none")),
        Map.of(),
        Map.of("metricsExporter", "otlp"),
        warnings::add);

    assertEquals("none", merged.get("metricsExporter"));
    assertTrue(warnings.isEmpty());
  }

  @Test
  void kafkaSinkRequiresBootstrap() {
    Map<String, String> defaults = Map.of("eventSink", "log", "kafkaBootstrap", "");
    Map<String, String> cli = Map.of("eventSink", "KAFKA");

    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "claim",
            Optional.empty(),
            cli,
            defaults,
            msg -> {}));
  }

  @Test
  void deployRequiresOwner() {
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "deploy",
            Optional.of(Map.of()),
            Map.of("owner", " "),
            Map.of(),
            msg -> {}));

    assertEquals("deploy requires owner=ADDRESS", ex.getMessage());
  }
}
