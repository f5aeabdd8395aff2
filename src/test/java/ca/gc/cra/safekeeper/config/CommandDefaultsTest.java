package ca.gc.cra.safekeeper.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CommandDefaultsTest {

  @Test
  void deployCarriesFeeDefaults() {
    Map<String, String> defaults = CommandDefaults.asFlatMap("deploy");

    assertEquals("42", defaults.get("feeBasisPoints"));
    assertEquals("STORE_AND_CLAIM", defaults.get("feePolicy"));
    assertEquals("false", defaults.get("allowOverwrite"));
    assertEquals("false", defaults.get("dryRun"));
    assertEquals("log", defaults.get("eventSink"));
    assertEquals(LedgerConfig.DEFAULT_KAFKA_TOPIC, defaults.get("kafkaTopic"));
  }

  @Test
  void showIsReadOnly() {
    Map<String, String> defaults = CommandDefaults.asFlatMap(" SHOW ");

    assertFalse(defaults.containsKey("dryRun"));
    assertFalse(defaults.containsKey("feeBasisPoints"));
    assertEquals("otlp", defaults.get("metricsExporter"));
  }

  @Test
  void everyCommandHasDefaults() {
    for (String command : CommandDefaults.COMMANDS) {
      assertEquals(LedgerConfig.defaults().statePath().toString(), CommandDefaults.asFlatMap(command).get("state"));
    }
  }

  @Test
  void unknownCommandIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> CommandDefaults.asFlatMap("mint"));
  }

  @Test
  void acceptedKeysCombineSharedSettingsWithCommandArguments() {
    assertTrue(CommandDefaults.acceptedKeys("withdraw-fees").containsAll(
        Set.of("recipient", "caller", "dryRun", "state", "now")));
    assertFalse(CommandDefaults.acceptedKeys("show").contains("dryRun"));
    assertFalse(CommandDefaults.commonKeys().contains("caller"));
    assertThrows(IllegalArgumentException.class, () -> CommandDefaults.acceptedKeys("mint"));
  }

  @Test
  void everyDefaultIsAnAcceptedKey() {
    for (String command : CommandDefaults.COMMANDS) {
      assertTrue(CommandDefaults.acceptedKeys(command).containsAll(CommandDefaults.asFlatMap(command).keySet()),
          command);
    }
  }
}
