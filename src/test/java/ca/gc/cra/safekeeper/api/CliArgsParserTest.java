package ca.gc.cra.safekeeper.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  @Test
  void parsesKeyValuePairsInOrder() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"caller=0xabc", " id = 7 ", ""});

    assertEquals(List.of("caller", "id"), List.copyOf(map.keySet()));
    assertEquals("7", map.get("id"));
  }

  @Test
  void valuesMayContainEquals() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"otelResourceAttributes=env=dev,team=ledger"});

    assertEquals("env=dev,team=ledger", map.get("otelResourceAttributes"));
  }

  @Test
  void rejectsMalformedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"invalid"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"key="}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"bad key=1"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"key=a\u0001b"}));
    IllegalArgumentException duplicate = assertThrows(IllegalArgumentException.class,
        () -> CliArgsParser.toMap(new String[] {"id=1", "id=2"}));
    assertTrue(duplicate.getMessage().contains("given more than once"));
  }

  @Test
  void nullArgumentsYieldEmptyMap() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }
}
