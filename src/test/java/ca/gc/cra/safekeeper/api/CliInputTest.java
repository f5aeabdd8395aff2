package ca.gc.cra.safekeeper.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class CliInputTest {
  @Test
  void separatesFlagsFromKeyValues() {
    CliInput input = CliInput.parse(new String[] {"caller=0x1", "--DRY-RUN", "-v", "id=2", " "});

    assertArrayEquals(new String[] {"caller=0x1", "id=2"}, input.keyValueArgs());
    assertTrue(input.hasFlag("--dry-run"));
    assertTrue(input.verbose());
    assertFalse(input.help());
    assertTrue(input.unknownFlags().isEmpty());
  }

  @Test
  void reportsUnknownFlags() {
    CliInput input = CliInput.parse(new String[] {"--force", "-h"});

    assertTrue(input.help());
    assertEquals(List.of("--force"), input.unknownFlags());
  }

  @Test
  void emptyInput() {
    CliInput input = CliInput.parse(null);

    assertEquals(0, input.keyValueArgs().length);
    assertFalse(input.hasFlag(null));
  }
}
