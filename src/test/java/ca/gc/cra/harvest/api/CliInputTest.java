package ca.gc.cra.harvest.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValueArgs() {
    CliInput input = CliInput.parse(new String[] {"-v", "spec=a.yaml", "--JSON", "-h"});

    assertTrue(input.verbose());
    assertTrue(input.help());
    assertTrue(input.hasFlag("--json"));
    assertArrayEquals(new String[] {"spec=a.yaml"}, input.keyValueArgs());
  }

  @Test
  void emptyInputHasNoFlags() {
    CliInput input = CliInput.parse(null);

    assertFalse(input.help());
    assertFalse(input.verbose());
    assertFalse(input.hasFlag(null));
  }
}
