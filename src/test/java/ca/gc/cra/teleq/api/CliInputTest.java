package ca.gc.cra.teleq.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValueArguments() {
    CliInput input = CliInput.parse(new String[] {"--json", "kql=traces", "-v", "stats"});

    assertTrue(input.hasFlag("--JSON"));
    assertTrue(input.verbose());
    assertFalse(input.help());
    assertArrayEquals(new String[] {"kql=traces", "stats"}, input.keyValueArgs());
  }

  @Test
  void recognisesHelpSpellings() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertTrue(CliInput.parse(new String[] {"--HELP"}).hasFlag("--help"));
  }

  @Test
  void dashedValuesWithEqualsStayKeyValue() {
    CliInput input = CliInput.parse(new String[] {"-x=1"});

    assertArrayEquals(new String[] {"-x=1"}, input.keyValueArgs());
    assertFalse(CliInput.parse(null).verbose());
  }
}
