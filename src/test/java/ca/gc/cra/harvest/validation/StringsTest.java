package ca.gc.cra.harvest.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("value", Strings.requireNonBlank("test", "  value  "));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("test", "bad\u0001"));
  }

  @Test
  void requireNonBlankRejectsBlank() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "   "));
    assertEquals("name must not be blank", ex.getMessage());
  }

  @Test
  void requireTableNameAllowsSafeCharactersAndWildcard() {
    assertEquals("aws_ec2.instances-v2", Strings.requireTableName("table", "aws_ec2.instances-v2"));
    assertEquals("*", Strings.requireTableName("table", " * "));
  }

  @Test
  void requireTableNameRejectsInvalidCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireTableName("table", "ec2 instances"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireTableName("table", "users*"));
  }
}
