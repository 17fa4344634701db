package ca.gc.cra.harvest.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(10, Numbers.requireRange("maxConcurrency", 10, 0, 64));
  }

  @Test
  void requireRangeRejectsValuesBelowMinimum() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("maxConcurrency", -1, 0, 64));
    assertEquals("maxConcurrency must be between 0 and 64 (was -1)", ex.getMessage());
  }

  @Test
  void requireRangeRejectsValuesAboveMaximum() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("maxConcurrency", 65, 0, 64));
  }

  @Test
  void parseRangeTrimsAndParses() {
    assertEquals(42L, Numbers.parseRange("maxConcurrency", " 42 ", 0, 100));
  }

  @Test
  void parseRangeRejectsNonNumeric() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseRange("maxConcurrency", "ten", 0, 100));
    assertEquals("maxConcurrency must be an integer (was ten)", ex.getMessage());
  }
}
