package ca.gc.cra.fragmenter.domain.text;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LengthWindowTest {

  @Test
  void defaultsAreThirtyToTwoFifty() {
    LengthWindow window = LengthWindow.defaults();

    assertEquals(30, window.minLength());
    assertEquals(250, window.maxLength());
  }

  @Test
  void containsIsInclusiveOnBothEnds() {
    LengthWindow window = new LengthWindow(5, 10);

    assertFalse(window.contains(4));
    assertTrue(window.contains(5));
    assertTrue(window.contains(10));
    assertFalse(window.contains(11));
    assertTrue(window.meetsMinimum(11));
  }

  @Test
  void equalBoundsAreAllowed() {
    assertTrue(new LengthWindow(7, 7).contains(7));
  }

  @Test
  void invertedBoundsAreRejectedWithBothValues() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> new LengthWindow(300, 250));

    assertTrue(ex.getMessage().contains("300 > 250"), ex.getMessage());
  }

  @Test
  void nonPositiveBoundsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> new LengthWindow(0, 10));
    assertThrows(IllegalArgumentException.class, () -> new LengthWindow(-1, 10));
  }
}
