package ca.gc.cra.fragmenter.domain.text;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CodePointsTest {

  @Test
  void spaceCoversNoBreakAndSeparatorCharacters() {
    for (int cp : new int[] {' ', '\t', '\n', 0x85, 0xA0, 0x2007, 0x202F, 0x3000, 0x2028}) {
      assertTrue(CodePoints.isSpace(cp), "expected space: U+" + Integer.toHexString(cp));
    }
    assertFalse(CodePoints.isSpace('甲'));
    assertFalse(CodePoints.isSpace('。'));
    assertFalse(CodePoints.isSpace(0x20000));
  }

  @Test
  void stripRemovesOnlyOuterSpace() {
    assertEquals("甲 乙", CodePoints.strip(" 　甲 乙 \u0085"));
    assertEquals("𠀀", CodePoints.strip(" 𠀀 "));
    assertEquals("", CodePoints.strip("  "));
    assertEquals("", CodePoints.strip(""));
  }

  @Test
  void lengthAndSliceCountSupplementaryCharactersOnce() {
    assertEquals(3, CodePoints.length("𠀀甲𠀁"));
    assertEquals("甲𠀁", CodePoints.slice("𠀀甲𠀁", 1, 3));
  }
}
