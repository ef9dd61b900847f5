package chromatic.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import chromatic.core.error.EmptyStructureException;
import chromatic.core.error.MalformedInputException;
import java.util.List;
import org.junit.jupiter.api.Test;

final class CompositionTest {

  @Test
  void parsesAndFormatsCanonicalText() {
    Composition composition = Composition.parse("(2,1,3)");

    assertEquals(List.of(2, 1, 3), composition.parts());
    assertEquals(6, composition.n());
    assertEquals(3, composition.nparts());
    assertEquals("(2,1,3)", composition.toString());
    assertEquals(composition, Composition.parse(composition.toString()));
  }

  @Test
  void emptyTextIsTheCompositionOfZero() {
    Composition empty = Composition.parse("()");

    assertEquals(Composition.EMPTY, empty);
    assertEquals(0, empty.n());
    assertTrue(empty.isEmpty());
    assertEquals("()", empty.toString());
  }

  @Test
  void sizeOverflowFailsAsArithmetic() {
    Composition huge = Composition.of(Integer.MAX_VALUE, 1);

    assertEquals(2, huge.nparts());
    assertThrows(ArithmeticException.class, huge::n);
  }

  @Test
  void rejectsSignsAndNonAsciiDigits() {
    assertThrows(MalformedInputException.class, () -> Composition.parse("(+2)"));
    assertThrows(MalformedInputException.class, () -> Composition.parse("(1,\u0663)"));
    assertThrows(MalformedInputException.class, () -> Composition.parse("(\uff12)"));
  }

  @Test
  void toleratesWhitespaceAroundParts() {
    assertEquals(Composition.of(1, 2), Composition.parse(" ( 1, 2 ) "));
  }

  @Test
  void rejectsNonPositiveParts() {
    assertThrows(MalformedInputException.class, () -> Composition.of(1, 0));
    assertThrows(MalformedInputException.class, () -> Composition.parse("(3,-1)"));
    assertThrows(MalformedInputException.class, () -> Composition.of(2).prepend(0));
  }

  @Test
  void rejectsMalformedText() {
    assertThrows(MalformedInputException.class, () -> Composition.parse("2,1"));
    assertThrows(MalformedInputException.class, () -> Composition.parse("(2,,1)"));
    assertThrows(MalformedInputException.class, () -> Composition.parse("(a)"));
    assertThrows(MalformedInputException.class, () -> Composition.parse("(2|1)"));
  }

  @Test
  void restAndPrependReturnNewValues() {
    Composition composition = Composition.of(2, 1, 3);

    assertEquals(Composition.of(1, 3), composition.rest());
    assertEquals(Composition.of(4, 2, 1, 3), composition.prepend(4));
    assertEquals(Composition.of(2, 1, 3), composition, "operations must not mutate");
  }

  @Test
  void restOfEmptyCompositionFails() {
    assertThrows(EmptyStructureException.class, () -> Composition.EMPTY.rest());
  }

  @Test
  void ordersLexicographicallyWithPrefixesFirst() {
    assertTrue(Composition.of(1, 2).compareTo(Composition.of(2)) < 0);
    assertTrue(Composition.of(1).compareTo(Composition.of(1, 1)) < 0);
    assertTrue(Composition.EMPTY.compareTo(Composition.of(1)) < 0);
    assertEquals(0, Composition.of(3, 1).compareTo(Composition.parse("(3,1)")));
  }
}
