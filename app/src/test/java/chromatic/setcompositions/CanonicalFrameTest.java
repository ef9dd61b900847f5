package chromatic.setcompositions;

import static org.junit.jupiter.api.Assertions.assertEquals;

import chromatic.core.model.SetComposition;
import java.math.BigInteger;
import java.util.Map;
import org.junit.jupiter.api.Test;

final class CanonicalFrameTest {

  @Test
  void mapsOperandsOntoConsecutiveRanges() {
    CanonicalFrame frame =
        CanonicalFrame.of(SetComposition.parse("(4|9)"), SetComposition.parse("(2,7)"));

    assertEquals(SetComposition.parse("(1|2)"), frame.left());
    assertEquals(SetComposition.parse("(3,4)"), frame.right());
  }

  @Test
  void sameShapeSharesTheCanonicalPair() {
    CanonicalFrame first =
        CanonicalFrame.of(SetComposition.parse("(5,8|1)"), SetComposition.parse("(3)"));
    CanonicalFrame second =
        CanonicalFrame.of(SetComposition.parse("(2,6|4)"), SetComposition.parse("(10)"));

    assertEquals(first.left(), second.left());
    assertEquals(first.right(), second.right());
  }

  @Test
  void restoreUndoesTheRelabeling() {
    CanonicalFrame frame =
        CanonicalFrame.of(SetComposition.parse("(4|9)"), SetComposition.parse("(2,7)"));

    assertEquals(
        SetComposition.parse("(2,4,7|9)"), frame.restore(SetComposition.parse("(1,3,4|2)")));
    assertEquals(
        Map.of(SetComposition.parse("(9|2,7|4)"), BigInteger.ONE),
        frame.restore(Map.of(SetComposition.parse("(2|3,4|1)"), BigInteger.ONE)));
  }
}
