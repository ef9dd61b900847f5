package chromatic.qsym;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import chromatic.ChromaticEngine;
import chromatic.core.EngineOptions;
import chromatic.core.error.MalformedInputException;
import chromatic.core.model.Composition;
import java.math.BigInteger;
import java.util.Map;
import org.junit.jupiter.api.Test;

final class QSymFunctionTest {
  private final ChromaticEngine engine = new ChromaticEngine(EngineOptions.lazy());

  @Test
  void monomialFromTextAndFromComposition() {
    assertEquals(
        QSymFunction.monomial(Composition.of(1, 3, 2)), QSymFunction.monomial("(1,3,2)"));
    assertEquals(BigInteger.ONE, QSymFunction.monomial("(2)").coefficient(Composition.of(2)));
    assertEquals(BigInteger.ZERO, QSymFunction.monomial("(2)").coefficient(Composition.of(1)));
  }

  @Test
  void addSumsKeyWiseAndKeepsZeros() {
    QSymFunction f = QSymFunction.parse(Map.of("(1,2)", 1, "(3)", 2));
    QSymFunction g = QSymFunction.parse(Map.of("(3)", -2, "(2,1)", 5L));

    QSymFunction sum = f.add(g);

    assertEquals(BigInteger.ZERO, sum.coefficient(Composition.of(3)));
    assertTrue(sum.coefficients().containsKey(Composition.of(3)), "zero terms may remain");
    assertEquals(QSymFunction.parse(Map.of("(1,2)", 1, "(2,1)", 5)), sum);
    assertEquals(QSymFunction.parse(Map.of("(1,2)", 1, "(3)", 2)), f, "operands are untouched");
  }

  @Test
  void scaleMultipliesEveryCoefficient() {
    QSymFunction f = QSymFunction.parse(Map.of("(1,2)", 1, "(3)", -2));

    assertEquals(QSymFunction.parse(Map.of("(1,2)", 3, "(3)", -6)), f.scale(3));
    assertTrue(f.scale(0).isZero());
  }

  @Test
  void productOfSingletonsIsTheQuasiShuffle() {
    QSymFunction m1 = QSymFunction.monomial("(1)");

    assertEquals(
        QSymFunction.parse(Map.of("(1,1)", 2, "(2)", 1)), m1.multiply(m1, engine));
  }

  @Test
  void productIsBilinear() {
    QSymFunction f = QSymFunction.parse(Map.of("(1)", 2, "(2)", -1));
    QSymFunction g = QSymFunction.monomial("(1)");

    QSymFunction expected =
        QSymFunction.parse(Map.of("(1,1)", 4, "(2)", 2, "(2,1)", -1, "(1,2)", -1, "(3)", -1));
    assertEquals(expected, f.multiply(g, engine));
  }

  @Test
  void emptyCompositionIsTheUnit() {
    QSymFunction f = QSymFunction.parse(Map.of("(2,1)", 3, "(1)", 1));

    assertEquals(f, f.multiply(QSymFunction.monomial("()"), engine));
    assertTrue(f.multiply(QSymFunction.zero(), engine).isZero());
  }

  @Test
  void keysAreStoredInCanonicalForm() {
    QSymFunction f = QSymFunction.parse(Map.of(" ( 2, 1 ) ", 1));

    assertEquals(Map.of("(2,1)", BigInteger.ONE), f.coefficientsByText());
  }

  @Test
  void rejectsBadKeysAndNonIntegerCoefficients() {
    assertThrows(MalformedInputException.class, () -> QSymFunction.parse(Map.of("(0)", 1)));
    assertThrows(MalformedInputException.class, () -> QSymFunction.parse(Map.of("2,1", 1)));
    assertThrows(MalformedInputException.class, () -> QSymFunction.parse(Map.of("(1)", 1.5)));
  }
}
