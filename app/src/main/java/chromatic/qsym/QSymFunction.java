package chromatic.qsym;

import chromatic.ChromaticEngine;
import chromatic.core.model.Composition;
import chromatic.util.Coefficients;
import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/** Quasisymmetric function in the monomial basis {@code M_alpha}, alpha a composition. */
public final class QSymFunction extends FormalSum<Composition, QSymFunction> {
  private static final QSymFunction ZERO = new QSymFunction(Map.of());

  private QSymFunction(Map<Composition, BigInteger> coefficients) {
    super(coefficients);
  }

  public static QSymFunction zero() {
    return ZERO;
  }

  public static QSymFunction monomial(Composition alpha) {
    return new QSymFunction(Map.of(Objects.requireNonNull(alpha, "alpha"), BigInteger.ONE));
  }

  public static QSymFunction monomial(String alpha) {
    return monomial(Composition.parse(alpha));
  }

  public static QSymFunction of(Map<Composition, BigInteger> coefficients) {
    return new QSymFunction(coefficients);
  }

  /** Builds a sum from canonical texts; every key must parse as a composition. */
  public static QSymFunction parse(Map<String, ? extends Number> coefficients) {
    Objects.requireNonNull(coefficients, "coefficients");
    Map<Composition, BigInteger> parsed = new TreeMap<>();
    coefficients.forEach(
        (key, value) ->
            parsed.merge(Composition.parse(key), Coefficients.exact(value), BigInteger::add));
    return new QSymFunction(parsed);
  }

  @Override
  protected QSymFunction create(Map<Composition, BigInteger> coefficients) {
    return new QSymFunction(coefficients);
  }

  @Override
  protected Map<Composition, BigInteger> product(
      Composition left, Composition right, ChromaticEngine engine) {
    return engine.quasiShuffle(left, right);
  }
}
