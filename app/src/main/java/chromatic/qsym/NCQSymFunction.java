package chromatic.qsym;

import chromatic.ChromaticEngine;
import chromatic.core.model.Composition;
import chromatic.core.model.SetComposition;
import chromatic.util.Coefficients;
import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Non-commutative quasisymmetric function in the monomial basis {@code M_pi}, pi a set
 * composition. Products need monomials over disjoint ground sets.
 */
public final class NCQSymFunction extends FormalSum<SetComposition, NCQSymFunction> {
  private static final NCQSymFunction ZERO = new NCQSymFunction(Map.of());

  private NCQSymFunction(Map<SetComposition, BigInteger> coefficients) {
    super(coefficients);
  }

  public static NCQSymFunction zero() {
    return ZERO;
  }

  public static NCQSymFunction monomial(SetComposition pi) {
    return new NCQSymFunction(Map.of(Objects.requireNonNull(pi, "pi"), BigInteger.ONE));
  }

  public static NCQSymFunction monomial(String pi) {
    return monomial(SetComposition.parse(pi));
  }

  public static NCQSymFunction of(Map<SetComposition, BigInteger> coefficients) {
    return new NCQSymFunction(coefficients);
  }

  /** Builds a sum from canonical texts; every key must parse as a set composition. */
  public static NCQSymFunction parse(Map<String, ? extends Number> coefficients) {
    Objects.requireNonNull(coefficients, "coefficients");
    Map<SetComposition, BigInteger> parsed = new TreeMap<>();
    coefficients.forEach(
        (key, value) ->
            parsed.merge(SetComposition.parse(key), Coefficients.exact(value), BigInteger::add));
    return new NCQSymFunction(parsed);
  }

  /** Commutative image: each {@code M_pi} goes to {@code M_alpha(pi)}, collisions summed. */
  public QSymFunction comu() {
    Map<Composition, BigInteger> image = new TreeMap<>();
    coefficients().forEach((pi, value) -> image.merge(pi.alpha(), value, BigInteger::add));
    return QSymFunction.of(image);
  }

  @Override
  protected NCQSymFunction create(Map<SetComposition, BigInteger> coefficients) {
    return new NCQSymFunction(coefficients);
  }

  @Override
  protected Map<SetComposition, BigInteger> product(
      SetComposition left, SetComposition right, ChromaticEngine engine) {
    return engine.quasiShuffle(left, right);
  }
}
