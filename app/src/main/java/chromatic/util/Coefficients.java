package chromatic.util;

import chromatic.core.error.MalformedInputException;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

/** Helpers for integer coefficient maps shared by the shuffle products and the formal sums. */
public final class Coefficients {
  private Coefficients() {}

  /**
   * Adds {@code factor * coefficient} for every term of {@code terms} into {@code target}, after
   * mapping its key through {@code transform}. Colliding keys are summed.
   */
  public static <K> void accumulate(
      Map<K, BigInteger> target,
      Map<K, BigInteger> terms,
      UnaryOperator<K> transform,
      BigInteger factor) {
    for (Map.Entry<K, BigInteger> term : terms.entrySet()) {
      target.merge(
          transform.apply(term.getKey()), term.getValue().multiply(factor), BigInteger::add);
    }
  }

  public static <K> void accumulate(
      Map<K, BigInteger> target, Map<K, BigInteger> terms, UnaryOperator<K> transform) {
    accumulate(target, terms, transform, BigInteger.ONE);
  }

  /** Immutable copy that keeps the insertion order of {@code coefficients}. */
  public static <K> Map<K, BigInteger> freeze(Map<K, BigInteger> coefficients) {
    return Collections.unmodifiableMap(new LinkedHashMap<>(coefficients));
  }

  /** Converts an integral {@link Number} into an exact coefficient. */
  public static BigInteger exact(Number value) {
    if (value == null) {
      throw new MalformedInputException("Coefficient must not be null");
    }
    if (value instanceof BigInteger big) {
      return big;
    }
    if (value instanceof Long
        || value instanceof Integer
        || value instanceof Short
        || value instanceof Byte) {
      return BigInteger.valueOf(value.longValue());
    }
    throw new MalformedInputException(
        "Coefficients must be integers, got " + value.getClass().getSimpleName() + " " + value);
  }
}
