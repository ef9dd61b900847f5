package chromatic.qsym;

import chromatic.ChromaticEngine;
import chromatic.util.Coefficients;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Finite integer combination of monomials {@code M_k}, keyed by a structured canonical value.
 * Instances are immutable; every operation returns a new sum. Zero coefficients produced by
 * addition are kept, while {@link #equals(Object)} only compares the non-zero terms.
 *
 * @param <K> monomial index
 * @param <S> concrete sum type
 */
public abstract class FormalSum<K extends Comparable<K>, S extends FormalSum<K, S>> {
  private final SortedMap<K, BigInteger> coefficients;

  protected FormalSum(Map<K, BigInteger> coefficients) {
    Objects.requireNonNull(coefficients, "coefficients");
    TreeMap<K, BigInteger> copy = new TreeMap<>();
    for (Map.Entry<K, BigInteger> term : coefficients.entrySet()) {
      copy.put(
          Objects.requireNonNull(term.getKey(), "key"),
          Objects.requireNonNull(term.getValue(), "coefficient"));
    }
    this.coefficients = Collections.unmodifiableSortedMap(copy);
  }

  protected abstract S create(Map<K, BigInteger> coefficients);

  /** Quasi-shuffle of two monomial indices. */
  protected abstract Map<K, BigInteger> product(K left, K right, ChromaticEngine engine);

  public SortedMap<K, BigInteger> coefficients() {
    return coefficients;
  }

  public BigInteger coefficient(K key) {
    return coefficients.getOrDefault(key, BigInteger.ZERO);
  }

  /** Coefficients keyed by canonical text, in key order. */
  public Map<String, BigInteger> coefficientsByText() {
    Map<String, BigInteger> byText = new LinkedHashMap<>();
    coefficients.forEach((key, value) -> byText.put(key.toString(), value));
    return Collections.unmodifiableMap(byText);
  }

  /** Keys with a non-zero coefficient. */
  public Set<K> support() {
    Set<K> support = new TreeSet<>();
    coefficients.forEach(
        (key, value) -> {
          if (value.signum() != 0) {
            support.add(key);
          }
        });
    return Collections.unmodifiableSet(support);
  }

  public boolean isZero() {
    return support().isEmpty();
  }

  public S add(S other) {
    Objects.requireNonNull(other, "other");
    Map<K, BigInteger> sum = new TreeMap<>(coefficients);
    Coefficients.accumulate(sum, other.coefficients(), key -> key);
    return create(sum);
  }

  public S scale(BigInteger scalar) {
    Objects.requireNonNull(scalar, "scalar");
    Map<K, BigInteger> scaled = new TreeMap<>();
    coefficients.forEach((key, value) -> scaled.put(key, value.multiply(scalar)));
    return create(scaled);
  }

  public S scale(long scalar) {
    return scale(BigInteger.valueOf(scalar));
  }

  public S multiply(S other) {
    return multiply(other, ChromaticEngine.shared());
  }

  /**
   * Bilinear extension of the quasi-shuffle product: {@code (sum a_t M_t)(sum b_q M_q) = sum
   * a_t b_q qs(t, q)}.
   */
  public S multiply(S other, ChromaticEngine engine) {
    Objects.requireNonNull(other, "other");
    Objects.requireNonNull(engine, "engine");
    Map<K, BigInteger> product = new TreeMap<>();
    for (Map.Entry<K, BigInteger> left : coefficients.entrySet()) {
      for (Map.Entry<K, BigInteger> right : other.coefficients().entrySet()) {
        BigInteger factor = left.getValue().multiply(right.getValue());
        Coefficients.accumulate(
            product, product(left.getKey(), right.getKey(), engine), key -> key, factor);
      }
    }
    return create(product);
  }

  private Map<K, BigInteger> nonZeroTerms() {
    Map<K, BigInteger> terms = new TreeMap<>();
    coefficients.forEach(
        (key, value) -> {
          if (value.signum() != 0) {
            terms.put(key, value);
          }
        });
    return terms;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || obj.getClass() != getClass()) {
      return false;
    }
    return nonZeroTerms().equals(((FormalSum<?, ?>) obj).nonZeroTerms());
  }

  @Override
  public int hashCode() {
    return nonZeroTerms().hashCode();
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + coefficientsByText();
  }
}
