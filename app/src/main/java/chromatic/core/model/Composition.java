package chromatic.core.model;

import chromatic.core.error.EmptyStructureException;
import chromatic.core.error.MalformedInputException;
import chromatic.util.CanonicalText;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Ordered sequence of positive integers summing to {@link #n()}. The empty composition is the
 * unique composition of 0.
 *
 * <p>Instances are values: {@link #rest()} and {@link #prepend(int)} return new compositions,
 * and {@link #toString()} yields the canonical text {@code (2,1,3)} which {@link #parse(String)}
 * reads back.
 */
public record Composition(List<Integer> parts) implements Comparable<Composition> {
  public static final Composition EMPTY = new Composition(List.of());

  public Composition {
    Objects.requireNonNull(parts, "parts");
    for (Integer part : parts) {
      if (part == null || part <= 0) {
        throw new MalformedInputException("All parts must be positive integers, got " + part);
      }
    }
    parts = List.copyOf(parts);
  }

  public static Composition of(int... parts) {
    return new Composition(Arrays.stream(parts).boxed().toList());
  }

  public static Composition of(List<Integer> parts) {
    return new Composition(parts);
  }

  /** Reads the canonical text {@code (a,b,c)} or {@code ()}. */
  public static Composition parse(String text) {
    return new Composition(CanonicalText.parseSequence(text));
  }

  /**
   * Sum of the parts.
   *
   * @throws ArithmeticException if the sum does not fit in an {@code int}
   */
  public int n() {
    int sum = 0;
    for (int part : parts) {
      sum = Math.addExact(sum, part);
    }
    return sum;
  }

  public int nparts() {
    return parts.size();
  }

  public boolean isEmpty() {
    return parts.isEmpty();
  }

  public int first() {
    if (parts.isEmpty()) {
      throw new EmptyStructureException("Empty composition has no first part");
    }
    return parts.get(0);
  }

  public Composition rest() {
    if (parts.isEmpty()) {
      throw new EmptyStructureException("Empty composition cannot be rest-ed");
    }
    return new Composition(parts.subList(1, parts.size()));
  }

  public Composition prepend(int part) {
    List<Integer> next = new ArrayList<>(parts.size() + 1);
    next.add(part);
    next.addAll(parts);
    return new Composition(next);
  }

  /** Lexicographic on parts; a proper prefix sorts first. */
  @Override
  public int compareTo(Composition other) {
    int shared = Math.min(parts.size(), other.parts.size());
    for (int i = 0; i < shared; i++) {
      int cmp = Integer.compare(parts.get(i), other.parts.get(i));
      if (cmp != 0) {
        return cmp;
      }
    }
    return Integer.compare(parts.size(), other.parts.size());
  }

  @Override
  public String toString() {
    return CanonicalText.formatSequence(parts);
  }
}
