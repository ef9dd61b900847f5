package chromatic.setcompositions;

import chromatic.core.model.SetComposition;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Relabels a pair of disjoint set compositions onto consecutive ranges: the left operand onto
 * {@code 1..|q|}, the right onto {@code |q|+1..|q|+|t|}, both in ground set order. Any pair with
 * the same shape lands on the same canonical pair, so a shuffle computed once in the canonical
 * frame can be {@linkplain #restore(Map) mapped back} onto any labeling.
 */
public final class CanonicalFrame {
  private final SetComposition left;
  private final SetComposition right;
  private final Map<Integer, Integer> toOriginal;

  private CanonicalFrame(
      SetComposition left, SetComposition right, Map<Integer, Integer> toOriginal) {
    this.left = left;
    this.right = right;
    this.toOriginal = toOriginal;
  }

  public static CanonicalFrame of(SetComposition q, SetComposition t) {
    Objects.requireNonNull(q, "q");
    Objects.requireNonNull(t, "t");
    Map<Integer, Integer> toCanonical = new HashMap<>();
    Map<Integer, Integer> toOriginal = new HashMap<>();
    int label = 1;
    for (Integer element : q.groundSet()) {
      toCanonical.put(element, label);
      toOriginal.put(label, element);
      label++;
    }
    for (Integer element : t.groundSet()) {
      toCanonical.put(element, label);
      toOriginal.put(label, element);
      label++;
    }
    return new CanonicalFrame(
        q.relabel(toCanonical), t.relabel(toCanonical), Map.copyOf(toOriginal));
  }

  public SetComposition left() {
    return left;
  }

  public SetComposition right() {
    return right;
  }

  public SetComposition restore(SetComposition canonical) {
    return canonical.relabel(toOriginal);
  }

  /** Maps every term of a canonical-frame result back onto the original labels. */
  public Map<SetComposition, BigInteger> restore(Map<SetComposition, BigInteger> canonical) {
    Map<SetComposition, BigInteger> restored = new LinkedHashMap<>();
    for (Map.Entry<SetComposition, BigInteger> term : canonical.entrySet()) {
      restored.put(restore(term.getKey()), term.getValue());
    }
    return restored;
  }
}
