package chromatic.cache;

import chromatic.core.model.Composition;
import chromatic.core.model.SetComposition;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Memo tables shared by the generators and the quasi-shuffle products. Enumerations are keyed by
 * size, products by the ordered operand pair. Everything here is a pure function of its key, so
 * nothing is ever invalidated.
 */
public final class AlgebraCache {
  private final MemoTable<Integer, List<Composition>> compositions =
      new MemoTable<>("compositions");
  private final MemoTable<ShuffleKey<Composition>, Map<Composition, BigInteger>>
      compositionShuffles = new MemoTable<>("composition-shuffles");
  private final MemoTable<Integer, List<SetComposition>> setCompositions =
      new MemoTable<>("set-compositions");
  private final MemoTable<ShuffleKey<SetComposition>, Map<SetComposition, BigInteger>>
      setCompositionShuffles = new MemoTable<>("set-composition-shuffles");

  public MemoTable<Integer, List<Composition>> compositions() {
    return compositions;
  }

  public MemoTable<ShuffleKey<Composition>, Map<Composition, BigInteger>> compositionShuffles() {
    return compositionShuffles;
  }

  public MemoTable<Integer, List<SetComposition>> setCompositions() {
    return setCompositions;
  }

  public MemoTable<ShuffleKey<SetComposition>, Map<SetComposition, BigInteger>>
      setCompositionShuffles() {
    return setCompositionShuffles;
  }

  public List<MemoTable<?, ?>> tables() {
    return List.of(compositions, compositionShuffles, setCompositions, setCompositionShuffles);
  }

  /** Ordered operand pair of a quasi-shuffle. */
  public record ShuffleKey<T>(T left, T right) {
    public ShuffleKey {
      Objects.requireNonNull(left, "left");
      Objects.requireNonNull(right, "right");
    }

    public ShuffleKey<T> swapped() {
      return new ShuffleKey<>(right, left);
    }
  }
}
