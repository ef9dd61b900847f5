package chromatic;

import chromatic.cache.AlgebraCache;
import chromatic.cache.MemoTable;
import chromatic.compositions.CompositionGenerator;
import chromatic.compositions.CompositionShuffle;
import chromatic.core.EngineOptions;
import chromatic.core.model.Composition;
import chromatic.core.model.SetComposition;
import chromatic.setcompositions.SetCompositionGenerator;
import chromatic.setcompositions.SetCompositionShuffle;
import com.google.common.base.Stopwatch;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point to the combinatorial algebra: enumeration of compositions and set compositions and
 * their quasi-shuffle products, all backed by one {@link AlgebraCache}.
 *
 * <p>{@link #shared()} is the process-wide engine configured from {@link
 * EngineOptions#fromEnvironment()}. Separate engines with their own caches can be created for
 * isolation, e.g. in tests.
 */
public final class ChromaticEngine {
  private static final Logger LOG = LoggerFactory.getLogger(ChromaticEngine.class);

  private final EngineOptions options;
  private final AlgebraCache cache;
  private final CompositionGenerator compositionGenerator;
  private final CompositionShuffle compositionShuffle;
  private final SetCompositionGenerator setCompositionGenerator;
  private final SetCompositionShuffle setCompositionShuffle;

  public ChromaticEngine() {
    this(EngineOptions.defaults());
  }

  public ChromaticEngine(EngineOptions options) {
    this(options, new AlgebraCache());
  }

  public ChromaticEngine(EngineOptions options, AlgebraCache cache) {
    this.options = EngineOptions.normalize(options);
    this.cache = Objects.requireNonNull(cache, "cache");
    this.compositionGenerator = new CompositionGenerator(cache);
    this.compositionShuffle = new CompositionShuffle(cache);
    this.setCompositionGenerator = new SetCompositionGenerator(cache);
    this.setCompositionShuffle = new SetCompositionShuffle(cache);
    if (this.options.eagerSelfTest()) {
      precompute();
    }
  }

  public static ChromaticEngine shared() {
    return Holder.INSTANCE;
  }

  public EngineOptions options() {
    return options;
  }

  public AlgebraCache cache() {
    return cache;
  }

  public List<Composition> compositions(int n) {
    return compositionGenerator.generateAll(n);
  }

  public List<SetComposition> setCompositions(int n) {
    return setCompositionGenerator.generateAll(n);
  }

  public Map<Composition, BigInteger> quasiShuffle(Composition q, Composition t) {
    return compositionShuffle.quasiShuffle(q, t);
  }

  public Map<SetComposition, BigInteger> quasiShuffle(SetComposition q, SetComposition t) {
    return setCompositionShuffle.quasiShuffle(q, t);
  }

  /**
   * Computes every composition of size at most {@link EngineOptions#compositionPregenSize()} and
   * all their pairwise quasi-shuffles, then the same for set compositions, shifting the second
   * operand past the first one's ground set. Exercises both recurrences and fills the cache.
   */
  public SelfTestReport precompute() {
    Stopwatch stopwatch = Stopwatch.createStarted();
    int compositionShuffles = 0;
    int compositionCount = 0;
    int maxCompositions = options.compositionPregenSize();
    for (int n = 0; n <= maxCompositions; n++) {
      compositionCount += compositions(n).size();
    }
    for (int n = 0; n <= maxCompositions; n++) {
      for (Composition left : compositions(n)) {
        for (int m = 0; m <= maxCompositions; m++) {
          for (Composition right : compositions(m)) {
            quasiShuffle(left, right);
            compositionShuffles++;
          }
        }
      }
    }

    int setCompositionShuffles = 0;
    int setCompositionCount = 0;
    int maxSetCompositions = options.setCompositionPregenSize();
    for (int n = 0; n <= maxSetCompositions; n++) {
      setCompositionCount += setCompositions(n).size();
    }
    for (int n = 0; n <= maxSetCompositions; n++) {
      for (SetComposition left : setCompositions(n)) {
        for (int m = 0; m <= maxSetCompositions; m++) {
          for (SetComposition right : setCompositions(m)) {
            quasiShuffle(left, right.shift(n));
            setCompositionShuffles++;
          }
        }
      }
    }

    SelfTestReport report =
        new SelfTestReport(
            compositionCount,
            compositionShuffles,
            setCompositionCount,
            setCompositionShuffles,
            stopwatch.elapsed(TimeUnit.MILLISECONDS));
    LOG.info(
        "Precomputed {} compositions ({} shuffles) and {} set compositions ({} shuffles) in {} ms",
        report.compositions(),
        report.compositionShuffles(),
        report.setCompositions(),
        report.setCompositionShuffles(),
        report.elapsedMillis());
    if (LOG.isDebugEnabled()) {
      for (MemoTable<?, ?> table : cache.tables()) {
        LOG.debug("Cache {}", table);
      }
    }
    return report;
  }

  /** Counts gathered by {@link #precompute()}. */
  public record SelfTestReport(
      int compositions,
      int compositionShuffles,
      int setCompositions,
      int setCompositionShuffles,
      long elapsedMillis) {}

  private static final class Holder {
    private static final ChromaticEngine INSTANCE =
        new ChromaticEngine(EngineOptions.fromEnvironment());
  }
}
