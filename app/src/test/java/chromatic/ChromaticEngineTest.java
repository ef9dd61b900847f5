package chromatic;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import chromatic.ChromaticEngine.SelfTestReport;
import chromatic.cache.AlgebraCache;
import chromatic.cache.MemoTable;
import chromatic.core.EngineOptions;
import chromatic.core.model.Composition;
import java.math.BigInteger;
import java.util.Map;
import org.junit.jupiter.api.Test;

final class ChromaticEngineTest {

  @Test
  void precomputeCoversConfiguredSizes() {
    ChromaticEngine engine = new ChromaticEngine(EngineOptions.lazy());
    ChromaticEngine configured =
        new ChromaticEngine(new EngineOptions(4, 3, false), engine.cache());

    SelfTestReport report = configured.precompute();

    assertEquals(16, report.compositions(), "1 + 1 + 2 + 4 + 8");
    assertEquals(16 * 16, report.compositionShuffles());
    assertEquals(18, report.setCompositions(), "1 + 1 + 3 + 13");
    assertEquals(18 * 18, report.setCompositionShuffles());
    assertTrue(engine.cache().compositionShuffles().size() > 0);
    assertTrue(engine.cache().setCompositionShuffles().size() > 0);
  }

  @Test
  void lazyEngineStartsWithEmptyCache() {
    ChromaticEngine engine = new ChromaticEngine(EngineOptions.lazy());

    for (MemoTable<?, ?> table : engine.cache().tables()) {
      assertEquals(0, table.size(), table.name());
    }
  }

  @Test
  void engineKeepsNormalizedOptions() {
    ChromaticEngine engine = new ChromaticEngine(new EngineOptions(-2, 1, false));

    assertEquals(new EngineOptions(0, 1, false), engine.options());
    assertEquals(EngineOptions.defaults(), new ChromaticEngine(null).options());
  }

  @Test
  void eagerEngineWarmsTheCache() {
    AlgebraCache cache = new AlgebraCache();
    new ChromaticEngine(EngineOptions.defaults(), cache);

    assertTrue(cache.compositions().contains(4));
    assertTrue(cache.setCompositions().contains(3));
  }

  @Test
  void sharedEngineIsASingleton() {
    assertSame(ChromaticEngine.shared(), ChromaticEngine.shared());
    assertEquals(
        Map.of(Composition.of(1, 1), BigInteger.TWO, Composition.of(2), BigInteger.ONE),
        ChromaticEngine.shared().quasiShuffle(Composition.of(1), Composition.of(1)));
  }

  @Test
  void normalizeClampsNegativeSizes() {
    assertEquals(EngineOptions.defaults(), EngineOptions.normalize(null));
    assertEquals(
        new EngineOptions(0, 0, true), EngineOptions.normalize(new EngineOptions(-1, -5, true)));
  }

  @Test
  void optionsReadSystemProperties() {
    System.setProperty(EngineOptions.COMPOSITION_PREGEN_PROPERTY, "2");
    System.setProperty(EngineOptions.SET_COMPOSITION_PREGEN_PROPERTY, "not-a-number");
    System.setProperty(EngineOptions.SELF_TEST_PROPERTY, "false");
    try {
      EngineOptions options = EngineOptions.fromEnvironment();

      assertEquals(2, options.compositionPregenSize());
      assertEquals(3, options.setCompositionPregenSize(), "invalid values fall back");
      assertFalse(options.eagerSelfTest());
    } finally {
      System.clearProperty(EngineOptions.COMPOSITION_PREGEN_PROPERTY);
      System.clearProperty(EngineOptions.SET_COMPOSITION_PREGEN_PROPERTY);
      System.clearProperty(EngineOptions.SELF_TEST_PROPERTY);
    }
  }
}
