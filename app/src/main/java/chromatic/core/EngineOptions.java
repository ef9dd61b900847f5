package chromatic.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for a {@link chromatic.ChromaticEngine}.
 *
 * @param compositionPregenSize compositions up to this size, and all their pairwise
 *     quasi-shuffles, are computed when the engine starts
 * @param setCompositionPregenSize same for set compositions
 * @param eagerSelfTest whether the start-up precomputation runs at all
 */
public record EngineOptions(
    int compositionPregenSize, int setCompositionPregenSize, boolean eagerSelfTest) {
  private static final Logger LOG = LoggerFactory.getLogger(EngineOptions.class);

  public static final String COMPOSITION_PREGEN_PROPERTY = "chromatic.pregen.compositions";
  public static final String COMPOSITION_PREGEN_ENV = "CHROMATIC_PREGEN_COMPOSITIONS";
  public static final String SET_COMPOSITION_PREGEN_PROPERTY = "chromatic.pregen.setcompositions";
  public static final String SET_COMPOSITION_PREGEN_ENV = "CHROMATIC_PREGEN_SETCOMPOSITIONS";
  public static final String SELF_TEST_PROPERTY = "chromatic.selftest";
  public static final String SELF_TEST_ENV = "CHROMATIC_SELFTEST";

  private static final int DEFAULT_COMPOSITION_PREGEN = 4;
  private static final int DEFAULT_SET_COMPOSITION_PREGEN = 3;

  public static EngineOptions defaults() {
    return new EngineOptions(DEFAULT_COMPOSITION_PREGEN, DEFAULT_SET_COMPOSITION_PREGEN, true);
  }

  /** Engine without any start-up precomputation. */
  public static EngineOptions lazy() {
    return new EngineOptions(0, 0, false);
  }

  public static EngineOptions normalize(EngineOptions options) {
    if (options == null) {
      return defaults();
    }
    return new EngineOptions(
        Math.max(0, options.compositionPregenSize()),
        Math.max(0, options.setCompositionPregenSize()),
        options.eagerSelfTest());
  }

  /**
   * Defaults overridden by system properties, then by environment variables when no property is
   * set. Unparsable integers fall back to the default with a warning.
   */
  public static EngineOptions fromEnvironment() {
    EngineOptions defaults = defaults();
    int compositions =
        intSetting(
            COMPOSITION_PREGEN_PROPERTY, COMPOSITION_PREGEN_ENV, defaults.compositionPregenSize());
    int setCompositions =
        intSetting(
            SET_COMPOSITION_PREGEN_PROPERTY,
            SET_COMPOSITION_PREGEN_ENV,
            defaults.setCompositionPregenSize());
    String selfTest = setting(SELF_TEST_PROPERTY, SELF_TEST_ENV);
    boolean eager = selfTest == null ? defaults.eagerSelfTest() : Boolean.parseBoolean(selfTest);
    return normalize(new EngineOptions(compositions, setCompositions, eager));
  }

  private static int intSetting(String property, String env, int defaultValue) {
    String raw = setting(property, env);
    if (raw == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      LOG.warn("Ignoring invalid integer '{}' for {}, using {}", raw, property, defaultValue);
      return defaultValue;
    }
  }

  private static String setting(String property, String env) {
    String value = System.getProperty(property);
    if (value != null && !value.isBlank()) {
      return value;
    }
    value = System.getenv(env);
    return value == null || value.isBlank() ? null : value;
  }
}
