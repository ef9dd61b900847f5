package chromatic.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

final class MemoTableTest {

  @Test
  void statsCaptureHitsAndMisses() {
    MemoTable<String, Integer> table = new MemoTable<>("test");

    assertNull(table.lookup("a"));
    table.store("a", 1);
    assertEquals(1, table.lookup("a"));
    assertEquals(1, table.lookup("a"));

    CacheStats.Snapshot snapshot = table.stats().snapshot();
    assertEquals(2, snapshot.hits());
    assertEquals(1, snapshot.misses());
    assertEquals(2.0 / 3.0, snapshot.hitRate(), 1e-9);
  }

  @Test
  void firstStoredValueWins() {
    MemoTable<String, Integer> table = new MemoTable<>("test");

    assertEquals(1, table.store("a", 1));
    assertEquals(1, table.store("a", 2), "entries are never overwritten");
    assertEquals(1, table.size());
    assertTrue(table.contains("a"));
  }

  @Test
  void emptyStatsHaveZeroHitRate() {
    assertEquals(0.0, new MemoTable<String, String>("empty").stats().hitRate());
  }
}
