package chromatic.cache;

import java.util.concurrent.atomic.AtomicLong;

/** Hit and miss counters for one memo table. */
public final class CacheStats {
  private final AtomicLong hits = new AtomicLong();
  private final AtomicLong misses = new AtomicLong();

  public void recordHit() {
    hits.incrementAndGet();
  }

  public void recordMiss() {
    misses.incrementAndGet();
  }

  public long hits() {
    return hits.get();
  }

  public long misses() {
    return misses.get();
  }

  public long lookups() {
    return hits() + misses();
  }

  public double hitRate() {
    long total = lookups();
    return total == 0 ? 0.0 : hits() / (double) total;
  }

  public Snapshot snapshot() {
    return new Snapshot(hits(), misses());
  }

  public record Snapshot(long hits, long misses) {
    public long lookups() {
      return hits + misses;
    }

    public double hitRate() {
      long total = lookups();
      return total == 0 ? 0.0 : hits / (double) total;
    }
  }
}
