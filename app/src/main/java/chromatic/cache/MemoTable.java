package chromatic.cache;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Append-only memo table. Entries are never evicted or replaced: when two callers race to store
 * the same key, the first value wins and is returned to both.
 */
public final class MemoTable<K, V> {
  private final String name;
  private final ConcurrentMap<K, V> entries = new ConcurrentHashMap<>();
  private final CacheStats stats = new CacheStats();

  public MemoTable(String name) {
    this.name = Objects.requireNonNull(name, "name");
  }

  /** Returns the cached value or {@code null}, recording a hit or a miss. */
  public V lookup(K key) {
    V value = entries.get(key);
    if (value == null) {
      stats.recordMiss();
    } else {
      stats.recordHit();
    }
    return value;
  }

  /** Stores {@code value} unless the key is already present; returns the value kept. */
  public V store(K key, V value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    V existing = entries.putIfAbsent(key, value);
    return existing != null ? existing : value;
  }

  public boolean contains(K key) {
    return entries.containsKey(key);
  }

  public int size() {
    return entries.size();
  }

  public String name() {
    return name;
  }

  public CacheStats stats() {
    return stats;
  }

  @Override
  public String toString() {
    CacheStats.Snapshot snapshot = stats.snapshot();
    return String.format(
        "%s[entries=%d, hits=%d, misses=%d, hitRate=%.2f]",
        name, size(), snapshot.hits(), snapshot.misses(), snapshot.hitRate());
  }
}
