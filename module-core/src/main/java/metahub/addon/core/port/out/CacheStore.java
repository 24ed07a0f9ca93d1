package metahub.addon.core.port.out;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import metahub.addon.core.domain.cache.CacheEntry;

/**
 * Port for the key/value store backing the cache.
 *
 * <p>Implemented by module-infra adapters (Redis, in-process Caffeine).
 *
 * <p>All expiries are physical: the store drops an entry once its TTL elapses. Freshness and
 * staleness are decided by the caller from {@link CacheEntry#createdAt()}.
 */
public interface CacheStore {

  /**
   * Read an entry.
   *
   * @param key rendered cache key
   * @return the entry, or empty if absent or physically expired
   * @throws metahub.addon.error.exception.CacheCodecException if the stored bytes are corrupted
   */
  Optional<CacheEntry> get(String key);

  /** Unconditional write. */
  void set(CacheEntry entry, Duration ttl);

  /**
   * Write unless the stored entry has a newer {@code createdAt}.
   *
   * @return true if the entry was written
   */
  boolean setIfNewer(CacheEntry entry, Duration ttl);

  /** @return true if a key was removed */
  boolean delete(String key);

  boolean exists(String key);

  /**
   * Enumerate keys matching a glob pattern ({@code *}, {@code ?}, {@code [...]}).
   *
   * @param pattern glob pattern
   * @return matching keys, possibly empty
   */
  List<String> keysMatching(String pattern);

  /**
   * Delete all keys matching a glob pattern.
   *
   * @return number of deleted keys
   */
  long deleteMatching(String pattern);
}
