package metahub.addon.core.domain.cache;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.util.Objects;

/**
 * Stored cache entry. Positive entries carry a JSON value; error markers carry the failure class
 * and message instead.
 *
 * <p>{@code createdAt} is the instant the producing computation started. Stores only accept a write
 * whose {@code createdAt} is not older than the stored one.
 */
public record CacheEntry(
    String key,
    JsonNode value,
    long createdAt,
    long ttlMillis,
    long staleWindowMillis,
    CacheCategory category,
    boolean errorMarker,
    ErrorKind errorKind,
    String errorMessage,
    int retryCount) {

  public CacheEntry {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(category, "category");
    if (ttlMillis <= 0) {
      throw new IllegalArgumentException("ttl must be positive: " + key);
    }
    if (staleWindowMillis < 0) {
      throw new IllegalArgumentException("staleWindow must not be negative: " + key);
    }
    if (errorMarker && errorKind == null) {
      throw new IllegalArgumentException("error marker without kind: " + key);
    }
  }

  public static CacheEntry of(
      CacheKey key,
      JsonNode value,
      long createdAt,
      Duration ttl,
      Duration staleWindow) {
    return new CacheEntry(
        key.asString(),
        value,
        createdAt,
        ttl.toMillis(),
        staleWindow.toMillis(),
        key.category(),
        false,
        null,
        null,
        0);
  }

  public static CacheEntry errorMarker(
      CacheKey key,
      ErrorKind kind,
      String message,
      long createdAt,
      Duration ttl,
      int retryCount) {
    return new CacheEntry(
        key.asString(), null, createdAt, ttl.toMillis(), 0L, key.category(), true, kind, message,
        retryCount);
  }

  public EntryState stateAt(long nowMillis) {
    long age = nowMillis - createdAt;
    if (age < ttlMillis) {
      return EntryState.FRESH;
    }
    if (staleWindowMillis > 0 && age < ttlMillis + staleWindowMillis) {
      return EntryState.STALE;
    }
    return EntryState.EXPIRED;
  }

  /** Lifetime in the backing store: logical TTL plus the grace period. */
  public Duration physicalTtl() {
    return Duration.ofMillis(ttlMillis + staleWindowMillis);
  }

  /** Remaining physical lifetime; used when the store needs a relative expiry. */
  public Duration remainingAt(long nowMillis) {
    long remaining = createdAt + ttlMillis + staleWindowMillis - nowMillis;
    return Duration.ofMillis(Math.max(remaining, 0L));
  }
}
