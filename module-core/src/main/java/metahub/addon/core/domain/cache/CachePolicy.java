package metahub.addon.core.domain.cache;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;
import lombok.Builder;

/**
 * Caching options for a single {@code wrap} call.
 *
 * <p>Stale-while-revalidate, error caching and empty-result caching are independent switches. Every
 * error-marker TTL must be strictly shorter than {@code ttl}; unset marker TTLs default to the
 * standard value capped below {@code ttl}.
 *
 * @param ttl freshness period of positive entries
 * @param staleWindow grace period after {@code ttl} during which the value is served while a
 *     refresh runs; zero disables stale-while-revalidate
 * @param errorCaching whether failures are stored as short-lived error markers
 * @param maxRetries number of inline retries for transient failures
 * @param errorTtl marker TTL for transient failures
 * @param rateLimitedTtl marker TTL for rate-limited failures
 * @param notFoundTtl TTL of negative (not-found) entries
 * @param retryDelay pause between inline retries
 * @param computeTimeout upper bound for one compute attempt; {@code null} means none
 * @param cacheEmpty whether empty results may be stored
 * @param validator predicate a computed value must satisfy to be stored
 */
@Builder(toBuilder = true)
public record CachePolicy(
    Duration ttl,
    Duration staleWindow,
    boolean errorCaching,
    int maxRetries,
    Duration errorTtl,
    Duration rateLimitedTtl,
    Duration notFoundTtl,
    Duration retryDelay,
    Duration computeTimeout,
    boolean cacheEmpty,
    Predicate<Object> validator) {

  public static final Duration DEFAULT_ERROR_TTL = Duration.ofMinutes(2);
  public static final Duration DEFAULT_RATE_LIMITED_TTL = Duration.ofMinutes(15);
  public static final Duration DEFAULT_NOT_FOUND_TTL = Duration.ofHours(1);
  public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(1);

  /** Entries are stored with millisecond TTLs; a marker needs at least 1ms below {@code ttl}. */
  public static final Duration MIN_TTL = Duration.ofMillis(2);

  private static final Duration MIN_MARKER_TTL = Duration.ofMillis(1);

  public CachePolicy {
    Objects.requireNonNull(ttl, "ttl");
    if (ttl.compareTo(MIN_TTL) < 0) {
      throw new IllegalArgumentException("ttl must be at least " + MIN_TTL.toMillis() + "ms");
    }
    if (staleWindow == null) {
      staleWindow = Duration.ZERO;
    }
    if (staleWindow.isNegative()) {
      throw new IllegalArgumentException("staleWindow must not be negative");
    }
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must not be negative");
    }
    errorTtl = markerTtl(errorTtl, DEFAULT_ERROR_TTL, ttl, "errorTtl");
    rateLimitedTtl = markerTtl(rateLimitedTtl, DEFAULT_RATE_LIMITED_TTL, ttl, "rateLimitedTtl");
    notFoundTtl = markerTtl(notFoundTtl, DEFAULT_NOT_FOUND_TTL, ttl, "notFoundTtl");
    if (retryDelay == null || retryDelay.isNegative()) {
      retryDelay = DEFAULT_RETRY_DELAY;
    }
    if (validator == null) {
      validator = value -> true;
    }
  }

  /** Policy with only a TTL: no stale window, no error caching, no retries. */
  public static CachePolicy ofTtl(Duration ttl) {
    return CachePolicy.builder().ttl(ttl).build();
  }

  public boolean staleWhileRevalidate() {
    return !staleWindow.isZero();
  }

  /**
   * Longest time a single load can legitimately take: every attempt running into {@code
   * computeTimeout} plus the delays between retries. {@code null} when attempts are unbounded.
   */
  public Duration worstCaseLoadTime() {
    if (computeTimeout == null || computeTimeout.isZero() || computeTimeout.isNegative()) {
      return null;
    }
    return computeTimeout.multipliedBy(maxRetries + 1L).plus(retryDelay.multipliedBy(maxRetries));
  }

  public Duration markerTtl(ErrorKind kind) {
    return switch (kind) {
      case TRANSIENT -> errorTtl;
      case RATE_LIMITED -> rateLimitedTtl;
      case NOT_FOUND -> notFoundTtl;
    };
  }

  private static Duration markerTtl(
      Duration requested, Duration standard, Duration ttl, String name) {
    if (requested == null) {
      return standard.compareTo(ttl) < 0 ? standard : ttl.dividedBy(2);
    }
    if (requested.compareTo(MIN_MARKER_TTL) < 0 || requested.compareTo(ttl) >= 0) {
      throw new IllegalArgumentException(name + " must be positive and shorter than ttl");
    }
    return requested;
  }
}
