package metahub.addon.service.health;

import java.util.Locale;

/** Outcome tag of {@code cache.requests}. */
public enum CacheOutcome {
  HIT,
  STALE_HIT,
  ERROR_CACHE_HIT,
  MISS,
  ERROR,
  PARTIAL_HIT,
  CORRUPTED;

  public String tag() {
    return name().toLowerCase(Locale.ROOT);
  }
}
