package metahub.addon.core.domain.cache;

import java.util.Arrays;

/**
 * Cache categories. Each category carries its own default policy (TTL, stale window, error caching)
 * and its own health counters.
 */
public enum CacheCategory {
  CATALOG("catalog"),
  META("meta"),
  SEARCH("search"),
  PROVIDER("provider"),
  GLOBAL("global");

  private final String key;

  CacheCategory(String key) {
    this.key = key;
  }

  /** Segment used in the key namespace and as metric tag. */
  public String key() {
    return key;
  }

  public static CacheCategory fromKey(String key) {
    return Arrays.stream(values())
        .filter(c -> c.key.equalsIgnoreCase(key))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown cache category: " + key));
  }
}
