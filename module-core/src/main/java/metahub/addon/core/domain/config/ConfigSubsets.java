package metahub.addon.core.domain.config;

import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Extracts the part of a {@link UserConfig} that affects a given route family.
 *
 * <p>Result maps are sorted so that their serialized form is canonical.
 */
public final class ConfigSubsets {

  /** API keys that change artwork (rating posters, list ratings). */
  public static final Set<String> ARTWORK_API_KEYS = Set.of("rpdb", "mdblist");

  private ConfigSubsets() {}

  /** Same as {@link #forRoute}; named after the validator category it feeds. */
  public static SortedMap<String, Object> forCategory(RouteCategory category, UserConfig config) {
    return forRoute(category, config);
  }

  public static SortedMap<String, Object> forRoute(RouteCategory route, UserConfig config) {
    SortedMap<String, Object> subset = new TreeMap<>();
    switch (route) {
      case CATALOG -> {
        subset.put("language", config.language());
        subset.put("providers", sorted(config.providers()));
        subset.put("artProviders", sorted(config.artProviders()));
        putContentFilters(subset, config);
        subset.put("mal", mal(config.mal()));
      }
      case META -> {
        subset.put("language", config.language());
        subset.put("providers", sorted(config.providers()));
        subset.put("artProviders", sorted(config.artProviders()));
        subset.put("tvdbSeasonType", config.tvdbSeasonType());
        subset.put("castCount", config.castCount());
        subset.put("blurThumbs", config.blurThumbs());
        subset.put("apiKeys", artworkApiKeys(config.apiKeys()));
        subset.put("mal", mal(config.mal()));
      }
      case SEARCH -> {
        subset.put("language", config.language());
        subset.put("searchProviders", sorted(config.searchProviders()));
        putContentFilters(subset, config);
      }
      case MANIFEST -> {
        subset.put("language", config.language());
        subset.put("providers", sorted(config.providers()));
        subset.put("artProviders", sorted(config.artProviders()));
        subset.put("searchProviders", sorted(config.searchProviders()));
        subset.put("catalogs", config.catalogs());
        putContentFilters(subset, config);
        subset.put("tvdbSeasonType", config.tvdbSeasonType());
        subset.put("castCount", config.castCount());
        subset.put("blurThumbs", config.blurThumbs());
        subset.put("apiKeys", sorted(config.apiKeys()));
        subset.put("mal", mal(config.mal()));
        subset.put("showPrefix", config.showPrefix());
      }
    }
    return subset;
  }

  private static void putContentFilters(Map<String, Object> subset, UserConfig config) {
    subset.put("sfw", config.sfw());
    subset.put("includeAdult", config.includeAdult());
    subset.put("ageRating", config.ageRating());
  }

  private static SortedMap<String, String> artworkApiKeys(Map<String, String> apiKeys) {
    SortedMap<String, String> keys = new TreeMap<>();
    apiKeys.forEach(
        (name, value) -> {
          if (ARTWORK_API_KEYS.contains(name)) {
            keys.put(name, value);
          }
        });
    return keys;
  }

  private static SortedMap<String, Object> mal(MalSettings mal) {
    SortedMap<String, Object> values = new TreeMap<>();
    values.put("enabled", mal.enabled());
    values.put("skipFiller", mal.skipFiller());
    values.put("skipRecap", mal.skipRecap());
    return values;
  }

  private static SortedMap<String, String> sorted(Map<String, String> map) {
    return new TreeMap<>(map);
  }
}
