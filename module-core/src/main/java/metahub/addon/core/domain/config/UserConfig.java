package metahub.addon.core.domain.config;

import java.util.List;
import java.util.Map;

/**
 * Per-user addon configuration as supplied by the config provider.
 *
 * <p>Only the fields that influence cached content or HTTP validators are modelled here.
 *
 * @param userId user identifier, also used as cache scope for user-specific entries
 * @param language preferred metadata language, e.g. {@code en-US}
 * @param providers meta provider per content type, e.g. {@code movie -> tmdb}
 * @param artProviders art provider per content type
 * @param searchProviders search provider per content type
 * @param catalogs enabled catalog ids in manifest order
 * @param sfw safe-for-work filter
 * @param includeAdult whether adult titles are included
 * @param ageRating maximum age rating
 * @param tvdbSeasonType season numbering preference (official, dvd, absolute)
 * @param castCount maximum cast members; {@code null} means unlimited
 * @param blurThumbs blur episode thumbnails
 * @param apiKeys user supplied third-party keys, e.g. {@code rpdb}, {@code mdblist}
 * @param mal MyAnimeList options
 * @param showPrefix prefix catalog names with the provider name
 */
public record UserConfig(
    String userId,
    String language,
    Map<String, String> providers,
    Map<String, String> artProviders,
    Map<String, String> searchProviders,
    List<String> catalogs,
    boolean sfw,
    boolean includeAdult,
    String ageRating,
    String tvdbSeasonType,
    Integer castCount,
    boolean blurThumbs,
    Map<String, String> apiKeys,
    MalSettings mal,
    boolean showPrefix) {

  public UserConfig {
    providers = providers == null ? Map.of() : Map.copyOf(providers);
    artProviders = artProviders == null ? Map.of() : Map.copyOf(artProviders);
    searchProviders = searchProviders == null ? Map.of() : Map.copyOf(searchProviders);
    catalogs = catalogs == null ? List.of() : List.copyOf(catalogs);
    apiKeys = apiKeys == null ? Map.of() : Map.copyOf(apiKeys);
    mal = mal == null ? MalSettings.disabled() : mal;
  }

  public boolean usesProvider(String provider) {
    return providers.containsValue(provider);
  }
}
