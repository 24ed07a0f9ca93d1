package metahub.addon.service.health;

import java.time.Instant;
import java.util.Map;
import metahub.addon.core.domain.cache.CacheCategory;

/**
 * Point-in-time copy of the health counters.
 *
 * @param since instant of the last reset
 * @param categories counts per category, every category present
 */
public record HealthSnapshot(Instant since, Map<CacheCategory, CategoryHealth> categories) {

  public HealthSnapshot {
    categories = Map.copyOf(categories);
  }

  public CategoryHealth of(CacheCategory category) {
    return categories.get(category);
  }
}
