package metahub.addon.service.health;

/**
 * Counts of one category since the last reset.
 *
 * <p>{@code hits} includes {@code staleHits}. Error-cache hits are counted apart from hits and
 * misses.
 */
public record CategoryHealth(
    long hits,
    long staleHits,
    long errorCacheHits,
    long misses,
    long errors,
    long partialHits,
    long corrupted) {

  public long requests() {
    return hits + misses + partialHits + errorCacheHits + errors;
  }

  public double hitRate() {
    long requests = requests();
    return requests == 0 ? 0.0 : (double) hits / requests;
  }

  public double errorRate() {
    long requests = requests();
    return requests == 0 ? 0.0 : (double) errors / requests;
  }
}
