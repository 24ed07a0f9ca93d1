package metahub.addon.core.domain.warming;

import java.time.Instant;

/**
 * Outcome of one essential warming pass.
 *
 * @param attempted targets for which {@code wrap} was called
 * @param skipped targets already fresh in the store
 * @param succeeded attempted targets that completed normally
 * @param failed attempted targets that failed
 */
public record WarmingReport(
    int attempted, int skipped, int succeeded, int failed, Instant startedAt, Instant finishedAt) {

  public static WarmingReport empty(Instant at) {
    return new WarmingReport(0, 0, 0, 0, at, at);
  }

  public WarmingStatus status() {
    if (failed == 0) {
      return WarmingStatus.SUCCESS;
    }
    return succeeded + skipped > 0 ? WarmingStatus.PARTIAL : WarmingStatus.FAILED;
  }
}
