package metahub.addon.service.warming;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import metahub.addon.core.domain.warming.WarmingJobStatus;
import metahub.addon.core.domain.warming.WarmingReport;
import metahub.addon.core.domain.warming.WarmingStatus;

/** Mutable state of the essential warming job. One pass at a time. */
final class WarmingState {

  private final AtomicReference<CompletableFuture<WarmingReport>> currentRun =
      new AtomicReference<>();

  private volatile List<String> targetKeys = List.of();
  private volatile long cadenceMinutes;
  private volatile Instant lastRunAt;
  private volatile WarmingStatus lastStatus = WarmingStatus.NEVER;
  private volatile boolean initialWarmingComplete;

  /**
   * Claims the job for a new pass.
   *
   * @return null if claimed, otherwise the future of the pass already running
   */
  CompletableFuture<WarmingReport> tryStart(CompletableFuture<WarmingReport> run) {
    return currentRun.compareAndExchange(null, run);
  }

  void finish(CompletableFuture<WarmingReport> run, WarmingReport report, List<String> keys) {
    targetKeys = List.copyOf(keys);
    lastRunAt = report.finishedAt();
    lastStatus = report.status();
    initialWarmingComplete = true;
    currentRun.compareAndSet(run, null);
  }

  boolean inProgress() {
    return currentRun.get() != null;
  }

  boolean initialWarmingComplete() {
    return initialWarmingComplete;
  }

  void cadenceMinutes(long minutes) {
    this.cadenceMinutes = minutes;
  }

  WarmingJobStatus snapshot() {
    return new WarmingJobStatus(
        targetKeys, cadenceMinutes, lastRunAt, lastStatus, inProgress(), initialWarmingComplete);
  }
}
