package metahub.addon.core.domain.warming;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of the essential warming job.
 *
 * @param targetKeys keys of the essential targets, in warming order
 * @param cadenceMinutes schedule interval, 0 when not scheduled
 * @param lastRunAt end of the last finished pass, {@code null} before the first one
 * @param lastStatus status of the last finished pass
 * @param inProgress whether a pass is currently running
 * @param initialWarmingComplete whether the first pass has finished
 */
public record WarmingJobStatus(
    List<String> targetKeys,
    long cadenceMinutes,
    Instant lastRunAt,
    WarmingStatus lastStatus,
    boolean inProgress,
    boolean initialWarmingComplete) {}
