package metahub.addon.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import metahub.addon.config.CacheProperties;
import metahub.addon.infrastructure.concurrency.SingleFlightExecutor;
import metahub.addon.infrastructure.executor.LogicExecutor;
import metahub.addon.infrastructure.executor.TaskContext;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 끝나지 않는 Single-flight 계산 정리 스케줄러
 *
 * <p>{@code cache.single-flight.max-age}보다 오래된 in-flight 항목을 제거하고 대기자 전원을 TimeoutException으로
 * 실패시킵니다. 제거된 키의 다음 요청은 새 Leader가 됩니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SingleFlightSweepScheduler {

  private final SingleFlightExecutor singleFlight;
  private final CacheProperties properties;
  private final LogicExecutor executor;

  @Scheduled(
      fixedDelayString = "${cache.single-flight.sweep-interval:PT1M}",
      initialDelayString = "${cache.single-flight.sweep-interval:PT1M}")
  public void sweep() {
    executor.executeOrCatch(
        () -> singleFlight.evictOlderThan(properties.getSingleFlight().getMaxAge()),
        e -> {
          log.warn("[SingleFlightSweep] Sweep failed: {}", e.getMessage());
          return 0;
        },
        TaskContext.of("SingleFlightSweep", "Sweep"));
  }
}
