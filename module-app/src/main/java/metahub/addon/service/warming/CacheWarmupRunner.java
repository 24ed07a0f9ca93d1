package metahub.addon.service.warming;

import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import metahub.addon.config.CacheProperties;
import metahub.addon.core.domain.warming.WarmingReport;
import metahub.addon.infrastructure.executor.LogicExecutor;
import metahub.addon.infrastructure.executor.TaskContext;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 기동 시 초기 Essential 웜업
 *
 * <p>첫 패스를 {@code cache.warming.startup-timeout}까지만 기다린 뒤 정기 웜업을 설치합니다. 첫 패스가 실패하거나 제한 시간을
 * 넘겨도 기동은 계속됩니다 (패스 자체는 백그라운드에서 계속 진행).
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "cache.warming.enabled", havingValue = "true", matchIfMissing = true)
public class CacheWarmupRunner implements ApplicationRunner {

  private final CacheWarmer cacheWarmer;
  private final CacheProperties properties;
  private final LogicExecutor executor;

  @Override
  public void run(ApplicationArguments args) {
    CacheProperties.Warming warming = properties.getWarming();
    executor.executeOrCatch(
        () -> {
          WarmingReport report =
              cacheWarmer
                  .warmEssential()
                  .get(warming.getStartupTimeout().toMillis(), TimeUnit.MILLISECONDS);
          log.info("[CacheWarmup] Initial warming finished: status={}", report.status());
          return report;
        },
        e -> {
          if (e.getCause() instanceof InterruptedException) {
            Thread.currentThread().interrupt();
          }
          log.warn("[CacheWarmup] Initial warming not completed, continuing startup: {}", e.getMessage());
          return null;
        },
        TaskContext.of("CacheWarmup", "Initial"));
    cacheWarmer.scheduleEssential(warming.getIntervalMinutes());
  }
}
