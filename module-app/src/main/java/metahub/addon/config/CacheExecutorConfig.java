package metahub.addon.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * 캐시 전용 Executor / Scheduler 설정
 *
 * <h4>풀 분리</h4>
 *
 * <ul>
 *   <li>cacheComputeExecutor: Single-flight Leader 계산 (CallerRunsPolicy, 유실 불가)
 *   <li>cacheRefreshExecutor: Stale 백그라운드 갱신 (DiscardPolicy, Stale 값이 이미 응답됨)
 *   <li>cacheWarmingExecutor: 웜업 작업 (AbortPolicy, 요청 경로와 격리)
 *   <li>cacheTaskScheduler: 정기 웜업 타이머
 * </ul>
 */
@Slf4j
@Configuration
@EnableScheduling
@RequiredArgsConstructor
@EnableConfigurationProperties({CacheProperties.class, CacheExecutorProperties.class})
public class CacheExecutorConfig {

  private final MeterRegistry meterRegistry;

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean("cacheComputeExecutor")
  public Executor cacheComputeExecutor(CacheExecutorProperties props) {
    ThreadPoolTaskExecutor executor =
        newExecutor(
            "cache-compute-",
            props.computeCorePoolSize(),
            props.computeMaxPoolSize(),
            props.computeQueueCapacity(),
            props.awaitTerminationSeconds());
    // 포화 시 호출 스레드에서 실행 (계산 유실 시 대기자 전원이 실패하므로)
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.initialize();
    registerMetrics("compute", executor);
    return executor;
  }

  @Bean("cacheRefreshExecutor")
  public Executor cacheRefreshExecutor(CacheExecutorProperties props) {
    ThreadPoolTaskExecutor executor =
        newExecutor(
            "cache-refresh-",
            props.refreshCorePoolSize(),
            props.refreshMaxPoolSize(),
            props.refreshQueueCapacity(),
            props.awaitTerminationSeconds());
    // 큐 포화 시 버림: 다음 stale hit에서 다시 트리거됨
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.DiscardPolicy());
    executor.initialize();
    registerMetrics("refresh", executor);
    return executor;
  }

  @Bean("cacheWarmingExecutor")
  public Executor cacheWarmingExecutor(CacheExecutorProperties props) {
    ThreadPoolTaskExecutor executor =
        newExecutor(
            "cache-warming-",
            props.warmingCorePoolSize(),
            props.warmingMaxPoolSize(),
            props.warmingQueueCapacity(),
            props.awaitTerminationSeconds());
    // 기본 AbortPolicy: 거절 시 웜업 호출자가 경고 로그 후 건너뜀
    executor.initialize();
    registerMetrics("warming", executor);
    return executor;
  }

  @Bean("cacheTaskScheduler")
  public TaskScheduler cacheTaskScheduler(CacheExecutorProperties props) {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(props.schedulerPoolSize());
    scheduler.setThreadNamePrefix("cache-scheduler-");
    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setAwaitTerminationSeconds(props.awaitTerminationSeconds());
    scheduler.setErrorHandler(t -> log.error("[CacheScheduler] Scheduled task failed", t));
    scheduler.initialize();
    return scheduler;
  }

  private ThreadPoolTaskExecutor newExecutor(
      String prefix, int core, int max, int queueCapacity, int awaitTerminationSeconds) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(core);
    executor.setMaxPoolSize(max);
    executor.setQueueCapacity(queueCapacity);
    executor.setThreadNamePrefix(prefix);
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(awaitTerminationSeconds);
    return executor;
  }

  /** Thread Pool 메트릭 등록 (풀 이름은 고정 태그) */
  private void registerMetrics(String pool, ThreadPoolTaskExecutor executor) {
    Gauge.builder(
            "cache.executor.queue.size",
            executor,
            e -> e.getThreadPoolExecutor().getQueue().size())
        .tag("pool", pool)
        .description("캐시 Executor 대기 큐 크기")
        .register(meterRegistry);

    Gauge.builder("cache.executor.active.count", executor, ThreadPoolTaskExecutor::getActiveCount)
        .tag("pool", pool)
        .description("캐시 Executor 활성 스레드 수")
        .register(meterRegistry);
  }
}
