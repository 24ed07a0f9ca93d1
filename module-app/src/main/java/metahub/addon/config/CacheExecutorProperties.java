package metahub.addon.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * 캐시 전용 Thread Pool 프로퍼티
 *
 * <h2>설정</h2>
 *
 * <pre>{@code
 * cache:
 *   executor:
 *     compute-core-pool-size: 8
 *     refresh-core-pool-size: 2
 *     warming-core-pool-size: 2
 *     scheduler-pool-size: 2
 * }</pre>
 *
 * @see CacheExecutorConfig
 */
@ConfigurationProperties(prefix = "cache.executor")
public record CacheExecutorProperties(
    @DefaultValue("8") int computeCorePoolSize,
    @DefaultValue("32") int computeMaxPoolSize,
    @DefaultValue("500") int computeQueueCapacity,
    @DefaultValue("2") int refreshCorePoolSize,
    @DefaultValue("4") int refreshMaxPoolSize,
    @DefaultValue("100") int refreshQueueCapacity,
    @DefaultValue("2") int warmingCorePoolSize,
    @DefaultValue("4") int warmingMaxPoolSize,
    @DefaultValue("200") int warmingQueueCapacity,
    @DefaultValue("2") int schedulerPoolSize,
    @DefaultValue("30") int awaitTerminationSeconds) {

  public CacheExecutorProperties {
    requirePool("compute", computeCorePoolSize, computeMaxPoolSize);
    requirePool("refresh", refreshCorePoolSize, refreshMaxPoolSize);
    requirePool("warming", warmingCorePoolSize, warmingMaxPoolSize);
    if (schedulerPoolSize <= 0) {
      throw new IllegalArgumentException(
          "cache.executor.scheduler-pool-size must be positive, got: " + schedulerPoolSize);
    }
    if (awaitTerminationSeconds <= 0) {
      throw new IllegalArgumentException("await-termination-seconds must be positive");
    }
  }

  private static void requirePool(String name, int core, int max) {
    if (core <= 0 || max < core) {
      throw new IllegalArgumentException(
          "cache.executor." + name + " pool must satisfy 0 < core <= max, got: " + core + "/" + max);
    }
  }
}
