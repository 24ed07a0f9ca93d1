package metahub.addon.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;
import metahub.addon.infrastructure.concurrency.SingleFlightExecutor;
import metahub.addon.service.cache.CachePolicies;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 캐시 래퍼가 공유하는 프로세스 단위 Single-flight 맵
 *
 * <p>Follower에는 별도 타임아웃이 없으므로 멈춘 계산은 {@code cache.single-flight.max-age} 스윕으로만 정리됩니다. 정상 로드가
 * 스윕에 걸리지 않도록 max-age는 카테고리 정책의 최대 로드 시간보다 길어야 합니다.
 */
@Configuration
public class SingleFlightConfig {

  @Bean
  public SingleFlightExecutor cacheSingleFlight(
      CacheProperties properties,
      CachePolicies policies,
      @Qualifier("cacheComputeExecutor") Executor computeExecutor,
      Clock clock,
      MeterRegistry meterRegistry) {
    requireMaxAgeAboveLoadTime(properties.getSingleFlight().getMaxAge(), policies);
    SingleFlightExecutor singleFlight = new SingleFlightExecutor(computeExecutor, clock);
    Gauge.builder("cache.singleflight.inflight", singleFlight, SingleFlightExecutor::getInFlightCount)
        .description("진행 중인 Single-flight 계산 수")
        .register(meterRegistry);
    return singleFlight;
  }

  static void requireMaxAgeAboveLoadTime(Duration maxAge, CachePolicies policies) {
    Duration longest = policies.longestLoadTime();
    if (maxAge.compareTo(longest) <= 0) {
      throw new IllegalStateException(
          "cache.single-flight.max-age ("
              + maxAge
              + ") must exceed the longest category load time ("
              + longest
              + ")");
    }
  }
}
