package metahub.addon.service.warming;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;
import lombok.extern.slf4j.Slf4j;
import metahub.addon.config.CacheProperties;
import metahub.addon.infrastructure.executor.LogicExecutor;
import metahub.addon.infrastructure.executor.TaskContext;
import org.springframework.stereotype.Component;

/**
 * 최근 요청된 콘텐츠 호출 횟수 트래커
 *
 * <h4>구조</h4>
 *
 * <pre>
 * Key:   (id, type)
 * Value: 호출 횟수 (LongAdder)
 * 만료:  마지막 접근 후 cache.warming.popular-window
 * 크기:  cache.warming.popular-maximum-size (초과 시 Caffeine이 빈도 기반으로 축출)
 * </pre>
 *
 * <p>정기 웜업 시 상위 N개 항목의 연관 콘텐츠를 미리 채우는 데 사용합니다. 기록 실패는 요청 처리에 영향을 주지 않습니다.
 *
 * @see CacheWarmer#warmRelated(String, String)
 */
@Slf4j
@Component
public class PopularContentTracker {

  private final Cache<ContentRef, LongAdder> accesses;
  private final LogicExecutor executor;
  private final MeterRegistry meterRegistry;

  /** 추적 대상 콘텐츠 */
  public record ContentRef(String id, String type) {}

  public PopularContentTracker(
      CacheProperties properties, LogicExecutor executor, MeterRegistry meterRegistry) {
    CacheProperties.Warming warming = properties.getWarming();
    this.accesses =
        Caffeine.newBuilder()
            .maximumSize(warming.getPopularMaximumSize())
            .expireAfterAccess(warming.getPopularWindow())
            .build();
    this.executor = executor;
    this.meterRegistry = meterRegistry;
  }

  /**
   * 콘텐츠 호출 기록 (Fire-and-Forget)
   *
   * @param id 콘텐츠 ID (예: tt0903747, mal:1535)
   * @param type 콘텐츠 타입 (movie, series, anime)
   */
  public void recordAccess(String id, String type) {
    executor.executeOrDefault(
        () -> {
          accesses.get(new ContentRef(id, type), ref -> new LongAdder()).increment();
          meterRegistry.counter("cache.popular.record").increment();
          return null;
        },
        null,
        TaskContext.of("PopularTracker", "RecordAccess", id));
  }

  /**
   * 호출 횟수 상위 N개
   *
   * @param limit 상위 N개
   * @return 호출 횟수 내림차순 목록
   */
  public List<ContentRef> topN(int limit) {
    return executor.executeOrDefault(
        () ->
            accesses.asMap().entrySet().stream()
                .sorted(
                    Comparator.comparingLong(
                            (Map.Entry<ContentRef, LongAdder> e) -> e.getValue().sum())
                        .reversed())
                .limit(limit)
                .map(Map.Entry::getKey)
                .toList(),
        List.of(),
        TaskContext.of("PopularTracker", "TopN", String.valueOf(limit)));
  }

  public long accessCount(String id, String type) {
    LongAdder count = accesses.getIfPresent(new ContentRef(id, type));
    return count == null ? 0 : count.sum();
  }

  public void clear() {
    accesses.invalidateAll();
    log.info("[PopularTracker] Cleared access counts");
  }
}
