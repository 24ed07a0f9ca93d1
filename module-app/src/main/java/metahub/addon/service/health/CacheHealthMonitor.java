package metahub.addon.service.health;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;
import java.util.concurrent.atomic.LongAdder;
import lombok.extern.slf4j.Slf4j;
import metahub.addon.core.domain.cache.CacheCategory;
import metahub.addon.infrastructure.executor.LogicExecutor;
import metahub.addon.infrastructure.executor.TaskContext;
import org.springframework.stereotype.Component;

/**
 * 카테고리별 캐시 결과 카운터
 *
 * <h4>기록 대상</h4>
 *
 * <ul>
 *   <li>hit / stale hit (stale hit은 hit에도 포함)
 *   <li>error-cache hit: 살아있는 에러 마커로 응답
 *   <li>miss: 계산 성공, error: 계산 실패 (백그라운드 갱신 실패 포함)
 *   <li>partial hit: 컴포넌트 일부만 존재, corrupted: 손상 항목 삭제
 * </ul>
 *
 * <p>각 카운트는 {@link LongAdder}로 누적되고 Micrometer {@code cache.requests{category,outcome}} 카운터로도
 * 기록됩니다. 기록 실패는 로그만 남기고 삼키므로 캐시 동작에 영향을 주지 않습니다.
 */
@Slf4j
@Component
public class CacheHealthMonitor {

  private static final String METRIC_NAME = "cache.requests";

  private final LogicExecutor executor;
  private final Clock clock;

  private final Map<CacheCategory, Map<CacheOutcome, LongAdder>> counts =
      new EnumMap<>(CacheCategory.class);
  private final Map<CacheCategory, Map<CacheOutcome, Counter>> counters =
      new EnumMap<>(CacheCategory.class);

  private volatile Instant since;

  public CacheHealthMonitor(MeterRegistry meterRegistry, LogicExecutor executor, Clock clock) {
    this.executor = executor;
    this.clock = clock;
    for (CacheCategory category : CacheCategory.values()) {
      Map<CacheOutcome, LongAdder> adders = new EnumMap<>(CacheOutcome.class);
      Map<CacheOutcome, Counter> meters = new EnumMap<>(CacheOutcome.class);
      for (CacheOutcome outcome : CacheOutcome.values()) {
        adders.put(outcome, new LongAdder());
        meters.put(
            outcome,
            Counter.builder(METRIC_NAME)
                .tag("category", category.key())
                .tag("outcome", outcome.tag())
                .description("캐시 요청 결과")
                .register(meterRegistry));
      }
      counts.put(category, adders);
      counters.put(category, meters);
    }
    this.since = clock.instant();
  }

  public void recordHit(CacheCategory category) {
    record(category, CacheOutcome.HIT);
  }

  /** Stale 응답은 hit으로도 집계 */
  public void recordStaleHit(CacheCategory category) {
    record(category, CacheOutcome.HIT);
    record(category, CacheOutcome.STALE_HIT);
  }

  public void recordErrorCacheHit(CacheCategory category) {
    record(category, CacheOutcome.ERROR_CACHE_HIT);
  }

  public void recordMiss(CacheCategory category) {
    record(category, CacheOutcome.MISS);
  }

  public void recordError(CacheCategory category) {
    record(category, CacheOutcome.ERROR);
  }

  public void recordPartialHit(CacheCategory category) {
    record(category, CacheOutcome.PARTIAL_HIT);
  }

  public void recordCorrupted(CacheCategory category) {
    record(category, CacheOutcome.CORRUPTED);
  }

  public HealthSnapshot snapshot() {
    Map<CacheCategory, CategoryHealth> categories = new EnumMap<>(CacheCategory.class);
    counts.forEach((category, adders) -> categories.put(category, toHealth(adders)));
    return new HealthSnapshot(since, categories);
  }

  /** 카운트 초기화. Micrometer 카운터는 단조 증가이므로 유지됩니다. */
  public void reset() {
    counts.values().forEach(adders -> adders.values().forEach(LongAdder::reset));
    since = clock.instant();
    log.info("[CacheHealth] Counters reset");
  }

  /** 사람이 읽을 수 있는 한 줄 요약 */
  public String describe() {
    HealthSnapshot snapshot = snapshot();
    StringJoiner joiner = new StringJoiner(" ", "[CacheHealth] since=" + snapshot.since() + " ", "");
    for (CacheCategory category : CacheCategory.values()) {
      CategoryHealth health = snapshot.of(category);
      joiner.add(
          String.format(
              Locale.ROOT,
              "%s{hits=%d, stale=%d, misses=%d, errors=%d, errorCached=%d, partial=%d,"
                  + " corrupted=%d, hitRate=%.1f%%}",
              category.key(),
              health.hits(),
              health.staleHits(),
              health.misses(),
              health.errors(),
              health.errorCacheHits(),
              health.partialHits(),
              health.corrupted(),
              health.hitRate() * 100));
    }
    return joiner.toString();
  }

  private void record(CacheCategory category, CacheOutcome outcome) {
    executor.executeOrCatch(
        () -> {
          counts.get(category).get(outcome).increment();
          counters.get(category).get(outcome).increment();
          return null;
        },
        e -> {
          log.warn(
              "[CacheHealth] Failed to record outcome={} category={}: {}",
              outcome,
              category,
              e.getMessage());
          return null;
        },
        TaskContext.of("CacheHealth", "Record", outcome.tag()));
  }

  private static CategoryHealth toHealth(Map<CacheOutcome, LongAdder> adders) {
    return new CategoryHealth(
        adders.get(CacheOutcome.HIT).sum(),
        adders.get(CacheOutcome.STALE_HIT).sum(),
        adders.get(CacheOutcome.ERROR_CACHE_HIT).sum(),
        adders.get(CacheOutcome.MISS).sum(),
        adders.get(CacheOutcome.ERROR).sum(),
        adders.get(CacheOutcome.PARTIAL_HIT).sum(),
        adders.get(CacheOutcome.CORRUPTED).sum());
  }
}
