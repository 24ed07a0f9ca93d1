package metahub.addon.service.warming;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import metahub.addon.config.CacheProperties;
import metahub.addon.core.domain.cache.CacheCategory;
import metahub.addon.core.domain.cache.CacheEntry;
import metahub.addon.core.domain.cache.CacheKey;
import metahub.addon.core.domain.cache.CachePolicy;
import metahub.addon.core.domain.config.UserConfig;
import metahub.addon.core.domain.warming.WarmingJobStatus;
import metahub.addon.core.domain.warming.WarmingReport;
import metahub.addon.core.domain.warming.WarmupTarget;
import metahub.addon.core.port.out.CacheStore;
import metahub.addon.core.port.out.ConfigProvider;
import metahub.addon.core.port.out.WarmupTargetSource;
import metahub.addon.infrastructure.cache.codec.CacheEntryCodec;
import metahub.addon.infrastructure.executor.LogicExecutor;
import metahub.addon.infrastructure.executor.TaskContext;
import metahub.addon.infrastructure.util.ExceptionUtils;
import metahub.addon.service.cache.CachePolicies;
import metahub.addon.service.cache.CacheWrapper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * 캐시 웜업 서비스
 *
 * <h3>기능</h3>
 *
 * <ul>
 *   <li>Essential: 등록된 {@link WarmupTargetSource}의 사용자 무관 고트래픽 항목을 동시성 제한 배치로 채움
 *   <li>Related / User: 요청 처리 후 다음에 요청될 가능성이 높은 콘텐츠를 Best-effort로 채움
 *   <li>Popular: 정기 웜업 시 최근 인기 항목 상위 N개의 연관 콘텐츠를 채움
 * </ul>
 *
 * <h3>보장</h3>
 *
 * <ul>
 *   <li>이미 fresh인 항목은 건너뛰므로 같은 TTL 구간 내 반복 호출은 업스트림 호출이 없음
 *   <li>진행 중인 Essential 패스가 있으면 새 패스를 시작하지 않고 그 결과에 합류
 *   <li>모든 실패는 로그와 헬스 카운터에만 남고 호출자에게 전파되지 않음
 *   <li>모든 쓰기는 캐시 래퍼의 createdAt 비교 기록을 거치므로 더 최신 값을 덮어쓰지 않음
 * </ul>
 *
 * @see PopularContentTracker
 */
@Slf4j
@Component
public class CacheWarmer {

  private static final String COMPONENT = "CacheWarmer";
  static final String TMDB_PROVIDER = "tmdb";
  static final String TMDB_TRENDING = "tmdb.trending";
  static final String MAL_TOP = "mal.top";
  static final String MAL_SEASONAL = "mal.seasonal";

  private final CacheWrapper wrapper;
  private final CacheStore store;
  private final CacheEntryCodec codec;
  private final CachePolicies policies;
  private final List<WarmupTargetSource> sources;
  private final ObjectProvider<ConfigProvider> configProvider;
  private final PopularContentTracker popularTracker;
  private final LogicExecutor executor;
  private final Executor warmingExecutor;
  private final TaskScheduler taskScheduler;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private final CacheProperties.Warming settings;

  private final WarmingState state = new WarmingState();
  private ScheduledFuture<?> schedule;

  public CacheWarmer(
      CacheWrapper wrapper,
      CacheStore store,
      CacheEntryCodec codec,
      CachePolicies policies,
      List<WarmupTargetSource> sources,
      ObjectProvider<ConfigProvider> configProvider,
      PopularContentTracker popularTracker,
      LogicExecutor executor,
      @Qualifier("cacheWarmingExecutor") Executor warmingExecutor,
      @Qualifier("cacheTaskScheduler") TaskScheduler taskScheduler,
      MeterRegistry meterRegistry,
      Clock clock,
      CacheProperties properties) {
    this.wrapper = wrapper;
    this.store = store;
    this.codec = codec;
    this.policies = policies;
    this.sources = List.copyOf(sources);
    this.configProvider = configProvider;
    this.popularTracker = popularTracker;
    this.executor = executor;
    this.warmingExecutor = warmingExecutor;
    this.taskScheduler = taskScheduler;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
    this.settings = properties.getWarming();
  }

  // ==================== Essential ====================

  /**
   * Essential 웜업 1회 실행
   *
   * @return 결과 리포트 (항상 정상 완료, 예상치 못한 실패는 FAILED 리포트)
   */
  public CompletableFuture<WarmingReport> warmEssential() {
    CompletableFuture<WarmingReport> run = new CompletableFuture<>();
    CompletableFuture<WarmingReport> running = state.tryStart(run);
    if (running != null) {
      log.debug("[CacheWarmer] Essential warming already in progress, joining");
      return running;
    }

    Instant startedAt = clock.instant();
    List<String> keys = new ArrayList<>();
    executor.executeOrCatch(
        () ->
            CompletableFuture.supplyAsync(this::collectEssentialTargets, warmingExecutor)
                .thenCompose(
                    targets -> {
                      targets.forEach(target -> keys.add(target.key().asString()));
                      return warmInBatches(targets, startedAt);
                    })
                .whenComplete(
                    (report, error) -> completeEssential(run, report, error, startedAt, keys)),
        e -> {
          completeEssential(run, null, e, startedAt, keys);
          return null;
        },
        TaskContext.of(COMPONENT, "Essential"));
    return run;
  }

  /**
   * 정기 Essential 웜업 설치. 기존 타이머는 취소됩니다.
   *
   * @param intervalMinutes 실행 간격 (분)
   */
  public synchronized void scheduleEssential(long intervalMinutes) {
    if (intervalMinutes <= 0) {
      throw new IllegalArgumentException(
          "intervalMinutes must be positive, got: " + intervalMinutes);
    }
    cancelSchedule();
    Duration interval = Duration.ofMinutes(intervalMinutes);
    schedule =
        taskScheduler.scheduleAtFixedRate(
            this::scheduledPass, clock.instant().plus(interval), interval);
    state.cadenceMinutes(intervalMinutes);
    log.info("[CacheWarmer] Essential warming scheduled every {} min", intervalMinutes);
  }

  @PreDestroy
  public synchronized void cancelSchedule() {
    if (schedule != null) {
      schedule.cancel(false);
      schedule = null;
      state.cadenceMinutes(0);
    }
  }

  public boolean isInitialWarmingComplete() {
    return state.initialWarmingComplete();
  }

  public WarmingJobStatus status() {
    return state.snapshot();
  }

  /** 타이머 콜백: 진행 중인 패스가 있으면 건너뜀 (큐잉하지 않음) */
  void scheduledPass() {
    if (state.inProgress()) {
      log.info("[CacheWarmer] Previous essential pass still running, tick skipped");
      increment("essential", "skipped");
      return;
    }
    warmEssential().thenRun(this::warmPopular);
  }

  private List<WarmupTarget> collectEssentialTargets() {
    return collect("EssentialTargets", WarmupTargetSource::essentialTargets);
  }

  private void completeEssential(
      CompletableFuture<WarmingReport> run,
      WarmingReport report,
      Throwable error,
      Instant startedAt,
      List<String> keys) {
    WarmingReport result = report;
    if (error != null || report == null) {
      log.warn(
          "[CacheWarmer] Essential warming aborted: {}",
          error == null ? "no report" : ExceptionUtils.describe(error));
      result = new WarmingReport(keys.size(), 0, 0, keys.size(), startedAt, clock.instant());
    }
    state.finish(run, result, keys);
    recordLastRun(result);
    increment("essential", result.status().name().toLowerCase(Locale.ROOT));
    log.info(
        "[CacheWarmer] Essential warming {}: attempted={} skipped={} succeeded={} failed={}",
        result.status(),
        result.attempted(),
        result.skipped(),
        result.succeeded(),
        result.failed());
    run.complete(result);
  }

  private void recordLastRun(WarmingReport report) {
    CacheKey key = policies.globalKey(CacheCategory.GLOBAL, "maintenance", "last-cache-warming");
    CachePolicy policy = policies.forCategory(CacheCategory.GLOBAL);
    Map<String, Object> value = new LinkedHashMap<>();
    value.put("finishedAt", report.finishedAt().toString());
    value.put("status", report.status().name());
    value.put("attempted", report.attempted());
    value.put("skipped", report.skipped());
    value.put("succeeded", report.succeeded());
    value.put("failed", report.failed());
    executor.executeOrCatch(
        () -> {
          CacheEntry entry =
              CacheEntry.of(
                  key,
                  codec.toTree(value),
                  report.finishedAt().toEpochMilli(),
                  policy.ttl(),
                  Duration.ZERO);
          return store.setIfNewer(entry, entry.physicalTtl());
        },
        e -> {
          log.warn("[CacheWarmer] Failed to record last warming run: {}", e.getMessage());
          return false;
        },
        TaskContext.of(COMPONENT, "RecordLastRun", key.asString()));
  }

  // ==================== Related / User / Popular ====================

  /**
   * 연관 콘텐츠 Best-effort 웜업
   *
   * @return 항상 정상 완료되는 분리된 Future
   */
  public CompletableFuture<Void> warmRelated(String id, String type) {
    return detached(
        "Related",
        id + "/" + type,
        () -> collect("RelatedTargets", source -> source.relatedTargets(id, type)));
  }

  /**
   * 사용자 설정 기반 카탈로그 Best-effort 웜업
   *
   * <ul>
   *   <li>프로바이더에 tmdb 포함: tmdb.trending (movie, series)
   *   <li>MAL 활성: mal.top, mal.seasonal (anime)
   * </ul>
   *
   * @return 항상 정상 완료되는 분리된 Future
   */
  public CompletableFuture<Void> warmForUser(String userId) {
    return detached("User", userId, () -> userTargets(userId));
  }

  /** 최근 인기 항목 상위 N개의 연관 콘텐츠 웜업 */
  public CompletableFuture<Void> warmPopular() {
    int topN = settings.getPopularTopN();
    if (topN <= 0) {
      return CompletableFuture.completedFuture(null);
    }
    List<CompletableFuture<Void>> runs =
        popularTracker.topN(topN).stream().map(ref -> warmRelated(ref.id(), ref.type())).toList();
    return CompletableFuture.allOf(runs.toArray(CompletableFuture[]::new));
  }

  private List<WarmupTarget> userTargets(String userId) {
    ConfigProvider provider = configProvider.getIfAvailable();
    if (provider == null) {
      log.debug("[CacheWarmer] No config provider, user warming skipped: userId={}", userId);
      return List.of();
    }
    Optional<UserConfig> config = provider.findByUserId(userId);
    if (config.isEmpty()) {
      log.debug("[CacheWarmer] Unknown user, warming skipped: userId={}", userId);
      return List.of();
    }
    UserConfig user = config.get();
    List<WarmupTarget> targets = new ArrayList<>();
    if (user.usesProvider(TMDB_PROVIDER)) {
      targets.addAll(catalogTargets(user, TMDB_TRENDING, "movie"));
      targets.addAll(catalogTargets(user, TMDB_TRENDING, "series"));
    }
    if (user.mal().enabled()) {
      targets.addAll(catalogTargets(user, MAL_TOP, "anime"));
      targets.addAll(catalogTargets(user, MAL_SEASONAL, "anime"));
    }
    return targets;
  }

  private List<WarmupTarget> catalogTargets(UserConfig user, String catalogId, String type) {
    return collect("CatalogTargets", source -> source.catalogTargets(user, catalogId, type));
  }

  private CompletableFuture<Void> detached(
      String operation, String subject, Supplier<List<WarmupTarget>> targets) {
    CompletableFuture<Void> done = new CompletableFuture<>();
    Instant startedAt = clock.instant();
    executor.executeOrCatch(
        () ->
            CompletableFuture.supplyAsync(targets, warmingExecutor)
                .thenCompose(list -> warmInBatches(list, startedAt))
                .whenComplete(
                    (report, error) -> {
                      if (error != null) {
                        log.warn(
                            "[CacheWarmer] {} warming aborted: subject={} cause={}",
                            operation,
                            subject,
                            ExceptionUtils.describe(error));
                        increment(operation.toLowerCase(Locale.ROOT), "failed");
                      } else {
                        log.debug(
                            "[CacheWarmer] {} warming {}: subject={} attempted={} failed={}",
                            operation,
                            report.status(),
                            subject,
                            report.attempted(),
                            report.failed());
                        increment(
                            operation.toLowerCase(Locale.ROOT),
                            report.status().name().toLowerCase(Locale.ROOT));
                      }
                      done.complete(null);
                    }),
        e -> {
          log.warn(
              "[CacheWarmer] {} warming not started: subject={} cause={}",
              operation,
              subject,
              e.getMessage());
          done.complete(null);
          return null;
        },
        TaskContext.of(COMPONENT, operation, subject));
    return done;
  }

  // ==================== Batch execution ====================

  private CompletableFuture<WarmingReport> warmInBatches(
      List<WarmupTarget> targets, Instant startedAt) {
    int concurrency = Math.max(1, settings.getConcurrency());
    AtomicInteger attempted = new AtomicInteger();
    AtomicInteger skipped = new AtomicInteger();
    AtomicInteger succeeded = new AtomicInteger();
    AtomicInteger failed = new AtomicInteger();

    CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
    for (int from = 0; from < targets.size(); from += concurrency) {
      List<WarmupTarget> batch = targets.subList(from, Math.min(from + concurrency, targets.size()));
      chain =
          chain.thenCompose(
              ignored -> {
                List<CompletableFuture<Boolean>> futures = new ArrayList<>();
                for (WarmupTarget target : batch) {
                  if (wrapper.isFresh(target.key())) {
                    skipped.incrementAndGet();
                    continue;
                  }
                  attempted.incrementAndGet();
                  futures.add(warmTarget(target));
                }
                return CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                    .thenRun(
                        () ->
                            futures.forEach(
                                f -> {
                                  if (f.join()) {
                                    succeeded.incrementAndGet();
                                  } else {
                                    failed.incrementAndGet();
                                  }
                                }));
              });
    }
    return chain.thenApply(
        ignored ->
            new WarmingReport(
                attempted.get(),
                skipped.get(),
                succeeded.get(),
                failed.get(),
                startedAt,
                clock.instant()));
  }

  // 실패해도 false로 정상 완료
  private CompletableFuture<Boolean> warmTarget(WarmupTarget target) {
    String key = target.key().asString();
    return executor.executeOrCatch(
        () ->
            wrapper
                .wrap(target.key(), Object.class, target.compute(), target.policy())
                .handle(
                    (value, error) -> {
                      if (error != null) {
                        log.warn(
                            "[CacheWarmer] Target failed: key={} cause={}",
                            key,
                            ExceptionUtils.describe(error));
                        return false;
                      }
                      return true;
                    }),
        e -> {
          log.warn("[CacheWarmer] Target not started: key={} cause={}", key, e.getMessage());
          return CompletableFuture.completedFuture(false);
        },
        TaskContext.of(COMPONENT, "Target", key));
  }

  private List<WarmupTarget> collect(
      String operation, Function<WarmupTargetSource, List<WarmupTarget>> extractor) {
    List<WarmupTarget> targets = new ArrayList<>();
    for (WarmupTargetSource source : sources) {
      targets.addAll(
          executor.executeOrCatch(
              () -> {
                List<WarmupTarget> found = extractor.apply(source);
                return found == null ? List.<WarmupTarget>of() : found;
              },
              e -> {
                log.warn(
                    "[CacheWarmer] Target source failed: source={} cause={}",
                    source.getClass().getSimpleName(),
                    e.getMessage());
                return List.of();
              },
              TaskContext.of(COMPONENT, operation, source.getClass().getSimpleName())));
    }
    return targets;
  }

  private void increment(String type, String status) {
    meterRegistry.counter("cache.warming.execution", "type", type, "status", status).increment();
  }
}
