package metahub.addon.service.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import metahub.addon.core.domain.cache.CacheEntry;
import metahub.addon.core.domain.cache.CacheKey;
import metahub.addon.core.domain.cache.CachePolicy;
import metahub.addon.core.domain.cache.ErrorKind;
import metahub.addon.core.port.out.CacheStore;
import metahub.addon.error.exception.CacheCodecException;
import metahub.addon.error.exception.CachedFailureException;
import metahub.addon.error.exception.InvalidCacheValueException;
import metahub.addon.error.exception.ResourceNotFoundException;
import metahub.addon.infrastructure.cache.codec.CacheEntryCodec;
import metahub.addon.infrastructure.concurrency.SingleFlightExecutor;
import metahub.addon.infrastructure.executor.LogicExecutor;
import metahub.addon.infrastructure.executor.TaskContext;
import metahub.addon.infrastructure.util.ExceptionUtils;
import metahub.addon.service.health.CacheHealthMonitor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * 범용 compute-or-fetch 캐시 래퍼
 *
 * <h4>조회 흐름</h4>
 *
 * <ol>
 *   <li>Fresh: 즉시 반환 (hit)
 *   <li>Stale: 즉시 반환 후 refresh Executor에서 백그라운드 갱신 1회 트리거 (stale hit). 갱신이 실패하면 해당 실패
 *       종류의 마커 TTL 동안 새 갱신을 시작하지 않고 stale 값을 계속 반환
 *   <li>에러 마커: compute 없이 캐시된 실패 반환 (error-cache hit)
 *   <li>없음/만료: Single-flight로 Leader 한 명만 계산, 나머지는 결과 공유
 * </ol>
 *
 * <h4>Leader 계산</h4>
 *
 * <ul>
 *   <li>계산 전 저장소 Double-check
 *   <li>일시 장애는 {@code retryDelay} 간격으로 최대 {@code maxRetries}회 비차단 재시도
 *   <li>성공 시 물리 TTL {@code ttl + staleWindow}로 createdAt 비교 기록 (에러 마커도 덮어씀)
 *   <li>최종 실패 시 {@code errorCaching}이면 짧은 TTL의 에러 마커 1개 기록 (연장하지 않음)
 *   <li>내부 계산 오류는 캐시/재시도 없이 즉시 전파
 * </ul>
 *
 * <h4>저장소 장애</h4>
 *
 * <p>읽기 실패는 miss로, 쓰기 실패는 경고 로그로 처리하므로 저장소가 내려가도 계산 결과는 계속 응답합니다. 손상된 항목은 읽는 시점에
 * 삭제하고 miss로 처리합니다.
 */
@Slf4j
@Component
public class CacheWrapper {

  private static final String COMPONENT = "CacheWrapper";
  private static final Duration REFRESH_BACKOFF_RETENTION = Duration.ofDays(1);

  private final CacheStore store;
  private final CacheEntryCodec codec;
  private final SingleFlightExecutor singleFlight;
  private final CacheHealthMonitor healthMonitor;
  private final LogicExecutor executor;
  private final Executor refreshExecutor;
  private final Clock clock;

  // 실패한 백그라운드 갱신 키 -> 다음 갱신 허용 시각 (clock millis)
  private final Cache<String, Long> refreshBackoff =
      Caffeine.newBuilder()
          .maximumSize(10_000)
          .expireAfterWrite(REFRESH_BACKOFF_RETENTION)
          .build();

  public CacheWrapper(
      CacheStore store,
      CacheEntryCodec codec,
      SingleFlightExecutor singleFlight,
      CacheHealthMonitor healthMonitor,
      LogicExecutor executor,
      @Qualifier("cacheRefreshExecutor") Executor refreshExecutor,
      Clock clock) {
    this.store = store;
    this.codec = codec;
    this.singleFlight = singleFlight;
    this.healthMonitor = healthMonitor;
    this.executor = executor;
    this.refreshExecutor = refreshExecutor;
    this.clock = clock;
  }

  public <T> CompletableFuture<T> wrap(
      CacheKey key, Class<T> type, Supplier<CompletableFuture<T>> compute, CachePolicy policy) {
    return wrap(key, codec.typeOf(type), compute, policy);
  }

  public <T> CompletableFuture<T> wrap(
      CacheKey key,
      TypeReference<T> type,
      Supplier<CompletableFuture<T>> compute,
      CachePolicy policy) {
    return wrap(key, codec.typeOf(type), compute, policy);
  }

  /**
   * 캐시된 값을 반환하거나 진행 중인 계산에 합류하거나 새로 계산합니다.
   *
   * @param key 캐시 키
   * @param type 값 타입 (저장된 JSON 트리를 이 타입으로 변환)
   * @param compute 업스트림 비동기 계산
   * @param policy TTL / stale / 에러 정책
   * @return 값, 또는 계산 실패/캐시된 실패로 완료되는 Future
   */
  public <T> CompletableFuture<T> wrap(
      CacheKey key, JavaType type, Supplier<CompletableFuture<T>> compute, CachePolicy policy) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(compute, "compute");
    Objects.requireNonNull(policy, "policy");

    CacheLookup lookup = lookup(key);
    switch (lookup.state()) {
      case FRESH -> {
        Optional<Cached<T>> cached = decode(key, lookup.entry(), type);
        if (cached.isPresent()) {
          healthMonitor.recordHit(key.category());
          return CompletableFuture.completedFuture(cached.get().value());
        }
      }
      case STALE -> {
        Optional<Cached<T>> cached = decode(key, lookup.entry(), type);
        if (cached.isPresent()) {
          healthMonitor.recordStaleHit(key.category());
          triggerRefresh(key, type, compute, policy);
          return CompletableFuture.completedFuture(cached.get().value());
        }
      }
      case ERROR_CACHED -> {
        healthMonitor.recordErrorCacheHit(key.category());
        log.debug("[CacheWrapper] Serving cached failure: key={}", key);
        return CompletableFuture.failedFuture(cachedFailure(lookup.entry()));
      }
      case MISS -> log.debug("[CacheWrapper] Miss: key={}", key);
    }

    return load(
        key,
        compute,
        policy,
        LoadMode.FOREGROUND,
        () -> recheck(key, type, LoadMode.FOREGROUND),
        (value, createdAt) ->
            writeTree(key, codec.toTree(value), createdAt, policy.ttl(), policy.staleWindow()));
  }

  /** 저장소에 fresh 값이 있는지 확인합니다. compute와 헬스 카운터에 영향을 주지 않습니다. */
  public boolean isFresh(CacheKey key) {
    return lookup(key).state() == CacheLookup.State.FRESH;
  }

  /** Value read from the store; {@code value} may be null when empty results are cached. */
  record Cached<T>(T value) {}

  /** Persists a computed value; never throws. */
  @FunctionalInterface
  interface ResultWriter<T> {
    void write(T value, long createdAt);
  }

  private record Outcome<T>(T value, Throwable error, int attempts) {}

  // ==================== Single-flight load ====================

  /**
   * Single-flight로 Leader 계산을 실행합니다.
   *
   * @param recheck Leader가 계산 전에 수행하는 저장소 재확인 (값이 있으면 계산 생략)
   * @param writer 성공 결과 기록 방식 (일반 값 / 컴포넌트 분해)
   */
  <T> CompletableFuture<T> load(
      CacheKey key,
      Supplier<CompletableFuture<T>> compute,
      CachePolicy policy,
      LoadMode mode,
      Supplier<Optional<Cached<T>>> recheck,
      ResultWriter<T> writer) {
    return singleFlight.executeAsync(
        key.asString(), () -> lead(key, compute, policy, mode, recheck, writer));
  }

  private <T> CompletableFuture<T> lead(
      CacheKey key,
      Supplier<CompletableFuture<T>> compute,
      CachePolicy policy,
      LoadMode mode,
      Supplier<Optional<Cached<T>>> recheck,
      ResultWriter<T> writer) {
    Optional<Cached<T>> existing = recheck.get();
    if (existing.isPresent()) {
      log.debug("[CacheWrapper] Double-check hit, compute skipped: key={}", key);
      if (mode == LoadMode.FOREGROUND) {
        healthMonitor.recordHit(key.category());
      }
      return CompletableFuture.completedFuture(existing.get().value());
    }

    long startedAt = clock.millis();
    return attempt(key, compute, policy, 1)
        .thenCompose(
            outcome ->
                outcome.error() == null
                    ? onSuccess(key, outcome.value(), startedAt, policy, mode, writer)
                    : onFailure(key, outcome.error(), outcome.attempts(), startedAt, policy, mode));
  }

  private <T> CompletableFuture<Outcome<T>> attempt(
      CacheKey key, Supplier<CompletableFuture<T>> compute, CachePolicy policy, int attemptNo) {
    return invoke(compute, policy)
        .handle(
            (value, error) -> {
              if (error == null) {
                return CompletableFuture.completedFuture(new Outcome<T>(value, null, attemptNo));
              }
              Throwable cause = ExceptionUtils.unwrapAsyncException(error);
              if (attemptNo <= policy.maxRetries() && ErrorClassifier.shouldRetry(cause)) {
                log.warn(
                    "[CacheWrapper] Compute failed, retrying: key={} attempt={}/{} cause={}",
                    key,
                    attemptNo,
                    policy.maxRetries() + 1,
                    ExceptionUtils.describe(cause));
                Executor delayed =
                    CompletableFuture.delayedExecutor(
                        policy.retryDelay().toMillis(), TimeUnit.MILLISECONDS);
                return CompletableFuture.supplyAsync(() -> attemptNo + 1, delayed)
                    .thenCompose(next -> attempt(key, compute, policy, next));
              }
              return CompletableFuture.completedFuture(new Outcome<T>(null, cause, attemptNo));
            })
        .thenCompose(Function.identity());
  }

  // compute가 동기 예외를 던지거나 null을 반환해도 실패한 Future로 수렴
  private <T> CompletableFuture<T> invoke(
      Supplier<CompletableFuture<T>> compute, CachePolicy policy) {
    CompletableFuture<T> future =
        CompletableFuture.completedFuture((Void) null).thenCompose(ignored -> compute.get());
    Duration timeout = policy.computeTimeout();
    if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
      future = future.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
    return future;
  }

  private <T> CompletableFuture<T> onSuccess(
      CacheKey key,
      T value,
      long startedAt,
      CachePolicy policy,
      LoadMode mode,
      ResultWriter<T> writer) {
    if (!isValid(key, value, policy)) {
      healthMonitor.recordError(key.category());
      log.error("[CacheWrapper] Computed value rejected by validator: key={}", key);
      if (mode == LoadMode.REFRESH) {
        backOffRefresh(key, FailureType.INTERNAL, policy);
      }
      return CompletableFuture.failedFuture(new InvalidCacheValueException(key.asString()));
    }
    refreshBackoff.invalidate(key.asString());
    if (!policy.cacheEmpty() && EmptyResultDetector.isEmpty(value)) {
      log.debug("[CacheWrapper] Empty result returned uncached: key={}", key);
    } else {
      writer.write(value, startedAt);
    }
    if (mode == LoadMode.FOREGROUND) {
      healthMonitor.recordMiss(key.category());
    }
    return CompletableFuture.completedFuture(value);
  }

  private <T> CompletableFuture<T> onFailure(
      CacheKey key,
      Throwable cause,
      int attempts,
      long startedAt,
      CachePolicy policy,
      LoadMode mode) {
    FailureType type = ErrorClassifier.classify(cause);
    healthMonitor.recordError(key.category());
    if (mode == LoadMode.REFRESH) {
      backOffRefresh(key, type, policy);
    }

    if (type == FailureType.INTERNAL) {
      log.error("[CacheWrapper] Compute failed: key={} mode={}", key, mode, cause);
      return CompletableFuture.failedFuture(cause);
    }

    log.warn(
        "[CacheWrapper] Upstream failure: key={} type={} attempts={} mode={} cause={}",
        key,
        type,
        attempts,
        mode,
        ExceptionUtils.describe(cause));
    if (policy.errorCaching()
        && mode != LoadMode.REFRESH
        && !(cause instanceof CachedFailureException)) {
      writeMarker(key, type.errorKind(), cause, startedAt, policy, attempts);
    }
    return CompletableFuture.failedFuture(cause);
  }

  private boolean isValid(CacheKey key, Object value, CachePolicy policy) {
    return executor.executeOrCatch(
        () -> policy.validator().test(value),
        e -> {
          log.warn("[CacheWrapper] Validator failed: key={} cause={}", key, e.getMessage());
          return false;
        },
        TaskContext.of(COMPONENT, "Validate", key.asString()));
  }

  // ==================== Stale refresh ====================

  private <T> void triggerRefresh(
      CacheKey key, JavaType type, Supplier<CompletableFuture<T>> compute, CachePolicy policy) {
    String rendered = key.asString();
    if (singleFlight.isInFlight(rendered)) {
      log.debug("[CacheWrapper] Refresh already in flight: key={}", rendered);
      return;
    }
    Long retryAt = refreshBackoff.getIfPresent(rendered);
    if (retryAt != null && retryAt > clock.millis()) {
      log.debug("[CacheWrapper] Refresh backed off after failure: key={}", rendered);
      return;
    }
    executor.executeOrCatch(
        () -> {
          refreshExecutor.execute(() -> refresh(key, type, compute, policy));
          return null;
        },
        e -> {
          log.warn("[CacheWrapper] Refresh not scheduled: key={} cause={}", rendered, e.getMessage());
          return null;
        },
        TaskContext.of(COMPONENT, "ScheduleRefresh", rendered));
  }

  // 에러 마커를 남기지 않는 대신 같은 기간 동안 갱신 재시작을 막음
  private void backOffRefresh(CacheKey key, FailureType type, CachePolicy policy) {
    Duration backoff = type.cacheable() ? policy.markerTtl(type.errorKind()) : policy.errorTtl();
    refreshBackoff.put(key.asString(), clock.millis() + backoff.toMillis());
  }

  private <T> void refresh(
      CacheKey key, JavaType type, Supplier<CompletableFuture<T>> compute, CachePolicy policy) {
    load(
            key,
            compute,
            policy,
            LoadMode.REFRESH,
            () -> recheck(key, type, LoadMode.REFRESH),
            (value, createdAt) ->
                writeTree(key, codec.toTree(value), createdAt, policy.ttl(), policy.staleWindow()))
        .whenComplete(
            (value, error) -> {
              if (error != null) {
                log.warn(
                    "[CacheWrapper] Background refresh failed: key={} cause={}",
                    key,
                    ExceptionUtils.describe(error));
              } else {
                log.debug("[CacheWrapper] Background refresh done: key={}", key);
              }
            });
  }

  // ==================== Store access ====================

  /** 저장소 조회. 읽기 실패는 miss, 손상 항목은 삭제 후 miss. */
  CacheLookup lookup(CacheKey key) {
    String rendered = key.asString();
    return executor.executeOrCatch(
        () ->
            store
                .get(rendered)
                .map(entry -> CacheLookup.classify(entry, clock.millis()))
                .orElse(CacheLookup.MISS),
        e -> {
          if (e instanceof CacheCodecException) {
            discardCorrupted(key, e);
          } else {
            log.warn(
                "[CacheWrapper] Store read failed, treating as miss: key={} cause={}",
                rendered,
                e.getMessage());
          }
          return CacheLookup.MISS;
        },
        TaskContext.of(COMPONENT, "Lookup", rendered));
  }

  <T> Optional<Cached<T>> decode(CacheKey key, CacheEntry entry, JavaType type) {
    String rendered = key.asString();
    return executor.executeOrCatch(
        () -> Optional.of(new Cached<T>(codec.<T>fromTree(rendered, entry.value(), type))),
        e -> {
          discardCorrupted(key, e);
          return Optional.empty();
        },
        TaskContext.of(COMPONENT, "Decode", rendered));
  }

  private <T> Optional<Cached<T>> recheck(CacheKey key, JavaType type, LoadMode mode) {
    CacheLookup lookup = lookup(key);
    if (lookup.state() == CacheLookup.State.FRESH) {
      return decode(key, lookup.entry(), type);
    }
    if (lookup.state() == CacheLookup.State.ERROR_CACHED && mode == LoadMode.FOREGROUND) {
      healthMonitor.recordErrorCacheHit(key.category());
      throw cachedFailure(lookup.entry());
    }
    return Optional.empty();
  }

  /** createdAt 비교 기록. 실패는 로그만 남깁니다. */
  boolean writeTree(
      CacheKey key, JsonNode tree, long createdAt, Duration ttl, Duration staleWindow) {
    String rendered = key.asString();
    return executor.executeOrCatch(
        () -> {
          CacheEntry entry = CacheEntry.of(key, tree, createdAt, ttl, staleWindow);
          boolean written = store.setIfNewer(entry, entry.physicalTtl());
          if (!written) {
            log.debug("[CacheWrapper] Newer entry already stored, write skipped: key={}", rendered);
          }
          return written;
        },
        e -> {
          log.warn("[CacheWrapper] Store write failed: key={} cause={}", rendered, e.getMessage());
          return false;
        },
        TaskContext.of(COMPONENT, "Write", rendered));
  }

  private void writeMarker(
      CacheKey key,
      ErrorKind kind,
      Throwable cause,
      long startedAt,
      CachePolicy policy,
      int attempts) {
    String rendered = key.asString();
    executor.executeOrCatch(
        () -> {
          CacheEntry marker =
              CacheEntry.errorMarker(
                  key,
                  kind,
                  ExceptionUtils.describe(cause),
                  startedAt,
                  policy.markerTtl(kind),
                  attempts);
          return store.setIfNewer(marker, marker.physicalTtl());
        },
        e -> {
          log.warn(
              "[CacheWrapper] Error marker write failed: key={} cause={}", rendered, e.getMessage());
          return false;
        },
        TaskContext.of(COMPONENT, "WriteMarker", rendered));
  }

  void discardCorrupted(CacheKey key, Throwable cause) {
    String rendered = key.asString();
    healthMonitor.recordCorrupted(key.category());
    log.warn("[CacheWrapper] Corrupted entry removed: key={} cause={}", rendered, cause.getMessage());
    executor.executeOrCatch(
        () -> store.delete(rendered),
        e -> {
          log.warn("[CacheWrapper] Corrupted entry delete failed: key={}", rendered);
          return false;
        },
        TaskContext.of(COMPONENT, "DiscardCorrupted", rendered));
  }

  static RuntimeException cachedFailure(CacheEntry marker) {
    if (marker.errorKind() == ErrorKind.NOT_FOUND) {
      return new ResourceNotFoundException(marker.key());
    }
    return new CachedFailureException(
        marker.key(), marker.errorKind(), marker.errorMessage(), marker.retryCount());
  }

  long now() {
    return clock.millis();
  }
}
