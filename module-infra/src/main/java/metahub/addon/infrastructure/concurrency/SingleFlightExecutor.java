package metahub.addon.infrastructure.concurrency;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import metahub.addon.infrastructure.util.ExceptionUtils;

/**
 * 프로세스 내 Single-flight 실행기
 *
 * <p>같은 키에 대한 동시 요청 중 첫 번째(Leader)만 계산을 수행하고, 나머지(Follower)는 Leader의 결과를 공유합니다.
 *
 * <h4>동작</h4>
 *
 * <ul>
 *   <li>{@code putIfAbsent}로 Leader 선출
 *   <li>Leader 완료(성공/실패) 시 in-flight 항목을 먼저 제거한 뒤 결과 전파
 *   <li>Follower는 독립 Future를 받으며 자체 타임아웃 없이 Leader와 같은 결과로 완료
 *   <li>끝나지 않는 계산은 {@link #evictOlderThan(Duration)} 스윕으로 제거하고 대기자 전원에게 같은 실패 전파
 * </ul>
 *
 * <p>분산 환경의 중복 계산은 저장소 TTL과 createdAt 비교 기록으로 수렴하므로 여기서는 다루지 않습니다.
 */
@Slf4j
public class SingleFlightExecutor {

  private final Executor executor;
  private final Clock clock;

  private final ConcurrentHashMap<String, InFlightEntry> inFlight = new ConcurrentHashMap<>();

  private record InFlightEntry(CompletableFuture<Object> promise, long startedAt) {}

  public SingleFlightExecutor(Executor executor, Clock clock) {
    this.executor = executor;
    this.clock = clock;
  }

  /**
   * Leader면 {@code asyncSupplier}를 실행하고, 이미 진행 중이면 그 결과에 합류합니다.
   *
   * @param key 중복 제거 키
   * @param asyncSupplier Leader만 호출하는 비동기 계산
   * @return 계산 결과 (Leader/Follower 모두 같은 값 또는 같은 예외)
   */
  @SuppressWarnings("unchecked")
  public <T> CompletableFuture<T> executeAsync(
      String key, Supplier<CompletableFuture<T>> asyncSupplier) {
    CompletableFuture<Object> promise = new CompletableFuture<>();
    InFlightEntry newEntry = new InFlightEntry(promise, clock.millis());
    InFlightEntry existing = inFlight.putIfAbsent(key, newEntry);

    if (existing == null) {
      return (CompletableFuture<T>) executeAsLeader(key, newEntry, asyncSupplier);
    }
    log.debug("[SingleFlight] Joined in-flight computation: key={}", key);
    // 각 follower에게 독립적인 Future 제공 (공유 promise 보호)
    return (CompletableFuture<T>) existing.promise().copy();
  }

  public boolean isInFlight(String key) {
    return inFlight.containsKey(key);
  }

  public int getInFlightCount() {
    return inFlight.size();
  }

  /**
   * 오래된 in-flight 항목 제거
   *
   * @param maxAge 허용 최대 진행 시간
   * @return 제거된 항목 수
   */
  public int evictOlderThan(Duration maxAge) {
    long threshold = clock.millis() - maxAge.toMillis();
    int evicted = 0;
    for (Map.Entry<String, InFlightEntry> e : inFlight.entrySet()) {
      InFlightEntry entry = e.getValue();
      if (entry.startedAt() <= threshold && inFlight.remove(e.getKey(), entry)) {
        entry
            .promise()
            .completeExceptionally(
                new TimeoutException("single-flight computation abandoned: " + e.getKey()));
        evicted++;
      }
    }
    if (evicted > 0) {
      log.warn("[SingleFlight] Evicted {} abandoned computations (maxAge={})", evicted, maxAge);
    }
    return evicted;
  }

  private <T> CompletableFuture<Object> executeAsLeader(
      String key, InFlightEntry entry, Supplier<CompletableFuture<T>> asyncSupplier) {
    CompletableFuture<Object> promise = entry.promise();

    CompletableFuture.supplyAsync(asyncSupplier::get, executor)
        .thenCompose(future -> future)
        .whenComplete(
            (result, error) -> {
              inFlight.remove(key, entry);
              if (error != null) {
                Throwable cause = ExceptionUtils.unwrapAsyncException(error);
                log.debug("[SingleFlight] Leader failed: key={} cause={}", key, cause.toString());
                promise.completeExceptionally(cause);
              } else {
                promise.complete(result);
              }
            });

    return promise.copy();
  }
}
