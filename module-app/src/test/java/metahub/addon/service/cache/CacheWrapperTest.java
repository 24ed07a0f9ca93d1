package metahub.addon.service.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.awaitility.Awaitility.await;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.node.TextNode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import metahub.addon.core.domain.cache.CacheCategory;
import metahub.addon.core.domain.cache.CacheEntry;
import metahub.addon.core.domain.cache.CacheKey;
import metahub.addon.core.domain.cache.CachePolicy;
import metahub.addon.core.domain.cache.ErrorKind;
import metahub.addon.error.exception.CachedFailureException;
import metahub.addon.error.exception.InvalidCacheValueException;
import metahub.addon.error.exception.ResourceNotFoundException;
import metahub.addon.error.exception.UpstreamException;
import metahub.addon.service.health.CategoryHealth;
import metahub.addon.support.CacheTestFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/**
 * CacheWrapper 단위 테스트
 *
 * <p>인메모리 저장소와 실제 Single-flight 위에서 조회 흐름, TTL 경계, 에러 캐싱을 검증합니다.
 */
@Tag("unit")
class CacheWrapperTest {

  private static final Duration WAIT = Duration.ofSeconds(3);
  private static final Duration TTL = Duration.ofHours(1);
  private static final Duration STALE = Duration.ofMinutes(10);

  private CacheTestFixture fixture;
  private CacheWrapper wrapper;
  private AtomicInteger computeCount;

  @BeforeEach
  void setUp() {
    fixture = new CacheTestFixture();
    wrapper = fixture.wrapper;
    computeCount = new AtomicInteger();
  }

  @AfterEach
  void tearDown() {
    fixture.close();
  }

  private static CacheKey key(String id) {
    return CacheKey.global("v1.0", CacheCategory.META, "movie", id);
  }

  private static CachePolicy policy() {
    return CachePolicy.builder()
        .ttl(TTL)
        .staleWindow(STALE)
        .errorCaching(true)
        .maxRetries(2)
        .retryDelay(Duration.ZERO)
        .build();
  }

  private Supplier<CompletableFuture<String>> counting(String prefix) {
    return () -> CompletableFuture.completedFuture(prefix + computeCount.incrementAndGet());
  }

  private Supplier<CompletableFuture<String>> failing(RuntimeException error) {
    return () -> {
      computeCount.incrementAndGet();
      return CompletableFuture.failedFuture(error);
    };
  }

  private String get(CacheKey key, Supplier<CompletableFuture<String>> compute, CachePolicy policy)
      throws Exception {
    return wrapper.wrap(key, String.class, compute, policy).get(WAIT.toSeconds(), TimeUnit.SECONDS);
  }

  private static void awaitQuietly(CountDownLatch latch) {
    try {
      latch.await(WAIT.toSeconds(), TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(e);
    }
  }

  private CategoryHealth meta() {
    return fixture.healthMonitor.snapshot().of(CacheCategory.META);
  }

  @Nested
  @DisplayName("Single-flight")
  class SingleFlightTest {

    @Test
    @DisplayName("캐시가 빈 키에 대한 동시 호출 N개는 계산 1회를 공유하고 같은 결과를 받음")
    void concurrentCallsComputeOnce() throws Exception {
      CompletableFuture<String> gate = new CompletableFuture<>();
      Supplier<CompletableFuture<String>> compute =
          () -> {
            computeCount.incrementAndGet();
            return gate;
          };

      List<CompletableFuture<String>> results = new ArrayList<>();
      for (int i = 0; i < 8; i++) {
        results.add(wrapper.wrap(key("tt1"), String.class, compute, policy()));
      }
      gate.complete("shared");

      for (CompletableFuture<String> result : results) {
        assertThat(result.get(WAIT.toSeconds(), TimeUnit.SECONDS)).isEqualTo("shared");
      }
      assertThat(computeCount).hasValue(1);
      assertThat(fixture.singleFlight.getInFlightCount()).isZero();
    }

    @Test
    @DisplayName("provider 목록은 TTL 안의 두 번째 호출에서 계산 없이 같은 5개 항목으로 반환")
    void providerListServedFromCache() throws Exception {
      CacheKey key = CacheKey.global("v1.0", CacheCategory.PROVIDER, "anime-genres");
      CachePolicy policy = CachePolicy.ofTtl(Duration.ofSeconds(3600));
      TypeReference<List<String>> type = new TypeReference<>() {};
      Supplier<CompletableFuture<List<String>>> compute =
          () -> {
            computeCount.incrementAndGet();
            return CompletableFuture.completedFuture(
                List.of("Action", "Comedy", "Drama", "Fantasy", "Romance"));
          };

      List<String> first = wrapper.wrap(key, type, compute, policy).get(3, TimeUnit.SECONDS);
      fixture.clock.advance(Duration.ofSeconds(1800));
      List<String> second = wrapper.wrap(key, type, compute, policy).get(3, TimeUnit.SECONDS);

      assertThat(key.asString()).isEqualTo("global:v1.0:provider:anime-genres");
      assertThat(computeCount).hasValue(1);
      assertThat(second).hasSize(5).isEqualTo(first);
    }

    @Test
    @DisplayName("Leader가 일시 장애 후 재시도로 성공하면 합류한 호출도 같은 값을 받음")
    void followerReceivesValueAfterLeaderRetry() throws Exception {
      CachePolicy policy = policy().toBuilder().retryDelay(Duration.ofMillis(100)).build();
      CountDownLatch followerJoined = new CountDownLatch(1);
      Supplier<CompletableFuture<String>> compute =
          () -> {
            if (computeCount.incrementAndGet() == 1) {
              return CompletableFuture.supplyAsync(
                  () -> {
                    awaitQuietly(followerJoined);
                    throw new UpstreamException("tmdb");
                  },
                  CompletableFuture.delayedExecutor(200, TimeUnit.MILLISECONDS));
            }
            return CompletableFuture.completedFuture("value");
          };

      CompletableFuture<String> leader = wrapper.wrap(key("tt1"), String.class, compute, policy);
      CompletableFuture<String> follower = wrapper.wrap(key("tt1"), String.class, compute, policy);
      followerJoined.countDown();

      assertThat(leader.get(WAIT.toSeconds(), TimeUnit.SECONDS)).isEqualTo("value");
      assertThat(follower.get(WAIT.toSeconds(), TimeUnit.SECONDS)).isEqualTo("value");
      assertThat(computeCount).hasValue(2);
    }
  }

  @Nested
  @DisplayName("TTL 경계")
  class TtlBoundaryTest {

    @Test
    @DisplayName("ttl - 1초 시점의 값은 fresh로 반환되고 백그라운드 갱신도 없음")
    void justBeforeTtlIsFresh() throws Exception {
      assertThat(get(key("tt1"), counting("v"), policy())).isEqualTo("v1");

      fixture.clock.advance(TTL.minusSeconds(1));
      assertThat(get(key("tt1"), counting("v"), policy())).isEqualTo("v1");

      assertThat(computeCount).hasValue(1);
      assertThat(meta().staleHits()).isZero();
      assertThat(fixture.singleFlight.getInFlightCount()).isZero();
    }

    @Test
    @DisplayName("ttl + staleWindow + 1초 시점에는 동기 재계산")
    void afterStaleWindowRecomputes() throws Exception {
      assertThat(get(key("tt1"), counting("v"), policy())).isEqualTo("v1");

      fixture.clock.advance(TTL.plus(STALE).plusSeconds(1));

      assertThat(get(key("tt1"), counting("v"), policy())).isEqualTo("v2");
      assertThat(computeCount).hasValue(2);
    }

    @Test
    @DisplayName("stale 구간에서는 이전 값을 즉시 반환하고 백그라운드에서 한 번 갱신")
    void staleServedAndRefreshed() throws Exception {
      assertThat(get(key("tt1"), counting("v"), policy())).isEqualTo("v1");
      fixture.clock.advance(TTL.plusMinutes(1));

      assertThat(get(key("tt1"), counting("v"), policy())).isEqualTo("v1");

      await()
          .atMost(WAIT)
          .untilAsserted(
              () -> {
                assertThat(computeCount).hasValue(2);
                assertThat(fixture.singleFlight.getInFlightCount()).isZero();
              });
      assertThat(get(key("tt1"), counting("v"), policy())).isEqualTo("v2");
      assertThat(meta().staleHits()).isEqualTo(1);
      assertThat(computeCount).hasValue(2);
    }

    @Test
    @DisplayName("백그라운드 갱신이 계속 실패해도 마커 TTL 동안 계산은 최대 maxRetries + 1회")
    void failedRefreshBacksOff() throws Exception {
      assertThat(get(key("tt1"), counting("v"), policy())).isEqualTo("v1");
      fixture.clock.advance(TTL.plusMinutes(1));
      computeCount.set(0);
      Supplier<CompletableFuture<String>> compute = failing(new UpstreamException("tmdb"));

      for (int i = 0; i < 5; i++) {
        assertThat(get(key("tt1"), compute, policy())).isEqualTo("v1");
      }
      await()
          .atMost(WAIT)
          .untilAsserted(
              () -> {
                assertThat(computeCount).hasValue(3);
                assertThat(fixture.singleFlight.getInFlightCount()).isZero();
              });
      for (int i = 0; i < 5; i++) {
        assertThat(get(key("tt1"), compute, policy())).isEqualTo("v1");
      }

      await()
          .during(Duration.ofMillis(300))
          .atMost(WAIT)
          .untilAsserted(() -> assertThat(computeCount).hasValue(3));
      assertThat(fixture.store.get(key("tt1").asString()).orElseThrow().errorMarker())
          .isFalse();
    }

    @Test
    @DisplayName("갱신 실패 후 마커 TTL이 지나면 stale 구간 안에서 다시 갱신을 시도")
    void refreshResumesAfterBackoff() throws Exception {
      get(key("tt1"), counting("v"), policy());
      fixture.clock.advance(TTL.plusMinutes(1));
      computeCount.set(0);
      Supplier<CompletableFuture<String>> compute = failing(new UpstreamException("tmdb"));
      assertThat(get(key("tt1"), compute, policy())).isEqualTo("v1");
      await()
          .atMost(WAIT)
          .untilAsserted(
              () -> {
                assertThat(computeCount).hasValue(3);
                assertThat(fixture.singleFlight.getInFlightCount()).isZero();
              });

      fixture.clock.advance(CachePolicy.DEFAULT_ERROR_TTL.plusSeconds(1));
      assertThat(get(key("tt1"), counting("v"), policy())).isEqualTo("v1");

      await()
          .atMost(WAIT)
          .untilAsserted(() -> assertThat(get(key("tt1"), counting("v"), policy())).isEqualTo("v4"));
    }

    @Test
    @DisplayName("staleWindow가 0이면 ttl 직후 바로 재계산")
    void noStaleWindowRecomputesAtTtl() throws Exception {
      CachePolicy policy = CachePolicy.ofTtl(TTL);
      get(key("tt1"), counting("v"), policy);

      fixture.clock.advance(TTL);

      assertThat(get(key("tt1"), counting("v"), policy)).isEqualTo("v2");
      assertThat(meta().staleHits()).isZero();
    }
  }

  @Nested
  @DisplayName("에러 캐싱")
  class ErrorCachingTest {

    @Test
    @DisplayName("항상 실패하는 계산은 에러 TTL 안에서 최대 maxRetries + 1회만 호출됨")
    void transientFailureBoundedByRetries() {
      Supplier<CompletableFuture<String>> compute = failing(new UpstreamException("tmdb"));

      CompletableFuture<String> first = wrapper.wrap(key("tt1"), String.class, compute, policy());
      assertThat(first)
          .failsWithin(WAIT)
          .withThrowableOfType(ExecutionException.class)
          .withCauseInstanceOf(UpstreamException.class);

      for (int i = 0; i < 3; i++) {
        fixture.clock.advance(Duration.ofSeconds(30));
        assertThat(wrapper.wrap(key("tt1"), String.class, compute, policy()))
            .failsWithin(WAIT)
            .withThrowableOfType(ExecutionException.class)
            .withCauseInstanceOf(CachedFailureException.class);
      }

      assertThat(computeCount).hasValue(3);
      assertThat(meta().errors()).isEqualTo(1);
      assertThat(meta().errorCacheHits()).isEqualTo(3);
    }

    @Test
    @DisplayName("에러 마커가 만료되면 다시 계산을 시도")
    void markerExpiryAllowsRetry() throws Exception {
      Supplier<CompletableFuture<String>> compute = failing(new UpstreamException("tmdb"));
      assertThat(wrapper.wrap(key("tt1"), String.class, compute, policy())).failsWithin(WAIT);

      fixture.clock.advance(CachePolicy.DEFAULT_ERROR_TTL.plusSeconds(1));

      assertThat(get(key("tt1"), counting("ok"), policy())).isEqualTo("ok4");
    }

    @Test
    @DisplayName("캐시된 실패는 원래 종류를 담은 CachedFailureException")
    void cachedFailureCarriesKind() {
      wrapper.wrap(key("tt1"), String.class, failing(new UpstreamException("tmdb")), policy());
      await().atMost(WAIT).until(() -> fixture.store.exists(key("tt1").asString()));

      Throwable thrown =
          catchThrowable(
              () ->
                  wrapper
                      .wrap(key("tt1"), String.class, counting("x"), policy())
                      .get(WAIT.toSeconds(), TimeUnit.SECONDS));

      assertThat(thrown).isInstanceOf(ExecutionException.class);
      assertThat(thrown.getCause())
          .isInstanceOfSatisfying(
              CachedFailureException.class,
              e -> {
                assertThat(e.getKind()).isEqualTo(ErrorKind.TRANSIENT);
                assertThat(e.getRetryCount()).isEqualTo(3);
              });
    }

    @Test
    @DisplayName("Rate Limit은 재시도 없이 긴 TTL의 마커로 기록")
    void rateLimitedNotRetried() throws Exception {
      Supplier<CompletableFuture<String>> compute = failing(UpstreamException.rateLimited("tmdb"));
      assertThat(wrapper.wrap(key("tt1"), String.class, compute, policy())).failsWithin(WAIT);

      fixture.clock.advance(CachePolicy.DEFAULT_ERROR_TTL.plusSeconds(1));
      assertThat(wrapper.wrap(key("tt1"), String.class, compute, policy()))
          .failsWithin(WAIT)
          .withThrowableOfType(ExecutionException.class)
          .withCauseInstanceOf(CachedFailureException.class);

      assertThat(computeCount).hasValue(1);
      CacheEntry marker = fixture.store.get(key("tt1").asString()).orElseThrow();
      assertThat(marker.errorKind()).isEqualTo(ErrorKind.RATE_LIMITED);
      assertThat(marker.ttlMillis()).isEqualTo(CachePolicy.DEFAULT_RATE_LIMITED_TTL.toMillis());
    }

    @Test
    @DisplayName("Not-Found는 재시도 없이 negative 캐시되고 ResourceNotFoundException으로 반환")
    void notFoundNegativeCached() {
      Supplier<CompletableFuture<String>> compute =
          failing(new ResourceNotFoundException("movie tt404"));

      assertThat(wrapper.wrap(key("tt404"), String.class, compute, policy()))
          .failsWithin(WAIT)
          .withThrowableOfType(ExecutionException.class)
          .withCauseInstanceOf(ResourceNotFoundException.class);
      fixture.clock.advance(Duration.ofMinutes(20));
      assertThat(wrapper.wrap(key("tt404"), String.class, compute, policy()))
          .failsWithin(WAIT)
          .withThrowableOfType(ExecutionException.class)
          .withCauseInstanceOf(ResourceNotFoundException.class);

      assertThat(computeCount).hasValue(1);
    }

    @Test
    @DisplayName("errorCaching이 꺼져 있으면 마커를 남기지 않고 매번 계산")
    void errorCachingDisabled() {
      CachePolicy policy = policy().toBuilder().errorCaching(false).maxRetries(0).build();
      Supplier<CompletableFuture<String>> compute = failing(new UpstreamException("tmdb"));

      assertThat(wrapper.wrap(key("tt1"), String.class, compute, policy)).failsWithin(WAIT);
      assertThat(wrapper.wrap(key("tt1"), String.class, compute, policy)).failsWithin(WAIT);

      assertThat(computeCount).hasValue(2);
      assertThat(fixture.store.exists(key("tt1").asString())).isFalse();
    }

    @Test
    @DisplayName("내부 계산 오류는 재시도/캐싱 없이 즉시 전파")
    void internalErrorNeverCached() {
      Supplier<CompletableFuture<String>> compute =
          () -> {
            computeCount.incrementAndGet();
            throw new IllegalStateException("bug in compute");
          };

      assertThat(wrapper.wrap(key("tt1"), String.class, compute, policy()))
          .failsWithin(WAIT)
          .withThrowableOfType(ExecutionException.class)
          .withCauseInstanceOf(IllegalStateException.class);
      assertThat(wrapper.wrap(key("tt1"), String.class, compute, policy())).failsWithin(WAIT);

      assertThat(computeCount).hasValue(2);
      assertThat(fixture.store.exists(key("tt1").asString())).isFalse();
      assertThat(meta().errors()).isEqualTo(2);
    }

    @Test
    @DisplayName("일시 장애 후 재시도에서 성공하면 값이 캐시됨")
    void retrySucceeds() throws Exception {
      Supplier<CompletableFuture<String>> compute =
          () ->
              computeCount.incrementAndGet() < 2
                  ? CompletableFuture.failedFuture(new UpstreamException("tvdb"))
                  : CompletableFuture.completedFuture("recovered");

      assertThat(get(key("tt1"), compute, policy())).isEqualTo("recovered");
      assertThat(get(key("tt1"), compute, policy())).isEqualTo("recovered");
      assertThat(computeCount).hasValue(2);
    }
  }

  @Nested
  @DisplayName("저장 규칙")
  class StoragePolicyTest {

    @Test
    @DisplayName("빈 결과는 cacheEmpty가 꺼져 있으면 저장하지 않음")
    void emptyResultNotCached() throws Exception {
      TypeReference<List<String>> type = new TypeReference<>() {};
      Supplier<CompletableFuture<List<String>>> compute =
          () -> {
            computeCount.incrementAndGet();
            return CompletableFuture.completedFuture(List.of());
          };

      wrapper.wrap(key("empty"), type, compute, policy()).get(3, TimeUnit.SECONDS);
      wrapper.wrap(key("empty"), type, compute, policy()).get(3, TimeUnit.SECONDS);

      assertThat(computeCount).hasValue(2);
    }

    @Test
    @DisplayName("cacheEmpty가 켜져 있으면 빈 결과도 저장")
    void emptyResultCachedWhenAllowed() throws Exception {
      CachePolicy policy = policy().toBuilder().cacheEmpty(true).build();
      TypeReference<List<String>> type = new TypeReference<>() {};
      Supplier<CompletableFuture<List<String>>> compute =
          () -> {
            computeCount.incrementAndGet();
            return CompletableFuture.completedFuture(List.of());
          };

      wrapper.wrap(key("empty"), type, compute, policy).get(3, TimeUnit.SECONDS);
      List<String> second = wrapper.wrap(key("empty"), type, compute, policy).get(3, TimeUnit.SECONDS);

      assertThat(second).isEmpty();
      assertThat(computeCount).hasValue(1);
    }

    @Test
    @DisplayName("validator가 거부한 값은 InvalidCacheValueException이며 저장되지 않음")
    void rejectedValueNotCached() {
      CachePolicy policy = policy().toBuilder().validator(v -> !"bad".equals(v)).build();
      Supplier<CompletableFuture<String>> compute =
          () -> {
            computeCount.incrementAndGet();
            return CompletableFuture.completedFuture("bad");
          };

      assertThat(wrapper.wrap(key("tt1"), String.class, compute, policy))
          .failsWithin(WAIT)
          .withThrowableOfType(ExecutionException.class)
          .withCauseInstanceOf(InvalidCacheValueException.class);
      assertThat(fixture.store.exists(key("tt1").asString())).isFalse();
    }

    @Test
    @DisplayName("손상된 항목은 삭제 후 miss로 처리되고 corrupted로 집계")
    void corruptedEntryHealed() throws Exception {
      CacheKey key = key("tt1");
      fixture.store.set(
          CacheEntry.of(key, TextNode.valueOf("not-a-number"), fixture.clock.millis(), TTL, STALE),
          TTL);
      Supplier<CompletableFuture<Integer>> compute =
          () -> {
            computeCount.incrementAndGet();
            return CompletableFuture.completedFuture(42);
          };

      Integer value = wrapper.wrap(key, Integer.class, compute, policy()).get(3, TimeUnit.SECONDS);

      assertThat(value).isEqualTo(42);
      assertThat(computeCount).hasValue(1);
      assertThat(meta().corrupted()).isEqualTo(1);
      assertThat(wrapper.wrap(key, Integer.class, compute, policy()).get(3, TimeUnit.SECONDS))
          .isEqualTo(42);
      assertThat(computeCount).hasValue(1);
    }

    @Test
    @DisplayName("더 최신 createdAt의 항목은 오래된 계산 결과로 덮어쓰지 않음")
    void olderWriteDoesNotOverwrite() {
      CacheKey key = key("tt1");
      long now = fixture.clock.millis();

      assertThat(wrapper.writeTree(key, TextNode.valueOf("new"), now, TTL, STALE)).isTrue();
      assertThat(wrapper.writeTree(key, TextNode.valueOf("old"), now - 1000, TTL, STALE)).isFalse();

      assertThat(fixture.store.get(key.asString()).orElseThrow().value().asText()).isEqualTo("new");
    }
  }

  @Nested
  @DisplayName("헬스 집계")
  class HealthRecordingTest {

    @Test
    @DisplayName("miss 후 hit이 카테고리별로 집계됨")
    void missThenHit() throws Exception {
      get(key("tt1"), counting("v"), policy());
      get(key("tt1"), counting("v"), policy());

      assertThat(meta().misses()).isEqualTo(1);
      assertThat(meta().hits()).isEqualTo(1);
      assertThat(fixture.healthMonitor.snapshot().of(CacheCategory.CATALOG).requests()).isZero();
    }

    @Test
    @DisplayName("isFresh는 헬스 카운터에 영향을 주지 않음")
    void isFreshDoesNotCount() throws Exception {
      get(key("tt1"), counting("v"), policy());

      assertThat(wrapper.isFresh(key("tt1"))).isTrue();
      assertThat(wrapper.isFresh(key("tt2"))).isFalse();
      assertThat(meta().requests()).isEqualTo(1);
    }
  }
}
