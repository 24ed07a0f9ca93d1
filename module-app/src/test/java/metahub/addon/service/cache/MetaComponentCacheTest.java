package metahub.addon.service.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import metahub.addon.core.domain.cache.CacheCategory;
import metahub.addon.core.domain.cache.CacheEntry;
import metahub.addon.core.domain.cache.CacheKey;
import metahub.addon.core.domain.cache.CachePolicy;
import metahub.addon.core.domain.meta.MetaComponentType;
import metahub.addon.error.exception.CachedFailureException;
import metahub.addon.error.exception.UpstreamException;
import metahub.addon.service.health.CategoryHealth;
import metahub.addon.support.CacheTestFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class MetaComponentCacheTest {

  private static final Duration WAIT = Duration.ofSeconds(3);
  private static final CacheKey PARENT =
      CacheKey.global("v1.0", CacheCategory.META, "series", "tt0903747");
  private static final Set<MetaComponentType> CORE_CAST_ARTWORK =
      EnumSet.of(MetaComponentType.CORE, MetaComponentType.CAST, MetaComponentType.ARTWORK);

  private final ObjectMapper mapper = new ObjectMapper();
  private CacheTestFixture fixture;
  private MetaComponentCache componentCache;
  private AtomicInteger computeCount;

  @BeforeEach
  void setUp() {
    fixture = new CacheTestFixture();
    componentCache = fixture.componentCache;
    computeCount = new AtomicInteger();
  }

  @AfterEach
  void tearDown() {
    fixture.close();
  }

  private ObjectNode meta() throws Exception {
    return (ObjectNode)
        mapper.readTree(
            """
            {
              "id": "tt0903747",
              "type": "series",
              "name": "Breaking Bad",
              "description": "A chemistry instructor turns to crime.",
              "cast": ["Bryan Cranston", "Aaron Paul"],
              "director": ["Vince Gilligan"],
              "poster": "https://images.example/poster.jpg",
              "background": "https://images.example/background.jpg",
              "videos": [{"id": "tt0903747:1:1", "season": 1, "episode": 1}],
              "links": [{"name": "Drama", "category": "Genres"}]
            }
            """);
  }

  private Supplier<CompletableFuture<JsonNode>> computing(ObjectNode value) {
    return () -> {
      computeCount.incrementAndGet();
      return CompletableFuture.completedFuture(value.deepCopy());
    };
  }

  private static CachePolicy policy() {
    return CachePolicy.builder()
        .ttl(Duration.ofDays(7))
        .errorCaching(true)
        .maxRetries(0)
        .retryDelay(Duration.ZERO)
        .build();
  }

  private CategoryHealth health() {
    return fixture.healthMonitor.snapshot().of(CacheCategory.META);
  }

  @Nested
  @DisplayName("분해와 조립")
  class ReconstructTest {

    @Test
    @DisplayName("분해 직후 조립하면 모든 필드가 원본과 같음")
    void roundTrip() throws Exception {
      ObjectNode meta = meta();

      int written = componentCache.store(PARENT, meta, fixture.clock.millis());
      Optional<ObjectNode> rebuilt =
          componentCache.reconstruct(PARENT, MetaComponentCache.ALL_COMPONENTS);

      assertThat(written).isEqualTo(MetaComponentType.values().length);
      assertThat(rebuilt).contains(meta);
      assertThat(health().hits()).isEqualTo(1);
    }

    @Test
    @DisplayName("요청한 컴포넌트의 필드만 조립")
    void onlyRequiredComponents() throws Exception {
      componentCache.store(PARENT, meta(), fixture.clock.millis());

      ObjectNode rebuilt =
          componentCache.reconstruct(PARENT, EnumSet.of(MetaComponentType.CORE)).orElseThrow();

      assertThat(rebuilt.has("name")).isTrue();
      assertThat(rebuilt.has("cast")).isFalse();
      assertThat(rebuilt.has("poster")).isFalse();
    }

    @Test
    @DisplayName("artwork만 만료되면 core/cast가 fresh여도 재조립하지 않고 값 없음")
    void expiredArtworkYieldsNone() throws Exception {
      long now = fixture.clock.millis();
      componentCache.store(PARENT, meta(), now);
      CacheKey artworkKey = MetaComponentCache.componentKey(PARENT, MetaComponentType.ARTWORK);
      JsonNode artwork = fixture.store.get(artworkKey.asString()).orElseThrow().value();
      fixture.store.set(
          CacheEntry.of(
              artworkKey,
              artwork,
              now - Duration.ofDays(8).toMillis(),
              Duration.ofDays(7),
              Duration.ZERO),
          Duration.ofDays(1));

      Optional<ObjectNode> rebuilt = componentCache.reconstruct(PARENT, CORE_CAST_ARTWORK);

      assertThat(rebuilt).isEmpty();
      assertThat(health().partialHits()).isEqualTo(1);
      assertThat(health().hits()).isZero();
    }

    @Test
    @DisplayName("컴포넌트가 하나도 없으면 miss")
    void nothingStoredIsMiss() {
      assertThat(componentCache.reconstruct(PARENT, CORE_CAST_ARTWORK)).isEmpty();
      assertThat(health().misses()).isEqualTo(1);
    }

    @Test
    @DisplayName("컴포넌트 키는 부모 키 아래 component 세그먼트")
    void componentKeyLayout() {
      assertThat(MetaComponentCache.componentKey(PARENT, MetaComponentType.CAST).asString())
          .isEqualTo("global:v1.0:meta:series:tt0903747:component:cast");
    }

    @Test
    @DisplayName("JSON 객체가 아닌 값은 분해할 수 없음")
    void nonObjectRejected() {
      assertThatThrownBy(() -> componentCache.decompose(List.of("a", "b")))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Nested
  @DisplayName("wrapComposite")
  class WrapCompositeTest {

    @Test
    @DisplayName("첫 호출은 계산 후 컴포넌트로 저장하고 두 번째 호출은 조립으로 응답")
    void computesOnceThenReconstructs() throws Exception {
      ObjectNode meta = meta();

      JsonNode first =
          componentCache
              .wrapComposite(
                  PARENT, CORE_CAST_ARTWORK, JsonNode.class, computing(meta), policy())
              .get(3, TimeUnit.SECONDS);
      JsonNode second =
          componentCache
              .wrapComposite(
                  PARENT, CORE_CAST_ARTWORK, JsonNode.class, computing(meta), policy())
              .get(3, TimeUnit.SECONDS);

      assertThat(first).isEqualTo(meta);
      assertThat(second.get("name").asText()).isEqualTo("Breaking Bad");
      assertThat(second.get("poster").asText()).isEqualTo("https://images.example/poster.jpg");
      assertThat(computeCount).hasValue(1);
      assertThat(fixture.store.exists(PARENT.asString())).isFalse();
      assertThat(health().misses()).isEqualTo(1);
      assertThat(health().hits()).isEqualTo(1);
    }

    @Test
    @DisplayName("컴포넌트 하나가 만료되면 전체를 다시 계산")
    void expiredComponentForcesRecompute() throws Exception {
      ObjectNode meta = meta();
      componentCache
          .wrapComposite(PARENT, CORE_CAST_ARTWORK, JsonNode.class, computing(meta), policy())
          .get(3, TimeUnit.SECONDS);

      fixture.clock.advance(Duration.ofDays(1).plusSeconds(1));
      componentCache
          .wrapComposite(PARENT, CORE_CAST_ARTWORK, JsonNode.class, computing(meta), policy())
          .get(3, TimeUnit.SECONDS);

      assertThat(computeCount).hasValue(2);
      assertThat(health().partialHits()).isEqualTo(1);
    }

    @Test
    @DisplayName("요청 타입으로 조립 결과를 변환")
    void decodesIntoRequestedType() throws Exception {
      componentCache.store(PARENT, meta(), fixture.clock.millis());

      SeriesView view =
          componentCache
              .wrapComposite(
                  PARENT,
                  EnumSet.of(MetaComponentType.CORE, MetaComponentType.CAST),
                  SeriesView.class,
                  () -> CompletableFuture.failedFuture(new AssertionError("not expected")),
                  policy())
              .get(3, TimeUnit.SECONDS);

      assertThat(view.name()).isEqualTo("Breaking Bad");
      assertThat(view.cast()).containsExactly("Bryan Cranston", "Aaron Paul");
    }

    @Test
    @DisplayName("계산 실패는 부모 키의 에러 마커로 남고 다음 호출은 계산 없이 실패")
    void failureCachedOnParentKey() {
      Supplier<CompletableFuture<JsonNode>> failing =
          () -> {
            computeCount.incrementAndGet();
            return CompletableFuture.failedFuture(new UpstreamException("tvdb"));
          };

      assertThat(
              componentCache.wrapComposite(
                  PARENT, CORE_CAST_ARTWORK, JsonNode.class, failing, policy()))
          .failsWithin(WAIT)
          .withThrowableOfType(ExecutionException.class)
          .withCauseInstanceOf(UpstreamException.class);
      assertThat(
              componentCache.wrapComposite(
                  PARENT, CORE_CAST_ARTWORK, JsonNode.class, failing, policy()))
          .failsWithin(WAIT)
          .withThrowableOfType(ExecutionException.class)
          .withCauseInstanceOf(CachedFailureException.class);

      assertThat(computeCount).hasValue(1);
      assertThat(health().errors()).isEqualTo(1);
      assertThat(health().errorCacheHits()).isEqualTo(1);
    }

    @Test
    @DisplayName("에러 마커 만료 후 성공하면 마커가 제거되고 컴포넌트가 저장됨")
    void successClearsParentMarker() throws Exception {
      Supplier<CompletableFuture<JsonNode>> failing =
          () -> CompletableFuture.failedFuture(new UpstreamException("tvdb"));
      assertThat(
              componentCache.wrapComposite(
                  PARENT, CORE_CAST_ARTWORK, JsonNode.class, failing, policy()))
          .failsWithin(WAIT);
      fixture.clock.advance(CachePolicy.DEFAULT_ERROR_TTL.plusSeconds(1));

      componentCache
          .wrapComposite(PARENT, CORE_CAST_ARTWORK, JsonNode.class, computing(meta()), policy())
          .get(3, TimeUnit.SECONDS);

      assertThat(fixture.store.exists(PARENT.asString())).isFalse();
      assertThat(componentCache.reconstruct(PARENT, CORE_CAST_ARTWORK)).isPresent();
    }
  }

  record SeriesView(String id, String name, List<String> cast, Map<String, Object> extra) {}
}
