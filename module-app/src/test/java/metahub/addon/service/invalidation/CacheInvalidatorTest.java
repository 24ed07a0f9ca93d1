package metahub.addon.service.invalidation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.TextNode;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import metahub.addon.config.CacheProperties;
import metahub.addon.core.domain.cache.CacheCategory;
import metahub.addon.core.domain.cache.CacheEntry;
import metahub.addon.core.domain.cache.CacheKey;
import metahub.addon.core.domain.config.MalSettings;
import metahub.addon.core.domain.config.UserConfig;
import metahub.addon.infrastructure.cache.store.CaffeineCacheStore;
import metahub.addon.service.cache.CachePolicies;
import metahub.addon.support.TestLogicExecutors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class CacheInvalidatorTest {

  private CaffeineCacheStore store;
  private CacheInvalidator invalidator;

  @BeforeEach
  void setUp() {
    store = new CaffeineCacheStore(1_000);
    CachePolicies policies = new CachePolicies(new CacheProperties());
    invalidator =
        new CacheInvalidator(store, new InvalidationPlanner(policies), TestLogicExecutors.real());
  }

  private void put(CacheKey key) {
    store.set(
        CacheEntry.of(key, TextNode.valueOf("v"), 0L, Duration.ofHours(1), Duration.ZERO),
        Duration.ofHours(1));
  }

  @Test
  @DisplayName("패턴에 맞는 키만 삭제하고 삭제 건수 반환")
  void deletesMatchingKeys() {
    put(CacheKey.of("u1", "v1.0", CacheCategory.META, "movie", "tt1"));
    put(CacheKey.of("u1", "v1.0", CacheCategory.META, "movie", "tt2"));
    put(CacheKey.of("u1", "v1.0", CacheCategory.CATALOG, "tmdb.top", "movie"));
    put(CacheKey.of("u2", "v1.0", CacheCategory.META, "movie", "tt1"));

    long deleted = invalidator.invalidate("u1:v1.0:meta:*");

    assertThat(deleted).isEqualTo(2);
    assertThat(store.keysMatching("*")).hasSize(2);
  }

  @Test
  @DisplayName("일치하는 키가 없으면 0")
  void nothingMatches() {
    assertThat(invalidator.invalidate("nobody:*")).isZero();
  }

  @Test
  @DisplayName("빈 패턴은 IllegalArgumentException")
  void blankPatternRejected() {
    assertThatThrownBy(() -> invalidator.invalidate(" "))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("설정 변경 시 계획된 패턴을 모두 실행하고 총 삭제 건수 반환")
  void configChangeRunsPlan() {
    CacheKey artwork =
        CacheKey.of("u1", "v1.0", CacheCategory.META, "series", "tt1").child("component", "artwork");
    CacheKey cast =
        CacheKey.of("u1", "v1.0", CacheCategory.META, "series", "tt1").child("component", "cast");
    put(artwork);
    put(cast);
    UserConfig before = config(false);
    UserConfig after = config(true);

    long deleted = invalidator.invalidateForConfigChange("u1", before, after);

    assertThat(deleted).isEqualTo(1);
    assertThat(store.exists(artwork.asString())).isFalse();
    assertThat(store.exists(cast.asString())).isTrue();
  }

  private static UserConfig config(boolean blurThumbs) {
    return new UserConfig(
        "u1",
        "en-US",
        Map.of(),
        Map.of(),
        Map.of(),
        List.of(),
        false,
        false,
        null,
        null,
        null,
        blurThumbs,
        Map.of(),
        MalSettings.disabled(),
        false);
  }
}
