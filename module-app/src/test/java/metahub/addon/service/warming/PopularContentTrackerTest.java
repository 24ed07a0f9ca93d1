package metahub.addon.service.warming;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import metahub.addon.config.CacheProperties;
import metahub.addon.service.warming.PopularContentTracker.ContentRef;
import metahub.addon.support.TestLogicExecutors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class PopularContentTrackerTest {

  private SimpleMeterRegistry meterRegistry;
  private PopularContentTracker tracker;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    tracker =
        new PopularContentTracker(new CacheProperties(), TestLogicExecutors.real(), meterRegistry);
  }

  @Test
  @DisplayName("호출 횟수 내림차순으로 상위 N개 반환")
  void topNByAccessCount() {
    for (int i = 0; i < 3; i++) {
      tracker.recordAccess("tt0903747", "series");
    }
    tracker.recordAccess("mal:1535", "anime");
    tracker.recordAccess("mal:1535", "anime");
    tracker.recordAccess("tt0111161", "movie");

    assertThat(tracker.topN(2))
        .containsExactly(
            new ContentRef("tt0903747", "series"), new ContentRef("mal:1535", "anime"));
    assertThat(tracker.accessCount("tt0111161", "movie")).isEqualTo(1);
    assertThat(meterRegistry.get("cache.popular.record").counter().count()).isEqualTo(6.0);
  }

  @Test
  @DisplayName("같은 id라도 타입이 다르면 별도로 집계")
  void typeIsPartOfIdentity() {
    tracker.recordAccess("tt1", "movie");
    tracker.recordAccess("tt1", "series");

    assertThat(tracker.accessCount("tt1", "movie")).isEqualTo(1);
    assertThat(tracker.topN(10)).hasSize(2);
  }

  @Test
  @DisplayName("clear 후에는 빈 목록")
  void clearRemovesCounts() {
    tracker.recordAccess("tt1", "movie");

    tracker.clear();

    assertThat(tracker.topN(10)).isEmpty();
    assertThat(tracker.accessCount("tt1", "movie")).isZero();
  }
}
