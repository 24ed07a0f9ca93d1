package metahub.addon.core.domain.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.NotBlank;
import net.jqwik.api.constraints.Size;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

/**
 * 캐시 키 네임스페이스 테스트
 *
 * <h3>검증하는 불변식</h3>
 *
 * <ul>
 *   <li>논리적으로 다른 요청은 절대 같은 키를 만들지 않음
 *   <li>논리적으로 같은 요청은 항상 같은 키를 만듦
 * </ul>
 */
@Tag("unit")
class CacheKeyTest {

  @Test
  @DisplayName("scope:version:category:qualifiers 형식으로 렌더링")
  void rendersNamespacedKey() {
    CacheKey key = CacheKey.global("v1.0", CacheCategory.PROVIDER, "anime-genres");

    assertThat(key.asString()).isEqualTo("global:v1.0:provider:anime-genres");
  }

  @Test
  @DisplayName("식별자 내부의 구분자와 glob 문자는 이스케이프")
  void escapesSeparatorsInsideSegments() {
    CacheKey key = CacheKey.of("user-1", "v1.0", CacheCategory.META, "series", "mal:1535*");

    assertThat(key.asString()).isEqualTo("user-1:v1.0:meta:series:mal%3A1535%2A");
  }

  @Test
  @DisplayName("구분자 위치만 다른 두 요청은 충돌하지 않음")
  void separatorShiftDoesNotCollide() {
    CacheKey a = CacheKey.global("v1", CacheCategory.META, "tt1:2", "3");
    CacheKey b = CacheKey.global("v1", CacheCategory.META, "tt1", "2:3");

    assertThat(a.asString()).isNotEqualTo(b.asString());
  }

  @Test
  @DisplayName("child 키는 부모 키 하위 패턴에 매칭")
  void childExtendsParent() {
    CacheKey parent = CacheKey.global("v1", CacheCategory.META, "cfg-ab12", "tt0903747");

    assertThat(parent.child("component", "core").asString())
        .isEqualTo("global:v1:meta:cfg-ab12:tt0903747:component:core");
    assertThat(parent.descendantsPattern()).isEqualTo("global:v1:meta:cfg-ab12:tt0903747:*");
  }

  @Test
  @DisplayName("빈 qualifier는 거부")
  void rejectsBlankQualifier() {
    assertThatThrownBy(() -> CacheKey.global("v1", CacheCategory.META, " "))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Property(tries = 200)
  void differentQualifiersNeverCollide(
      @ForAll @Size(min = 1, max = 3) List<@NotBlank String> left,
      @ForAll @Size(min = 1, max = 3) List<@NotBlank String> right) {
    CacheKey a = new CacheKey("global", "v1", CacheCategory.CATALOG, left);
    CacheKey b = new CacheKey("global", "v1", CacheCategory.CATALOG, right);

    assertThat(a.asString().equals(b.asString())).isEqualTo(left.equals(right));
  }

  @Property(tries = 100)
  void identicalRequestsRenderIdentically(@ForAll @NotBlank String scope, @ForAll @NotBlank String id) {
    CacheKey a = CacheKey.of(scope, "v2", CacheCategory.SEARCH, "movie", id);
    CacheKey b = CacheKey.of(scope, "v2", CacheCategory.SEARCH, "movie", id);

    assertThat(a.asString()).isEqualTo(b.asString());
    assertThat(a).isEqualTo(b);
  }
}
