package metahub.addon.service.invalidation;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import metahub.addon.core.domain.cache.CacheCategory;
import metahub.addon.core.domain.cache.CacheKey;
import metahub.addon.core.domain.config.ConfigSubsets;
import metahub.addon.core.domain.config.UserConfig;
import metahub.addon.core.domain.meta.MetaComponentType;
import metahub.addon.service.cache.CachePolicies;
import org.springframework.stereotype.Component;

/**
 * 사용자 설정 변경 시 삭제할 키 패턴 계산
 *
 * <p>두 설정을 비교해 변경된 필드가 영향을 주는 사용자 범위 캐시만 glob 패턴으로 반환합니다. 패턴은 중복 없이 계산 순서대로 반환되며,
 * 변경이 없으면 빈 목록입니다.
 */
@Component
public class InvalidationPlanner {

  private static final String ALL = "*";
  private static final String ARTWORK_COMPONENTS =
      "*:component:" + MetaComponentType.ARTWORK.componentName();

  private final CachePolicies policies;

  public InvalidationPlanner(CachePolicies policies) {
    this.policies = policies;
  }

  public List<String> plan(String userId, UserConfig oldConfig, UserConfig newConfig) {
    Set<String> patterns = new LinkedHashSet<>();

    if (!Objects.equals(oldConfig.language(), newConfig.language())) {
      patterns.add(pattern(userId, CacheCategory.META, ALL));
      patterns.add(pattern(userId, CacheCategory.SEARCH, ALL));
    }
    if (!oldConfig.providers().equals(newConfig.providers())
        || !oldConfig.artProviders().equals(newConfig.artProviders())) {
      patterns.add(pattern(userId, CacheCategory.META, ALL));
      patterns.add(pattern(userId, CacheCategory.CATALOG, ALL));
      patterns.add(pattern(userId, CacheCategory.SEARCH, ALL));
    }
    if (!oldConfig.searchProviders().equals(newConfig.searchProviders())) {
      patterns.add(pattern(userId, CacheCategory.SEARCH, ALL));
    }
    if (oldConfig.blurThumbs() != newConfig.blurThumbs()
        || artworkKeysChanged(oldConfig, newConfig)) {
      patterns.add(pattern(userId, CacheCategory.META, ARTWORK_COMPONENTS));
    }
    if (contentFiltersChanged(oldConfig, newConfig)) {
      patterns.add(pattern(userId, CacheCategory.CATALOG, ALL));
      patterns.add(pattern(userId, CacheCategory.SEARCH, ALL));
    }
    if (!oldConfig.mal().equals(newConfig.mal())) {
      patterns.add(pattern(userId, CacheCategory.CATALOG, ALL));
      patterns.add(pattern(userId, CacheCategory.META, ALL));
    }
    if (!Objects.equals(oldConfig.tvdbSeasonType(), newConfig.tvdbSeasonType())
        || !Objects.equals(oldConfig.castCount(), newConfig.castCount())) {
      patterns.add(pattern(userId, CacheCategory.META, ALL));
    }
    return new ArrayList<>(patterns);
  }

  private String pattern(String userId, CacheCategory category, String qualifierGlob) {
    return CacheKey.pattern(userId, policies.softwareVersion(), category, qualifierGlob);
  }

  private static boolean contentFiltersChanged(UserConfig oldConfig, UserConfig newConfig) {
    return oldConfig.sfw() != newConfig.sfw()
        || oldConfig.includeAdult() != newConfig.includeAdult()
        || !Objects.equals(oldConfig.ageRating(), newConfig.ageRating());
  }

  // 아트워크와 무관한 API 키 변경은 무시
  private static boolean artworkKeysChanged(UserConfig oldConfig, UserConfig newConfig) {
    return ConfigSubsets.ARTWORK_API_KEYS.stream()
        .anyMatch(k -> !Objects.equals(oldConfig.apiKeys().get(k), newConfig.apiKeys().get(k)));
  }
}
