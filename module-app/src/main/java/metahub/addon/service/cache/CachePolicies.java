package metahub.addon.service.cache;

import java.time.Duration;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import metahub.addon.config.CacheProperties;
import metahub.addon.core.domain.cache.CacheCategory;
import metahub.addon.core.domain.cache.CacheKey;
import metahub.addon.core.domain.cache.CachePolicy;
import metahub.addon.core.domain.meta.MetaComponentType;
import org.springframework.stereotype.Component;

/**
 * 카테고리별 기본 {@link CachePolicy} 및 키 생성 진입점
 *
 * <p>설정에서 정책을 한 번만 만들어 재사용합니다. 설정에 없는 카테고리는 기동 시점에 실패합니다.
 */
@Slf4j
@Component
public class CachePolicies {

  private final String softwareVersion;
  private final Map<CacheCategory, CachePolicy> policies = new EnumMap<>(CacheCategory.class);
  private final Map<MetaComponentType, Duration> componentTtls =
      new EnumMap<>(MetaComponentType.class);

  public CachePolicies(CacheProperties properties) {
    this.softwareVersion = properties.getSoftwareVersion();
    for (CacheCategory category : CacheCategory.values()) {
      CacheProperties.CategoryPolicy configured = properties.getCategories().get(category);
      if (configured == null) {
        throw new IllegalStateException("cache.categories." + category.key() + " is not configured");
      }
      policies.put(category, configured.toPolicy());
    }
    for (MetaComponentType type : MetaComponentType.values()) {
      componentTtls.put(type, properties.getComponents().ttlFor(type.ttlClass()));
    }
    log.info(
        "[CachePolicies] Loaded policies: version={} categories={}",
        softwareVersion,
        policies.keySet());
  }

  public CachePolicy forCategory(CacheCategory category) {
    return policies.get(category);
  }

  /** 카테고리 정책 중 가장 긴 최대 로드 시간. 모두 상한이 없으면 {@link Duration#ZERO} */
  public Duration longestLoadTime() {
    return policies.values().stream()
        .map(CachePolicy::worstCaseLoadTime)
        .filter(Objects::nonNull)
        .max(Comparator.naturalOrder())
        .orElse(Duration.ZERO);
  }

  public Duration componentTtl(MetaComponentType type) {
    return componentTtls.get(type);
  }

  public String softwareVersion() {
    return softwareVersion;
  }

  /** {@code global:{version}:{category}:...} 키 */
  public CacheKey globalKey(CacheCategory category, String... qualifiers) {
    return CacheKey.global(softwareVersion, category, qualifiers);
  }

  /** 사용자 범위 키 */
  public CacheKey userKey(String userId, CacheCategory category, String... qualifiers) {
    return CacheKey.of(userId, softwareVersion, category, qualifiers);
  }
}
