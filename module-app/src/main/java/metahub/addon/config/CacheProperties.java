package metahub.addon.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import metahub.addon.core.domain.cache.CacheCategory;
import metahub.addon.core.domain.cache.CachePolicy;
import metahub.addon.core.domain.meta.TtlClass;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * 캐시 서브시스템 외부 설정 프로퍼티
 *
 * <h4>구성</h4>
 *
 * <ul>
 *   <li>softwareVersion: 키 네임스페이스의 버전 세그먼트 (업그레이드 시 전체 키 자동 무효화)
 *   <li>store: 저장소 종류 (memory | redis)
 *   <li>categories: 카테고리별 TTL / Stale / 에러 캐싱 정책
 *   <li>components: 메타 컴포넌트 TTL 클래스
 *   <li>warming: 캐시 웜업 설정
 *   <li>singleFlight: Follower 타임아웃 및 스윕 설정
 * </ul>
 *
 * <p>{@code categories}는 기본값 맵에 YAML 항목이 병합되므로 일부 카테고리만 재정의해도 됩니다.
 *
 * @see metahub.addon.service.cache.CachePolicies
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "cache")
public class CacheProperties {

  @NotBlank private String softwareVersion = "v1.0";

  @NotNull @Valid private Store store = new Store();

  @NotNull @Valid private Map<CacheCategory, CategoryPolicy> categories = defaultCategories();

  @NotNull @Valid private Components components = new Components();

  @NotNull @Valid private Warming warming = new Warming();

  @NotNull @Valid private SingleFlight singleFlight = new SingleFlight();

  public enum StoreType {
    MEMORY,
    REDIS
  }

  /** 저장소 설정 */
  @Getter
  @Setter
  public static class Store {

    @NotNull private StoreType type = StoreType.MEMORY;

    @Min(100)
    private long memoryMaximumSize = 100_000;

    @NotBlank private String redisAddress = "redis://localhost:6379";

    @Min(1)
    @Max(256)
    private int redisConnectionPoolSize = 16;
  }

  /**
   * 카테고리별 캐시 정책
   *
   * <p>마커 TTL을 비워두면 기본값(일시 장애 2분, Rate Limit 15분, Not-Found 1시간)을 카테고리 TTL 미만으로 보정해 사용합니다.
   */
  @Getter
  @Setter
  public static class CategoryPolicy {

    @NotNull private Duration ttl = Duration.ofHours(1);

    @NotNull private Duration staleWindow = Duration.ZERO;

    private boolean errorCaching = true;

    @Min(0)
    @Max(5)
    private int maxRetries = 2;

    private Duration errorTtl;

    private Duration rateLimitedTtl;

    private Duration notFoundTtl;

    @NotNull private Duration retryDelay = CachePolicy.DEFAULT_RETRY_DELAY;

    @NotNull private Duration computeTimeout = Duration.ofSeconds(30);

    private boolean cacheEmpty = false;

    public CategoryPolicy() {}

    CategoryPolicy(Duration ttl, Duration staleWindow, boolean errorCaching) {
      this.ttl = ttl;
      this.staleWindow = staleWindow;
      this.errorCaching = errorCaching;
    }

    public CachePolicy toPolicy() {
      return CachePolicy.builder()
          .ttl(ttl)
          .staleWindow(staleWindow)
          .errorCaching(errorCaching)
          .maxRetries(maxRetries)
          .errorTtl(errorTtl)
          .rateLimitedTtl(rateLimitedTtl)
          .notFoundTtl(notFoundTtl)
          .retryDelay(retryDelay)
          .computeTimeout(computeTimeout)
          .cacheEmpty(cacheEmpty)
          .build();
    }
  }

  /** 메타 컴포넌트 TTL 클래스별 TTL */
  @Getter
  @Setter
  public static class Components {

    @NotNull private Duration longTtl = Duration.ofDays(7);

    @NotNull private Duration mediumTtl = Duration.ofDays(1);

    @NotNull private Duration shortTtl = Duration.ofHours(1);

    public Duration ttlFor(TtlClass ttlClass) {
      return switch (ttlClass) {
        case LONG -> longTtl;
        case MEDIUM -> mediumTtl;
        case SHORT -> shortTtl;
      };
    }
  }

  /** 캐시 웜업 설정 */
  @Getter
  @Setter
  public static class Warming {

    private boolean enabled = true;

    @Min(1)
    @Max(1440)
    private long intervalMinutes = 30;

    @Min(1)
    @Max(64)
    private int concurrency = 4;

    @NotNull private Duration startupTimeout = Duration.ofSeconds(60);

    /** 정기 웜업 시 연관 콘텐츠를 미리 채울 인기 항목 수 (0이면 비활성) */
    @Min(0)
    @Max(500)
    private int popularTopN = 20;

    @NotNull private Duration popularWindow = Duration.ofHours(24);

    @Min(100)
    private long popularMaximumSize = 10_000;
  }

  /** Single-flight 설정 */
  @Getter
  @Setter
  public static class SingleFlight {

    @NotNull private Duration maxAge = Duration.ofMinutes(5);

    @NotNull private Duration sweepInterval = Duration.ofMinutes(1);
  }

  private static Map<CacheCategory, CategoryPolicy> defaultCategories() {
    Map<CacheCategory, CategoryPolicy> defaults = new EnumMap<>(CacheCategory.class);
    defaults.put(
        CacheCategory.META, new CategoryPolicy(Duration.ofDays(7), Duration.ofDays(1), true));
    defaults.put(
        CacheCategory.CATALOG, new CategoryPolicy(Duration.ofDays(1), Duration.ofHours(1), true));
    defaults.put(
        CacheCategory.SEARCH, new CategoryPolicy(Duration.ofMinutes(10), Duration.ZERO, false));
    defaults.put(
        CacheCategory.PROVIDER,
        new CategoryPolicy(Duration.ofHours(12), Duration.ofHours(1), true));
    defaults.put(
        CacheCategory.GLOBAL, new CategoryPolicy(Duration.ofDays(30), Duration.ZERO, true));
    return defaults;
  }
}
