package metahub.addon.service.fingerprint;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Map;
import java.util.Optional;
import metahub.addon.core.domain.config.ConfigSubsets;
import metahub.addon.core.domain.config.RouteCategory;
import metahub.addon.core.domain.config.UserConfig;
import metahub.addon.core.port.out.ConfigProvider;
import metahub.addon.error.exception.ResourceNotFoundException;
import metahub.addon.infrastructure.cache.codec.CacheEntryCodec;
import metahub.addon.infrastructure.executor.LogicExecutor;
import metahub.addon.infrastructure.executor.TaskContext;
import metahub.addon.service.cache.CachePolicies;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * HTTP 검증자(ETag) 생성기
 *
 * <p>{@code W/"<md5 hex>"} 형식의 약한 ETag를 만듭니다. 입력은 라우트 카테고리, 소프트웨어 버전, 응답 payload, 그리고 해당
 * 카테고리에 영향을 주는 설정 부분집합({@link ConfigSubsets}) 입니다.
 *
 * <ul>
 *   <li>payload와 설정은 정렬된 키의 canonical JSON으로 직렬화되므로 동일 입력은 항상 동일 검증자
 *   <li>카테고리와 무관한 설정 필드 변경은 검증자에 영향 없음
 * </ul>
 */
@Component
public class FingerprintGenerator {

  private static final byte FIELD_SEPARATOR = 0x1F;

  private final CacheEntryCodec codec;
  private final CachePolicies policies;
  private final ObjectProvider<ConfigProvider> configProvider;
  private final LogicExecutor executor;

  public FingerprintGenerator(
      CacheEntryCodec codec,
      CachePolicies policies,
      ObjectProvider<ConfigProvider> configProvider,
      LogicExecutor executor) {
    this.codec = codec;
    this.policies = policies;
    this.configProvider = configProvider;
    this.executor = executor;
  }

  public String compute(
      RouteCategory category, String softwareVersion, Object payload, Map<String, ?> configSubset) {
    return executor.execute(
        () -> {
          MessageDigest md5 = MessageDigest.getInstance("MD5");
          md5.update(category.name().getBytes(StandardCharsets.UTF_8));
          md5.update(FIELD_SEPARATOR);
          md5.update(softwareVersion.getBytes(StandardCharsets.UTF_8));
          md5.update(FIELD_SEPARATOR);
          md5.update(codec.canonicalBytes(payload));
          md5.update(FIELD_SEPARATOR);
          md5.update(codec.canonicalBytes(configSubset == null ? Map.of() : configSubset));
          return "W/\"" + HexFormat.of().formatHex(md5.digest()) + "\"";
        },
        TaskContext.of("Fingerprint", "Compute", category.name()));
  }

  /** 현재 소프트웨어 버전과 사용자 설정의 카테고리 부분집합으로 계산 */
  public String compute(RouteCategory category, Object payload, UserConfig config) {
    return compute(
        category,
        policies.softwareVersion(),
        payload,
        ConfigSubsets.forCategory(category, config));
  }

  /**
   * ConfigProvider에서 사용자 설정을 조회해 계산
   *
   * @throws ResourceNotFoundException 사용자 설정이 없을 때
   * @throws IllegalStateException ConfigProvider 빈이 없을 때
   */
  public String fingerprintFor(String userId, RouteCategory category, Object payload) {
    ConfigProvider provider = configProvider.getIfAvailable();
    if (provider == null) {
      throw new IllegalStateException("No ConfigProvider available for user fingerprints");
    }
    Optional<UserConfig> config = provider.findByUserId(userId);
    return compute(
        category,
        payload,
        config.orElseThrow(() -> new ResourceNotFoundException("config " + userId)));
  }
}
