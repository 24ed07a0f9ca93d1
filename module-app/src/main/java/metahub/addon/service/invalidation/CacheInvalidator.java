package metahub.addon.service.invalidation;

import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import metahub.addon.core.domain.config.UserConfig;
import metahub.addon.core.port.out.CacheStore;
import metahub.addon.infrastructure.executor.LogicExecutor;
import metahub.addon.infrastructure.executor.TaskContext;
import org.springframework.stereotype.Service;

/**
 * 패턴 기반 일괄 무효화
 *
 * <p>glob 패턴({@code *}, {@code ?}, {@code [...]})에 맞는 키를 모두 삭제하고 삭제 건수를 반환합니다. 저장소 오류는
 * {@code CacheStoreException}으로 호출자에게 전파됩니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CacheInvalidator {

  private final CacheStore store;
  private final InvalidationPlanner planner;
  private final LogicExecutor executor;

  public long invalidate(String pattern) {
    if (pattern == null || pattern.isBlank()) {
      throw new IllegalArgumentException("pattern must not be blank");
    }
    long deleted =
        executor.execute(
            () -> store.deleteMatching(pattern), TaskContext.of("CacheInvalidator", "Invalidate"));
    log.info("[CacheInvalidator] Invalidated pattern={} deleted={}", pattern, deleted);
    return deleted;
  }

  /**
   * 설정 변경으로 영향을 받는 사용자 캐시 삭제
   *
   * @return 삭제된 키 총 개수
   */
  public long invalidateForConfigChange(String userId, UserConfig oldConfig, UserConfig newConfig) {
    List<String> patterns = planner.plan(userId, oldConfig, newConfig);
    if (patterns.isEmpty()) {
      log.debug("[CacheInvalidator] No cache-relevant config change: userId={}", userId);
      return 0;
    }
    long total = 0;
    for (String pattern : patterns) {
      total += invalidate(pattern);
    }
    log.info(
        "[CacheInvalidator] Config change invalidated: userId={} patterns={} deleted={}",
        userId,
        patterns.size(),
        total);
    return total;
  }
}
