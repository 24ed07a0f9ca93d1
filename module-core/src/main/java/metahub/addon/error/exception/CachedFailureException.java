package metahub.addon.error.exception;

import lombok.Getter;
import metahub.addon.core.domain.cache.ErrorKind;
import metahub.addon.error.CommonErrorCode;
import metahub.addon.error.exception.base.ServerBaseException;

/**
 * 에러 마커 적중 예외
 *
 * <p>최근 실패한 계산이 에러 마커로 캐시되어 있어 compute를 호출하지 않고 실패를 그대로 반환할 때 사용합니다.
 */
@Getter
public class CachedFailureException extends ServerBaseException {

  private final String key;
  private final ErrorKind kind;
  private final int retryCount;

  public CachedFailureException(String key, ErrorKind kind, String reason, int retryCount) {
    super(CommonErrorCode.CACHED_UPSTREAM_FAILURE, key, reason);
    this.key = key;
    this.kind = kind;
    this.retryCount = retryCount;
  }
}
