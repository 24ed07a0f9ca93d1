package metahub.addon.error.exception;

import lombok.Getter;
import metahub.addon.error.CommonErrorCode;
import metahub.addon.error.exception.base.ServerBaseException;

/**
 * 업스트림 프로바이더 일시 장애 예외
 *
 * <p>타임아웃, 네트워크 오류, 5xx 응답 등 다시 시도하면 성공할 수 있는 실패를 나타냅니다. 캐시 래퍼는 이 예외를 재시도 및 에러 캐싱 대상으로
 * 분류합니다.
 *
 * <h4>Rate Limit</h4>
 *
 * <p>{@link #rateLimited(String)}로 생성된 예외는 더 긴 에러 마커 TTL을 적용받습니다.
 */
@Getter
public class UpstreamException extends ServerBaseException {

  private final String provider;
  private final boolean rateLimitExceeded;

  public UpstreamException(String provider) {
    super(CommonErrorCode.EXTERNAL_API_ERROR, provider);
    this.provider = provider;
    this.rateLimitExceeded = false;
  }

  public UpstreamException(String provider, Throwable cause) {
    super(CommonErrorCode.EXTERNAL_API_ERROR, cause, provider);
    this.provider = provider;
    this.rateLimitExceeded = false;
  }

  private UpstreamException(String provider, boolean rateLimitExceeded) {
    super(CommonErrorCode.EXTERNAL_API_RATE_LIMITED, provider);
    this.provider = provider;
    this.rateLimitExceeded = rateLimitExceeded;
  }

  public static UpstreamException rateLimited(String provider) {
    return new UpstreamException(provider, true);
  }
}
