package metahub.addon.service.cache;

import java.io.IOException;
import java.util.concurrent.TimeoutException;
import metahub.addon.error.exception.CachedFailureException;
import metahub.addon.error.exception.ResourceNotFoundException;
import metahub.addon.error.exception.UpstreamException;
import metahub.addon.infrastructure.util.ExceptionUtils;

/**
 * 계산 실패 분류기
 *
 * <ul>
 *   <li>{@link UpstreamException}, {@link TimeoutException}, {@link IOException}: 일시 장애
 *   <li>{@link UpstreamException#rateLimited(String)}: Rate Limit (재시도 없이 긴 마커 TTL)
 *   <li>{@link ResourceNotFoundException}: 영구 Not-Found
 *   <li>{@link CachedFailureException}: 하위 캐시의 마커 종류를 그대로 따름
 *   <li>그 외: 내부 계산 오류
 * </ul>
 */
public final class ErrorClassifier {

  private ErrorClassifier() {}

  public static FailureType classify(Throwable error) {
    Throwable cause = ExceptionUtils.unwrapAsyncException(error);
    if (cause instanceof ResourceNotFoundException) {
      return FailureType.NOT_FOUND;
    }
    if (cause instanceof UpstreamException upstream) {
      return upstream.isRateLimitExceeded() ? FailureType.RATE_LIMITED : FailureType.TRANSIENT;
    }
    if (cause instanceof CachedFailureException cached) {
      return switch (cached.getKind()) {
        case TRANSIENT -> FailureType.TRANSIENT;
        case RATE_LIMITED -> FailureType.RATE_LIMITED;
        case NOT_FOUND -> FailureType.NOT_FOUND;
      };
    }
    if (cause instanceof TimeoutException || cause instanceof IOException) {
      return FailureType.TRANSIENT;
    }
    return FailureType.INTERNAL;
  }

  /** 재시도 대상 여부. 캐시된 실패는 재시도해도 같은 결과이므로 제외합니다. */
  public static boolean shouldRetry(Throwable error) {
    Throwable cause = ExceptionUtils.unwrapAsyncException(error);
    return !(cause instanceof CachedFailureException) && classify(cause).retryable();
  }
}
