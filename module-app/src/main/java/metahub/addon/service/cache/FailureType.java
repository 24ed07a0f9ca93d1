package metahub.addon.service.cache;

import metahub.addon.core.domain.cache.ErrorKind;

/** 계산 실패 분류. 재시도 여부와 에러 마커 종류를 결정합니다. */
public enum FailureType {
  TRANSIENT(true, ErrorKind.TRANSIENT),
  RATE_LIMITED(false, ErrorKind.RATE_LIMITED),
  NOT_FOUND(false, ErrorKind.NOT_FOUND),
  /** 계산 함수 자체의 결함: 캐시하지 않고 즉시 전파 */
  INTERNAL(false, null);

  private final boolean retryable;
  private final ErrorKind errorKind;

  FailureType(boolean retryable, ErrorKind errorKind) {
    this.retryable = retryable;
    this.errorKind = errorKind;
  }

  public boolean retryable() {
    return retryable;
  }

  public boolean cacheable() {
    return errorKind != null;
  }

  public ErrorKind errorKind() {
    return errorKind;
  }
}
