package metahub.addon.error.exception;

import metahub.addon.error.CommonErrorCode;
import metahub.addon.error.exception.base.ServerBaseException;

/** 캐시 정책의 검증기를 통과하지 못한 계산 결과 (내부 계산 오류로 분류되어 캐시되지 않음) */
public class InvalidCacheValueException extends ServerBaseException {

  public InvalidCacheValueException(String key) {
    super(CommonErrorCode.INVALID_CACHE_VALUE, key);
  }
}
