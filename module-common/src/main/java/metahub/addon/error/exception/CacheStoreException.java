package metahub.addon.error.exception;

import metahub.addon.error.CommonErrorCode;
import metahub.addon.error.exception.base.ServerBaseException;

/** 캐시 저장소(Redis 등) 접근 실패 예외 */
public class CacheStoreException extends ServerBaseException {

  public CacheStoreException(String operation, Throwable cause) {
    super(CommonErrorCode.CACHE_STORE_ERROR, cause, operation);
  }
}
