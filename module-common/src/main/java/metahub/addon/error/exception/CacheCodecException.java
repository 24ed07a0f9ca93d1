package metahub.addon.error.exception;

import metahub.addon.error.CommonErrorCode;
import metahub.addon.error.exception.base.ServerBaseException;

/**
 * 캐시 항목 직렬화/역직렬화 실패 예외
 *
 * <p>읽기 경로에서 발생하면 손상된(corrupted) 항목으로 간주되어 삭제됩니다.
 */
public class CacheCodecException extends ServerBaseException {

  public CacheCodecException(String detail, Throwable cause) {
    super(CommonErrorCode.CACHE_CODEC_ERROR, cause, detail);
  }
}
