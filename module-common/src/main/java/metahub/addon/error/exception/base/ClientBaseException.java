package metahub.addon.error.exception.base;

import metahub.addon.error.ErrorCode;

/**
 * ClientBaseException: 요청한 리소스가 없거나 입력이 잘못된 경우의 '비즈니스 예외' 4xx 계열의 에러를 처리하며, 호출자에게 구체적인 실패 원인을
 * 전달하는 것이 목적입니다.
 */
public abstract class ClientBaseException extends BaseException {

  public ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  // "리소스를 찾을 수 없습니다 (tmdb:603)"와 같은 메시지 완성용
  public ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}
