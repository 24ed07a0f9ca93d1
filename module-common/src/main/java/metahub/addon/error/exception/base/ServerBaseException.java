package metahub.addon.error.exception.base;

import metahub.addon.error.ErrorCode;

/**
 * ServerBaseException: 업스트림 장애나 내부 결함으로 발생하는 '서버 예외' 5xx 계열의 에러를 처리하며, 장애 회고를 위한 상세 로그를 남기는 것이
 * 주 목적입니다.
 */
public abstract class ServerBaseException extends BaseException {

  public ServerBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  // 캐시 키나 프로바이더 이름 등을 로그에 남기기 위한 동적 인자
  public ServerBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  public ServerBaseException(ErrorCode errorCode, Throwable cause) {
    super(errorCode, cause);
  }

  public ServerBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
