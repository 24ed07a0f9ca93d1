package metahub.addon.error.exception;

import metahub.addon.error.CommonErrorCode;
import metahub.addon.error.exception.base.ServerBaseException;

/**
 * LogicExecutor 전용 시스템 예외
 *
 * <p>LogicExecutor에서 처리하지 못한 관리되지 않은 예외를 프로젝트 규격에 맞게 래핑합니다. taskName으로 발생 지점을 추적합니다.
 *
 * @since 1.0.0
 */
public class InternalSystemException extends ServerBaseException {

  /**
   * LogicExecutor 작업 실행 중 발생한 예외를 래핑
   *
   * @param taskName 작업 이름 (예: "CacheStore:get:global:v1.0:meta:tt0111161")
   * @param cause 원본 예외
   */
  public InternalSystemException(String taskName, Throwable cause) {
    super(CommonErrorCode.INTERNAL_SERVER_ERROR, cause, taskName);
  }

  public InternalSystemException(String taskName) {
    super(CommonErrorCode.INTERNAL_SERVER_ERROR, taskName);
  }
}
