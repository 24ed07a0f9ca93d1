package metahub.addon.error.exception;

import metahub.addon.error.CommonErrorCode;
import metahub.addon.error.exception.base.ClientBaseException;

/**
 * 업스트림에 존재하지 않는 리소스
 *
 * <p>영구적인 Not-Found로 분류되어 자체 TTL을 가진 negative 캐시 항목으로 저장되며, 재시도 카운터 대상이 아닙니다.
 */
public class ResourceNotFoundException extends ClientBaseException {

  public ResourceNotFoundException(String resource) {
    super(CommonErrorCode.RESOURCE_NOT_FOUND, resource);
  }
}
