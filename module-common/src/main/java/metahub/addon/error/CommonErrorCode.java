package metahub.addon.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {
  // === Client Errors (4xx) ===
  INVALID_INPUT_VALUE("C001", "잘못된 입력값입니다: %s", HttpStatus.BAD_REQUEST),
  RESOURCE_NOT_FOUND("C002", "리소스를 찾을 수 없습니다 (%s)", HttpStatus.NOT_FOUND),

  // === Server Errors (5xx) ===
  INTERNAL_SERVER_ERROR("S001", "서버 내부 오류가 발생했습니다 (%s)", HttpStatus.INTERNAL_SERVER_ERROR),
  DATA_PROCESSING_ERROR("S004", "데이터 처리 중 오류 발생 (%s)", HttpStatus.INTERNAL_SERVER_ERROR),
  EXTERNAL_API_ERROR("S005", "외부 API 호출 실패 (%s)", HttpStatus.SERVICE_UNAVAILABLE),
  EXTERNAL_API_RATE_LIMITED("S006", "외부 API 호출 한도 초과 (%s)", HttpStatus.TOO_MANY_REQUESTS),
  CACHED_UPSTREAM_FAILURE(
      "S007", "최근 실패한 요청입니다 (key: %s, 사유: %s)", HttpStatus.SERVICE_UNAVAILABLE),
  CACHE_STORE_ERROR("S008", "캐시 저장소 오류 (%s)", HttpStatus.INTERNAL_SERVER_ERROR),
  CACHE_CODEC_ERROR("S009", "캐시 직렬화 오류 (%s)", HttpStatus.INTERNAL_SERVER_ERROR),
  INVALID_CACHE_VALUE("S010", "캐시할 수 없는 값입니다 (key: %s)", HttpStatus.INTERNAL_SERVER_ERROR);

  private final String code;
  private final String message;
  private final HttpStatus status;
}
