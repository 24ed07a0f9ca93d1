package metahub.addon.error.exception.base;

import lombok.Getter;
import metahub.addon.error.ErrorCode;

@Getter
public abstract class BaseException extends RuntimeException {
  private final ErrorCode errorCode;
  private final String message;

  public BaseException(ErrorCode errorCode) {
    super(errorCode.getMessage());
    this.errorCode = errorCode;
    this.message = errorCode.getMessage();
  }

  // 동적 인자를 받는 생성자 (String.format 활용)
  public BaseException(ErrorCode errorCode, Object... args) {
    super(String.format(errorCode.getMessage(), args));
    this.errorCode = errorCode;
    this.message = String.format(errorCode.getMessage(), args);
  }

  public BaseException(ErrorCode errorCode, Throwable cause) {
    super(errorCode.getMessage(), cause);
    this.errorCode = errorCode;
    this.message = errorCode.getMessage();
  }

  public BaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(String.format(errorCode.getMessage(), args), cause);
    this.errorCode = errorCode;
    this.message = String.format(errorCode.getMessage(), args);
  }
}
