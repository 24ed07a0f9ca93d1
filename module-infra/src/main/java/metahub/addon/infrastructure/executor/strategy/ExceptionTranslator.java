package metahub.addon.infrastructure.executor.strategy;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.IOException;
import metahub.addon.error.exception.CacheCodecException;
import metahub.addon.error.exception.CacheStoreException;
import metahub.addon.error.exception.InternalSystemException;
import metahub.addon.error.exception.base.BaseException;
import metahub.addon.infrastructure.executor.TaskContext;
import metahub.addon.infrastructure.util.ExceptionUtils;

/** 특정 예외를 도메인 예외로 변환하는 전략 */
@FunctionalInterface
public interface ExceptionTranslator {

  /**
   * 예외를 변환하여 반환
   *
   * @param e 원본 예외
   * @param context 작업 컨텍스트
   * @return 변환된 RuntimeException
   */
  RuntimeException translate(Throwable e, TaskContext context);

  /**
   * Error guard + async unwrap을 선행 적용하는 Decorator
   *
   * <ol>
   *   <li>Error → 즉시 rethrow
   *   <li>CompletionException/ExecutionException → 원본으로 unwrap
   *   <li>BaseException → 그대로 전파
   *   <li>나머지는 내부 translator에 위임
   * </ol>
   */
  static ExceptionTranslator withErrorGuardAndUnwrap(ExceptionTranslator inner) {
    return (e, context) -> {
      if (e instanceof Error err) {
        throw err;
      }
      Throwable unwrapped = ExceptionUtils.unwrapAsyncException(e);
      if (unwrapped instanceof BaseException be) {
        return be;
      }
      return inner.translate(unwrapped, context);
    };
  }

  /** 기본 예외 변환기 */
  static ExceptionTranslator defaultTranslator() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> new InternalSystemException(context.toTaskName(), unwrapped));
  }

  /** 캐시 항목 JSON 직렬화 예외 변환기 */
  static ExceptionTranslator forJson() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> {
          if (unwrapped instanceof JsonProcessingException || unwrapped instanceof IOException) {
            return new CacheCodecException(context.toTaskName(), unwrapped);
          }
          if (unwrapped instanceof IllegalArgumentException) {
            // ObjectMapper.convertValue 타입 불일치
            return new CacheCodecException(context.toTaskName(), unwrapped);
          }
          return new InternalSystemException("json-processing:" + context.operation(), unwrapped);
        });
  }

  /** 캐시 저장소 접근 예외 변환기 */
  static ExceptionTranslator forCacheStore() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> new CacheStoreException(context.toTaskName(), unwrapped));
  }

  /** Redis Lua Script 예외 변환기 */
  static ExceptionTranslator forRedisScript() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) ->
            new CacheStoreException("script:" + context.operation(), unwrapped));
  }
}
