package metahub.addon.infrastructure.executor;

import java.util.function.Function;
import metahub.addon.common.function.ThrowingSupplier;
import metahub.addon.infrastructure.executor.function.ThrowingRunnable;
import metahub.addon.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * try-catch 없이 작업을 실행하기 위한 실행기
 *
 * <p>모든 인프라/서비스 코드는 예외 처리를 이 실행기에 위임합니다. 작업 단위마다 {@link TaskContext}로 메트릭 태그와 로그 컨텍스트를
 * 부여합니다.
 *
 * <h4>규칙</h4>
 *
 * <ul>
 *   <li>{@link Error}는 절대 잡지 않고 상위로 전파
 *   <li>관리되지 않은 예외는 {@code InternalSystemException}으로 규격화, {@code BaseException}은 그대로 전파
 * </ul>
 */
public interface LogicExecutor {

  /** 작업 실행, 실패 시 번역된 예외 전파 */
  <T> T execute(ThrowingSupplier<T> task, TaskContext context);

  /** 작업 실행, 실패 시 기본값 반환 */
  <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context);

  /** 작업 실행, 실패 시 번역된 예외로 복구 로직 실행 */
  <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context);

  void executeVoid(ThrowingRunnable task, TaskContext context);

  <T> T executeWithFinally(ThrowingSupplier<T> task, Runnable finallyBlock, TaskContext context);

  /** 작업 실행, 실패 시 지정한 번역기로 예외 변환 */
  <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context);
}
