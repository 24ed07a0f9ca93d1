package metahub.addon.infrastructure.executor;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.Objects;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import metahub.addon.common.function.ThrowingSupplier;
import metahub.addon.infrastructure.executor.function.ThrowingRunnable;
import metahub.addon.infrastructure.executor.strategy.ExceptionTranslator;
import org.springframework.stereotype.Component;

/**
 * LogicExecutor 기본 구현체
 *
 * <ul>
 *   <li>Checked Exception → Runtime Exception 자동 변환
 *   <li>Micrometer 타이머 {@code logic.executor} 자동 기록
 *   <li><b>Error 격리</b>: Error(OOM 등)는 절대 캐치하지 않고 상위로 전파
 *   <li><b>메트릭 카디널리티 통제</b>: 동적 값은 로그에만 기록, 메트릭 태그는 component/operation만 사용
 * </ul>
 *
 * @see LogicExecutor
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultLogicExecutor implements LogicExecutor {

  private static final ExceptionTranslator DEFAULT_TRANSLATOR =
      ExceptionTranslator.defaultTranslator();

  private final MeterRegistry meterRegistry;

  @Override
  public <T> T execute(ThrowingSupplier<T> task, TaskContext context) {
    return executeWithTranslation(task, DEFAULT_TRANSLATOR, context);
  }

  @Override
  public <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context) {
    return executeOrCatch(
        task,
        e -> {
          log.debug("[{}] 예외 발생, 기본값 반환: {}", context.toTaskName(), e.getMessage());
          return defaultValue;
        },
        context);
  }

  @Override
  public <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context) {
    Objects.requireNonNull(recovery, "recovery");
    try {
      return timed(task, context);
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      return recovery.apply(DEFAULT_TRANSLATOR.translate(t, context));
    }
  }

  @Override
  public void executeVoid(ThrowingRunnable task, TaskContext context) {
    Objects.requireNonNull(task, "task");
    execute(
        () -> {
          task.run();
          return null;
        },
        context);
  }

  @Override
  public <T> T executeWithFinally(
      ThrowingSupplier<T> task, Runnable finallyBlock, TaskContext context) {
    Objects.requireNonNull(finallyBlock, "finallyBlock");
    try {
      return execute(task, context);
    } finally {
      finallyBlock.run();
    }
  }

  @Override
  public <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context) {
    Objects.requireNonNull(translator, "translator");
    try {
      return timed(task, context);
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      log.error("[{}] 실행 중 예외 발생", context.toTaskName(), t);
      throw translator.translate(t, context);
    }
  }

  /** 메트릭 수집 후 원본 예외를 그대로 던진다 (번역은 호출 메서드 책임) */
  private <T> T timed(ThrowingSupplier<T> task, TaskContext context) throws Throwable {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(context, "context");
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      T result = task.get();
      sample.stop(timer(context, "success", "none"));
      return result;
    } catch (Throwable t) {
      if (!(t instanceof Error)) {
        sample.stop(timer(context, "failure", t.getClass().getSimpleName()));
      }
      throw t;
    }
  }

  private Timer timer(TaskContext context, String result, String exception) {
    return Timer.builder("logic.executor")
        .tag("component", context.component())
        .tag("operation", context.operation())
        .tag("result", result)
        .tag("exception", exception)
        .register(meterRegistry);
  }
}
