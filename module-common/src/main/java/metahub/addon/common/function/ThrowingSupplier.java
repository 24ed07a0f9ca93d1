package metahub.addon.common.function;

/**
 * Checked Exception을 던질 수 있는 Supplier
 *
 * <p>LogicExecutor 작업 단위로 사용됩니다.
 *
 * @param <T> 결과 타입
 */
@FunctionalInterface
public interface ThrowingSupplier<T> {
  T get() throws Throwable;
}
