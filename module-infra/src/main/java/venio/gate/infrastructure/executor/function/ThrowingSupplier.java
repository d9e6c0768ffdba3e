package venio.gate.infrastructure.executor.function;

/** Checked Exception을 던질 수 있는 Supplier */
@FunctionalInterface
public interface ThrowingSupplier<T> {
  T get() throws Throwable;
}
