package venio.gate.infrastructure.executor.function;

/** Checked Exception을 던질 수 있는 Runnable */
@FunctionalInterface
public interface ThrowingRunnable {
  void run() throws Throwable;
}
