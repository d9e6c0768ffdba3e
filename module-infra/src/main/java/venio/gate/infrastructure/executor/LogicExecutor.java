package venio.gate.infrastructure.executor;

import java.util.function.Function;
import venio.gate.infrastructure.executor.function.ThrowingRunnable;
import venio.gate.infrastructure.executor.function.ThrowingSupplier;
import venio.gate.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * 예외 처리 / 로깅 / 메트릭을 일원화한 실행 템플릿
 *
 * <p>호출부에서 try-catch를 제거하고 실패 시 동작(전파, 기본값, 복구, 변환)을 메서드 선택으로 표현합니다.
 *
 * <ul>
 *   <li>{@link #execute}: 실패 시 기본 변환기를 거쳐 전파
 *   <li>{@link #executeOrDefault}: 실패 시 기본값 반환
 *   <li>{@link #executeOrCatch}: 실패 시 복구 함수 실행 (변환된 예외 전달)
 *   <li>{@link #executeWithTranslation}: 실패 시 커스텀 변환기로 전파
 * </ul>
 *
 * <p>Error(OOM 등)는 어떤 메서드에서도 잡지 않습니다.
 */
public interface LogicExecutor {

  <T> T execute(ThrowingSupplier<T> task, TaskContext context);

  <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context);

  <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context);

  void executeVoid(ThrowingRunnable task, TaskContext context);

  <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context);
}
