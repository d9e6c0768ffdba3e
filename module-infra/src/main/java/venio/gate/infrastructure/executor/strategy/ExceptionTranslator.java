package venio.gate.infrastructure.executor.strategy;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import venio.gate.error.exception.StoreUnavailableException;
import venio.gate.error.exception.base.BaseException;
import venio.gate.infrastructure.executor.TaskContext;

/** 특정 예외를 도메인 예외로 변환하는 전략 */
@FunctionalInterface
public interface ExceptionTranslator {

  RuntimeException translate(Throwable e, TaskContext context);

  /**
   * Error guard + async unwrap을 선행 적용하는 Decorator
   *
   * <ol>
   *   <li>Error → 즉시 rethrow
   *   <li>CompletionException/ExecutionException → 원본으로 unwrap
   *   <li>이미 도메인 예외(BaseException)이면 그대로 반환
   * </ol>
   */
  static ExceptionTranslator withErrorGuardAndUnwrap(ExceptionTranslator inner) {
    return (e, context) -> {
      if (e instanceof Error err) {
        throw err;
      }
      Throwable unwrapped = unwrap(e);
      if (unwrapped instanceof BaseException be) {
        return be;
      }
      return inner.translate(unwrapped, context);
    };
  }

  /** 기본 변환기: RuntimeException은 그대로, checked 예외는 IllegalStateException으로 감쌉니다. */
  static ExceptionTranslator defaultTranslator() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> {
          if (unwrapped instanceof RuntimeException re) {
            return re;
          }
          if (unwrapped instanceof InterruptedException) {
            Thread.currentThread().interrupt();
          }
          return new IllegalStateException(
              "작업 실패 [" + context.toTaskName() + "]: " + unwrapped.getMessage(), unwrapped);
        });
  }

  /**
   * 저장소 호출 변환기
   *
   * <p>인터럽트는 재시도 불가, 그 외 I/O 계열 오류는 재시도 가능한 {@link StoreUnavailableException}으로 변환합니다.
   */
  static ExceptionTranslator forStore() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> {
          if (unwrapped instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            return new StoreUnavailableException(context.operation(), false, unwrapped);
          }
          return new StoreUnavailableException(context.operation(), true, unwrapped);
        });
  }

  private static Throwable unwrap(Throwable e) {
    Throwable current = e;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
