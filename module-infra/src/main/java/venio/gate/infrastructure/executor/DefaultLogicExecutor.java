package venio.gate.infrastructure.executor;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.Objects;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import venio.gate.error.exception.base.ClientBaseException;
import venio.gate.infrastructure.executor.function.ThrowingRunnable;
import venio.gate.infrastructure.executor.function.ThrowingSupplier;
import venio.gate.infrastructure.executor.strategy.ExceptionTranslator;

/**
 * LogicExecutor 기본 구현체
 *
 * <ul>
 *   <li>Checked Exception → Runtime Exception 자동 변환
 *   <li>Micrometer Timer {@code logic.executor} 자동 기록 (component/operation/result 태그)
 *   <li><b>Error 격리</b>: Error는 절대 캐치하지 않고 상위로 전파
 *   <li><b>카디널리티 통제</b>: dynamicValue는 로그에만 기록
 * </ul>
 */
@Slf4j
public class DefaultLogicExecutor implements LogicExecutor {

  private final MeterRegistry meterRegistry;
  private final ExceptionTranslator translator;

  public DefaultLogicExecutor(MeterRegistry meterRegistry) {
    this(meterRegistry, ExceptionTranslator.defaultTranslator());
  }

  public DefaultLogicExecutor(MeterRegistry meterRegistry, ExceptionTranslator translator) {
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
    this.translator = Objects.requireNonNull(translator, "translator");
  }

  @Override
  public <T> T execute(ThrowingSupplier<T> task, TaskContext context) {
    return run(task, translator, context);
  }

  @Override
  public <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context) {
    return executeOrCatch(task, e -> defaultValue, context);
  }

  @Override
  public <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context) {
    Objects.requireNonNull(recovery, "recovery");
    try {
      return run(task, translator, context);
    } catch (RuntimeException e) {
      return recovery.apply(e);
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
  public <T> T executeWithTranslation(
      ThrowingSupplier<T> task, ExceptionTranslator customTranslator, TaskContext context) {
    return run(task, Objects.requireNonNull(customTranslator, "customTranslator"), context);
  }

  private <T> T run(ThrowingSupplier<T> task, ExceptionTranslator translator, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(context, "context");
    Timer.Sample sample = Timer.start(meterRegistry);

    try {
      T result = task.get();
      record(sample, context, "success", "none");
      return result;
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      record(sample, context, "failure", t.getClass().getSimpleName());
      logFailure(context, t);
      throw translator.translate(t, context);
    }
  }

  private void record(Timer.Sample sample, TaskContext context, String result, String exception) {
    sample.stop(
        Timer.builder("logic.executor")
            .tag("component", context.component())
            .tag("operation", context.operation())
            .tag("result", result)
            .tag("exception", exception)
            .register(meterRegistry));
  }

  // 클라이언트 판정 예외(401/403/429)는 정상 흐름이므로 debug로만 남긴다
  private void logFailure(TaskContext context, Throwable t) {
    if (t instanceof ClientBaseException) {
      log.debug("[{}] {}", context.toTaskName(), t.getMessage());
      return;
    }
    log.warn("[{}] 작업 실패: {}", context.toTaskName(), t.toString());
  }
}
