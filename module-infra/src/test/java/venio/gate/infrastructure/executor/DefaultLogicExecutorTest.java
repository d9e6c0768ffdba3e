package venio.gate.infrastructure.executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import venio.gate.error.exception.StoreUnavailableException;
import venio.gate.error.exception.UnauthenticatedException;
import venio.gate.infrastructure.executor.strategy.ExceptionTranslator;

@Tag("unit")
@DisplayName("DefaultLogicExecutor 테스트")
class DefaultLogicExecutorTest {

  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private final LogicExecutor executor = new DefaultLogicExecutor(meterRegistry);
  private final TaskContext context = TaskContext.of("Test", "Run", "dyn");

  @Test
  @DisplayName("성공 시 값을 반환하고 success 타이머를 기록한다")
  void recordsSuccess() {
    assertThat(executor.execute(() -> "ok", context)).isEqualTo("ok");
    assertThat(
            meterRegistry
                .find("logic.executor")
                .tag("component", "Test")
                .tag("result", "success")
                .timer())
        .isNotNull();
  }

  @Test
  @DisplayName("도메인 예외는 그대로 전파된다")
  void passesDomainExceptions() {
    UnauthenticatedException ex = new UnauthenticatedException();

    assertThatThrownBy(
            () ->
                executor.execute(
                    () -> {
                      throw ex;
                    },
                    context))
        .isSameAs(ex);
  }

  @Test
  @DisplayName("checked 예외는 IllegalStateException으로 감싼다")
  void wrapsCheckedExceptions() {
    assertThatThrownBy(
            () ->
                executor.execute(
                    () -> {
                      throw new IOException("boom");
                    },
                    context))
        .isInstanceOf(IllegalStateException.class)
        .hasCauseInstanceOf(IOException.class);
  }

  @Test
  @DisplayName("저장소 변환기는 비동기 래핑을 벗기고 재시도 가능한 StoreUnavailable로 변환한다")
  void storeTranslatorUnwraps() {
    assertThatThrownBy(
            () ->
                executor.executeWithTranslation(
                    () -> {
                      throw new CompletionException(new IOException("reset"));
                    },
                    ExceptionTranslator.forStore(),
                    context))
        .isInstanceOf(StoreUnavailableException.class)
        .hasCauseInstanceOf(IOException.class)
        .satisfies(e -> assertThat(((StoreUnavailableException) e).isRetryable()).isTrue());
  }

  @Test
  @DisplayName("executeOrDefault는 실패 시 기본값을 돌려준다")
  void defaultOnFailure() {
    String value =
        executor.executeOrDefault(
            () -> {
              throw new IllegalStateException("x");
            },
            "fallback",
            context);

    assertThat(value).isEqualTo("fallback");
  }

  @Test
  @DisplayName("Error는 잡지 않는다")
  void errorsPropagate() {
    assertThatThrownBy(
            () ->
                executor.executeOrDefault(
                    () -> {
                      throw new AssertionError("fatal");
                    },
                    "fallback",
                    context))
        .isInstanceOf(AssertionError.class);
  }
}
