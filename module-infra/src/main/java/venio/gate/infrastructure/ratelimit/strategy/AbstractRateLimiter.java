package venio.gate.infrastructure.ratelimit.strategy;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import venio.gate.core.concurrency.Deadline;
import venio.gate.infrastructure.executor.LogicExecutor;
import venio.gate.infrastructure.executor.TaskContext;
import venio.gate.infrastructure.ratelimit.ConsumeResult;
import venio.gate.infrastructure.ratelimit.FailureMode;
import venio.gate.infrastructure.ratelimit.RateLimitPolicy;
import venio.gate.infrastructure.ratelimit.RateLimiter;
import venio.gate.infrastructure.util.LogMasking;

/**
 * Rate Limiter 추상 클래스 (Template Method Pattern)
 *
 * <p>키 조립, LogicExecutor 실행, 장애 정책 적용, 메트릭 기록을 공통화하고 실제 카운팅만 백엔드에 위임합니다.
 *
 * <h4>구현체 책임</h4>
 *
 * <ul>
 *   <li>{@link #consume(Deadline, String)} - 전체 키 기준 1회 소비
 *   <li>{@link #clear(Deadline, String)} - 전체 키 상태 제거
 *   <li>{@link #backendName()} - 메트릭 태그
 * </ul>
 */
@Slf4j
public abstract class AbstractRateLimiter implements RateLimiter {

  protected final RateLimitPolicy policy;
  protected final String keyPrefix;
  protected final FailureMode failureMode;
  protected final LogicExecutor executor;
  protected final MeterRegistry meterRegistry;
  protected final Clock clock;

  protected AbstractRateLimiter(
      RateLimitPolicy policy,
      String keyPrefix,
      FailureMode failureMode,
      LogicExecutor executor,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.policy = policy;
    this.keyPrefix = keyPrefix;
    this.failureMode = failureMode;
    this.executor = executor;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  @Override
  public ConsumeResult allow(Deadline deadline, String key) {
    String fullKey = buildFullKey(key);
    TaskContext context =
        TaskContext.of("RateLimit", "Consume", policy.name() + ":" + LogMasking.maskKey(key));

    ConsumeResult result =
        executor.executeOrCatch(
            () -> consume(deadline, fullKey), e -> handleFailure(key, e), context);

    if (!result.degraded()) {
      recordMetrics(result.allowed());
    }
    return result;
  }

  @Override
  public void reset(Deadline deadline, String key) {
    executor.executeVoid(
        () -> clear(deadline, buildFullKey(key)),
        TaskContext.of("RateLimit", "Reset", policy.name() + ":" + LogMasking.maskKey(key)));
  }

  @Override
  public RateLimitPolicy policy() {
    return policy;
  }

  /** 전체 키 생성. 예: {ratelimit}:general:p:42 */
  protected String buildFullKey(String key) {
    return keyPrefix + ":" + policy.name() + ":" + key;
  }

  private ConsumeResult handleFailure(String key, Throwable cause) {
    Instant now = clock.instant();
    if (failureMode == FailureMode.FAIL_OPEN) {
      log.warn(
          "[RateLimit-FailOpen] Store failure, allowing request: policy={}, key={}, cause={}",
          policy.name(),
          LogMasking.maskKey(key),
          cause.toString());
      meterRegistry.counter("ratelimit.failopen", "policy", policy.name()).increment();
      return ConsumeResult.failOpen(policy.limit(), now);
    }

    log.warn(
        "[RateLimit-FailClose] Store failure, denying request: policy={}, key={}, cause={}",
        policy.name(),
        LogMasking.maskKey(key),
        cause.toString());
    meterRegistry.counter("ratelimit.failclose", "policy", policy.name()).increment();
    return ConsumeResult.failClosed(policy.limit(), now.plus(policy.window()));
  }

  private void recordMetrics(boolean allowed) {
    String result = allowed ? "allowed" : "denied";
    meterRegistry
        .counter(
            "ratelimit.consume",
            "policy",
            policy.name(),
            "backend",
            backendName(),
            "result",
            result)
        .increment();
  }

  // ===== Template Methods =====

  protected abstract ConsumeResult consume(Deadline deadline, String fullKey);

  protected abstract void clear(Deadline deadline, String fullKey);

  protected abstract String backendName();
}
