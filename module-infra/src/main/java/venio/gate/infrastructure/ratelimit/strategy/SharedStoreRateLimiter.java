package venio.gate.infrastructure.ratelimit.strategy;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import venio.gate.core.concurrency.Deadline;
import venio.gate.core.port.out.SharedKeyValueStore;
import venio.gate.core.port.out.WindowCounter;
import venio.gate.infrastructure.executor.LogicExecutor;
import venio.gate.infrastructure.ratelimit.ConsumeResult;
import venio.gate.infrastructure.ratelimit.FailureMode;
import venio.gate.infrastructure.ratelimit.RateLimitPolicy;

/**
 * 공유 저장소 기반 고정 윈도우 Rate Limiter
 *
 * <p>저장소가 원자적으로 "증가 + 첫 증가 시 만료 설정"을 수행하므로(Redis에서는 Lua Script 1회 호출), 여러 인스턴스가 같은 키를
 * 동시에 증가시켜도 같은 카운트를 관측하지 않습니다. 윈도우는 해당 윈도우의 첫 요청 시점에 시작합니다.
 *
 * <p>저장소 장애는 {@link FailureMode}에 따라 허용 또는 거부로 변환됩니다.
 */
public class SharedStoreRateLimiter extends AbstractRateLimiter {

  private final SharedKeyValueStore store;

  public SharedStoreRateLimiter(
      RateLimitPolicy policy,
      String keyPrefix,
      FailureMode failureMode,
      SharedKeyValueStore store,
      LogicExecutor executor,
      MeterRegistry meterRegistry,
      Clock clock) {
    super(policy, keyPrefix, failureMode, executor, meterRegistry, clock);
    this.store = store;
  }

  @Override
  protected ConsumeResult consume(Deadline deadline, String fullKey) {
    WindowCounter counter = store.incrementWithExpiry(deadline, fullKey, policy.window());
    Instant now = clock.instant();
    Duration ttl =
        counter.ttl().isNegative() || counter.ttl().isZero() ? policy.window() : counter.ttl();
    Instant resetAt = now.plus(ttl);

    if (counter.count() <= policy.limit()) {
      return ConsumeResult.allowed(policy.limit(), policy.limit() - counter.count(), resetAt);
    }
    return ConsumeResult.denied(policy.limit(), resetAt);
  }

  @Override
  protected void clear(Deadline deadline, String fullKey) {
    store.delete(deadline, fullKey);
  }

  @Override
  protected String backendName() {
    return "shared";
  }
}
