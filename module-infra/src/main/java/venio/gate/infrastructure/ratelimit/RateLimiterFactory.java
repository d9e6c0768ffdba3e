package venio.gate.infrastructure.ratelimit;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import venio.gate.core.port.out.SharedKeyValueStore;
import venio.gate.infrastructure.executor.LogicExecutor;
import venio.gate.infrastructure.ratelimit.strategy.LocalBucketRateLimiter;
import venio.gate.infrastructure.ratelimit.strategy.SharedStoreRateLimiter;

/**
 * 설정된 백엔드로 {@link RateLimiter}를 생성하는 팩토리
 *
 * <p>백엔드와 장애 정책은 생성 시 한 번 결정되며 요청 처리 중에 바뀌지 않습니다.
 */
@Slf4j
public class RateLimiterFactory {

  private final RateLimitBackend backend;
  private final FailureMode failureMode;
  private final String keyPrefix;
  private final int idleWindows;
  private final SharedKeyValueStore store;
  private final LogicExecutor executor;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  public RateLimiterFactory(
      RateLimitBackend backend,
      FailureMode failureMode,
      String keyPrefix,
      int idleWindows,
      SharedKeyValueStore store,
      LogicExecutor executor,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.backend = Objects.requireNonNull(backend, "backend");
    this.failureMode = Objects.requireNonNull(failureMode, "failureMode");
    this.keyPrefix = Objects.requireNonNull(keyPrefix, "keyPrefix");
    this.idleWindows = idleWindows;
    this.store = store;
    this.executor = executor;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
    if (backend == RateLimitBackend.REDIS && store == null) {
      throw new IllegalArgumentException("shared store is required for the redis backend");
    }
  }

  public RateLimiter create(RateLimitPolicy policy) {
    log.info(
        "[RateLimit] policy={} limit={} window={} backend={} failureMode={}",
        policy.name(),
        policy.limit(),
        policy.window(),
        backend,
        failureMode.value());

    return switch (backend) {
      case MEMORY ->
          new LocalBucketRateLimiter(
              policy, keyPrefix, idleWindows, executor, meterRegistry, clock);
      case REDIS ->
          new SharedStoreRateLimiter(
              policy, keyPrefix, failureMode, store, executor, meterRegistry, clock);
    };
  }

  public RateLimitBackend backend() {
    return backend;
  }
}
