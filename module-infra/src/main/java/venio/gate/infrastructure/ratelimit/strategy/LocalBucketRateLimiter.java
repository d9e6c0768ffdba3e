package venio.gate.infrastructure.ratelimit.strategy;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import io.github.bucket4j.TimeMeter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import venio.gate.core.concurrency.Deadline;
import venio.gate.infrastructure.executor.LogicExecutor;
import venio.gate.infrastructure.ratelimit.ConsumeResult;
import venio.gate.infrastructure.ratelimit.FailureMode;
import venio.gate.infrastructure.ratelimit.RateLimitPolicy;

/**
 * 프로세스 내 Bucket4j 로컬 버킷 Rate Limiter
 *
 * <p>버킷 용량 = limit, {@code refillIntervally(limit, window)}로 윈도우가 끝날 때 한 번에 채우므로 고정 윈도우와 같은
 * 동작을 합니다. 버킷은 lock-free(CAS)로 소비되며 맵 전체를 잠그는 락은 없습니다.
 *
 * <p>시간은 주입된 {@link Clock}을 {@link TimeMeter}로 감싸 사용합니다.
 *
 * <p>{@link #sweep()}은 {@code idleWindows}개 윈도우 이상 접근이 없는 버킷을 회수합니다.
 */
@Slf4j
public class LocalBucketRateLimiter extends AbstractRateLimiter {

  private final ConcurrentHashMap<String, BucketEntry> buckets = new ConcurrentHashMap<>();
  private final TimeMeter timeMeter;
  private final Duration idleThreshold;

  private static final class BucketEntry {
    private final Bucket bucket;
    private volatile Instant lastAccess;

    private BucketEntry(Bucket bucket, Instant lastAccess) {
      this.bucket = bucket;
      this.lastAccess = lastAccess;
    }
  }

  public LocalBucketRateLimiter(
      RateLimitPolicy policy,
      String keyPrefix,
      int idleWindows,
      LogicExecutor executor,
      MeterRegistry meterRegistry,
      Clock clock) {
    // 외부 저장소 호출이 없어 장애 정책은 적용되지 않는다
    super(policy, keyPrefix, FailureMode.FAIL_CLOSE, executor, meterRegistry, clock);
    this.timeMeter = new ClockTimeMeter(clock);
    this.idleThreshold = policy.window().multipliedBy(Math.max(1, idleWindows));
  }

  @Override
  protected ConsumeResult consume(Deadline deadline, String fullKey) {
    Instant now = clock.instant();
    BucketEntry entry =
        buckets.compute(
            fullKey,
            (k, existing) -> {
              if (existing == null) {
                return new BucketEntry(newBucket(), now);
              }
              existing.lastAccess = now;
              return existing;
            });

    ConsumptionProbe consumption = entry.bucket.tryConsumeAndReturnRemaining(1);
    if (consumption.isConsumed()) {
      Instant resetAt = now.plusNanos(Math.max(consumption.getNanosToWaitForReset(), 0L));
      return ConsumeResult.allowed(policy.limit(), consumption.getRemainingTokens(), resetAt);
    }
    return ConsumeResult.denied(
        policy.limit(), now.plusNanos(consumption.getNanosToWaitForRefill()));
  }

  @Override
  protected void clear(Deadline deadline, String fullKey) {
    buckets.remove(fullKey);
  }

  @Override
  protected String backendName() {
    return "memory";
  }

  /**
   * 유휴 버킷 회수
   *
   * <p>{@code computeIfPresent}로 판정하므로 방금 접근된 버킷은 제거되지 않습니다.
   *
   * @return 제거된 버킷 수
   */
  public int sweep() {
    Instant cutoff = clock.instant().minus(idleThreshold);
    AtomicInteger removed = new AtomicInteger();
    for (String key : buckets.keySet()) {
      buckets.computeIfPresent(
          key,
          (k, entry) -> {
            if (entry.lastAccess.isBefore(cutoff)) {
              removed.incrementAndGet();
              return null;
            }
            return entry;
          });
    }
    if (removed.get() > 0) {
      log.debug("[RateLimit-Sweep] policy={}, removed={}", policy.name(), removed.get());
    }
    return removed.get();
  }

  /** 현재 보유 버킷 수 (모니터링용) */
  public int bucketCount() {
    return buckets.size();
  }

  private Bucket newBucket() {
    Bandwidth bandwidth =
        Bandwidth.builder()
            .capacity(policy.limit())
            .refillIntervally(policy.limit(), policy.window())
            .build();

    return Bucket.builder().addLimit(bandwidth).withCustomTimePrecision(timeMeter).build();
  }

  /** java.time.Clock → Bucket4j TimeMeter 어댑터 */
  private record ClockTimeMeter(Clock clock) implements TimeMeter {
    @Override
    public long currentTimeNanos() {
      Instant now = clock.instant();
      return now.getEpochSecond() * 1_000_000_000L + now.getNano();
    }

    @Override
    public boolean isWallClockBased() {
      return true;
    }
  }
}
