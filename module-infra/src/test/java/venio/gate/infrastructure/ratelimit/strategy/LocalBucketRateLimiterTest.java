package venio.gate.infrastructure.ratelimit.strategy;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import venio.gate.core.concurrency.Deadline;
import venio.gate.core.support.MutableClock;
import venio.gate.infrastructure.executor.DefaultLogicExecutor;
import venio.gate.infrastructure.ratelimit.ConsumeResult;
import venio.gate.infrastructure.ratelimit.RateLimitPolicy;

@Tag("unit")
@DisplayName("LocalBucketRateLimiter 테스트")
class LocalBucketRateLimiterTest {

  private MutableClock clock;
  private SimpleMeterRegistry meterRegistry;
  private LocalBucketRateLimiter limiter;

  @BeforeEach
  void setUp() {
    clock = MutableClock.at("2025-01-01T00:00:00Z");
    meterRegistry = new SimpleMeterRegistry();
    limiter = newLimiter(5, Duration.ofSeconds(60));
  }

  private LocalBucketRateLimiter newLimiter(int limit, Duration window) {
    return new LocalBucketRateLimiter(
        RateLimitPolicy.of("test", limit, window),
        "{ratelimit}",
        2,
        new DefaultLogicExecutor(meterRegistry),
        meterRegistry,
        clock);
  }

  private Deadline deadline() {
    return Deadline.after(clock, Duration.ofSeconds(5));
  }

  @Nested
  @DisplayName("윈도우 경계")
  class Boundary {

    @Test
    @DisplayName("limit=5: remaining 4,3,2,1,0 후 6번째 거부, 윈도우가 지나면 다시 허용")
    void exactBoundary() {
      // when
      List<Long> remaining =
          IntStream.range(0, 5)
              .mapToObj(i -> limiter.allow(deadline(), "p:1"))
              .peek(r -> assertThat(r.allowed()).isTrue())
              .map(ConsumeResult::remaining)
              .toList();
      ConsumeResult sixth = limiter.allow(deadline(), "p:1");

      // then
      assertThat(remaining).containsExactly(4L, 3L, 2L, 1L, 0L);
      assertThat(sixth.allowed()).isFalse();
      assertThat(sixth.remaining()).isZero();
      assertThat(sixth.limit()).isEqualTo(5);
      assertThat(sixth.resetAt()).isAfter(clock.instant());
      assertThat(sixth.resetAt()).isBeforeOrEqualTo(clock.instant().plusSeconds(60));

      // 윈도우 경과
      clock.advance(Duration.ofSeconds(60));
      ConsumeResult next = limiter.allow(deadline(), "p:1");
      assertThat(next.allowed()).isTrue();
      assertThat(next.remaining()).isEqualTo(4L);
    }

    @Test
    @DisplayName("윈도우가 끝나기 전에는 거부가 유지된다")
    void stillDeniedBeforeWindowEnds() {
      for (int i = 0; i < 5; i++) {
        limiter.allow(deadline(), "p:1");
      }

      clock.advance(Duration.ofSeconds(59));

      assertThat(limiter.allow(deadline(), "p:1").allowed()).isFalse();
    }

    @Test
    @DisplayName("키마다 독립적으로 센다")
    void keysAreIndependent() {
      for (int i = 0; i < 5; i++) {
        limiter.allow(deadline(), "p:1");
      }

      assertThat(limiter.allow(deadline(), "p:1").allowed()).isFalse();
      assertThat(limiter.allow(deadline(), "p:2").allowed()).isTrue();
    }

    @Test
    @DisplayName("reset 후에는 새 윈도우로 시작한다")
    void resetStartsFresh() {
      for (int i = 0; i < 5; i++) {
        limiter.allow(deadline(), "p:1");
      }

      limiter.reset(deadline(), "p:1");

      ConsumeResult result = limiter.allow(deadline(), "p:1");
      assertThat(result.allowed()).isTrue();
      assertThat(result.remaining()).isEqualTo(4L);
    }
  }

  @Test
  @DisplayName("동시 100건, limit=10이면 정확히 10건만 허용된다")
  void concurrentAdmissionsNeverExceedLimit() throws InterruptedException {
    // given
    LocalBucketRateLimiter tenPerMinute = newLimiter(10, Duration.ofSeconds(60));
    int threadCount = 100;
    ExecutorService pool = Executors.newFixedThreadPool(32);
    CountDownLatch startLatch = new CountDownLatch(1);
    CountDownLatch doneLatch = new CountDownLatch(threadCount);
    AtomicInteger admitted = new AtomicInteger();

    // when
    for (int i = 0; i < threadCount; i++) {
      pool.submit(
          () -> {
            try {
              startLatch.await();
              if (tenPerMinute.allow(deadline(), "shared").allowed()) {
                admitted.incrementAndGet();
              }
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
            } finally {
              doneLatch.countDown();
            }
          });
    }
    startLatch.countDown();
    boolean completed = doneLatch.await(10, TimeUnit.SECONDS);
    pool.shutdownNow();

    // then
    assertThat(completed).isTrue();
    assertThat(admitted.get()).isEqualTo(10);
  }

  @Test
  @DisplayName("유휴 윈도우 수를 넘긴 버킷만 회수된다")
  void sweepRemovesIdleBuckets() {
    limiter.allow(deadline(), "idle");
    clock.advance(Duration.ofSeconds(90));
    limiter.allow(deadline(), "active");
    clock.advance(Duration.ofSeconds(40));

    int removed = limiter.sweep();

    assertThat(removed).isEqualTo(1);
    assertThat(limiter.bucketCount()).isEqualTo(1);
  }

  @Test
  @DisplayName("허용/거부 결과가 메트릭으로 기록된다")
  void recordsMetrics() {
    for (int i = 0; i < 6; i++) {
      limiter.allow(deadline(), "p:1");
    }

    assertThat(
            meterRegistry
                .counter(
                    "ratelimit.consume", "policy", "test", "backend", "memory", "result", "allowed")
                .count())
        .isEqualTo(5.0);
    assertThat(
            meterRegistry
                .counter(
                    "ratelimit.consume", "policy", "test", "backend", "memory", "result", "denied")
                .count())
        .isEqualTo(1.0);
  }
}
