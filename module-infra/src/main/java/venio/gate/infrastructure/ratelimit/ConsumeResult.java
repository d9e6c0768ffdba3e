package venio.gate.infrastructure.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Rate Limit 판정 결과 (Immutable Record)
 *
 * <h4>사용 예시</h4>
 *
 * <pre>{@code
 * ConsumeResult result = rateLimiter.allow(deadline, "p:42");
 * if (!result.allowed()) {
 *   long retryAfter = result.retryAfterSeconds(clock.instant());
 *   throw new RateLimitExceededException(retryAfter, result.limit());
 * }
 * }</pre>
 *
 * @param allowed 요청 허용 여부
 * @param limit 윈도우당 허용 횟수 (X-RateLimit-Limit)
 * @param remaining 현재 윈도우의 남은 횟수 (X-RateLimit-Remaining). 저장소 장애로 판정하지 못한 경우 -1
 * @param resetAt 현재 윈도우가 끝나는 시각 (X-RateLimit-Reset)
 */
public record ConsumeResult(boolean allowed, long limit, long remaining, Instant resetAt) {

  public static ConsumeResult allowed(long limit, long remaining, Instant resetAt) {
    return new ConsumeResult(true, limit, remaining, resetAt);
  }

  public static ConsumeResult denied(long limit, Instant resetAt) {
    return new ConsumeResult(false, limit, 0L, resetAt);
  }

  /** 저장소 장애 시 Fail-Open 허용 결과 (remaining -1로 장애 상황 표시) */
  public static ConsumeResult failOpen(long limit, Instant now) {
    return new ConsumeResult(true, limit, -1L, now);
  }

  /** 저장소 장애 시 Fail-Close 거부 결과 */
  public static ConsumeResult failClosed(long limit, Instant retryAt) {
    return new ConsumeResult(false, limit, -1L, retryAt);
  }

  /** 저장소 장애로 실제 카운트 없이 정책에 따라 판정된 결과인지 */
  public boolean degraded() {
    return remaining < 0;
  }

  /** Retry-After 헤더 값 (초, 올림, 최소 1) */
  public long retryAfterSeconds(Instant now) {
    Duration wait = Duration.between(now, resetAt);
    if (wait.isNegative() || wait.isZero()) {
      return 1L;
    }
    long seconds = wait.getSeconds() + (wait.getNano() > 0 ? 1 : 0);
    return Math.max(1L, seconds);
  }
}
