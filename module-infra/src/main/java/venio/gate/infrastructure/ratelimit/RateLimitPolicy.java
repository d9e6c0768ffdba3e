package venio.gate.infrastructure.ratelimit;

import java.time.Duration;
import java.util.Objects;

/**
 * 키당 윈도우 한도
 *
 * @param name 정책 이름 (키 접두사, 로그, 메트릭 태그)
 * @param limit 윈도우당 허용 횟수
 * @param window 고정 윈도우 길이
 */
public record RateLimitPolicy(String name, int limit, Duration window) {
  public RateLimitPolicy {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(window, "window");
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be >= 1: " + limit);
    }
    if (window.isNegative() || window.isZero()) {
      throw new IllegalArgumentException("window must be positive: " + window);
    }
  }

  public static RateLimitPolicy of(String name, int limit, Duration window) {
    return new RateLimitPolicy(name, limit, window);
  }
}
