package venio.gate.infrastructure.ratelimit;

import java.util.Locale;

/** Rate Limiter 백엔드. 기동 시 한 번 선택됩니다. */
public enum RateLimitBackend {
  /** 프로세스 내 Bucket4j 로컬 버킷 */
  MEMORY,
  /** 공유 저장소 원자적 카운터 (Redis Lua) */
  REDIS;

  public static RateLimitBackend from(String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
