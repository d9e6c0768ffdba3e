package venio.gate.infrastructure.ratelimit;

import venio.gate.core.concurrency.Deadline;

/**
 * Rate Limiter 인터페이스 (Strategy Pattern)
 *
 * <p>키마다 윈도우당 최대 {@code limit}회 허용하는 고정 윈도우 계약입니다. 윈도우 경계 직전/직후로 최대 {@code 2 × limit}회가
 * 통과할 수 있습니다.
 *
 * <h4>구현체</h4>
 *
 * <ul>
 *   <li>{@link venio.gate.infrastructure.ratelimit.strategy.LocalBucketRateLimiter} - 프로세스 내 버킷
 *   <li>{@link venio.gate.infrastructure.ratelimit.strategy.SharedStoreRateLimiter} - 공유 저장소 카운터
 * </ul>
 */
public interface RateLimiter {

  /**
   * 요청 1건에 대한 허용 여부 판정
   *
   * <p>저장소 장애는 설정된 {@link FailureMode}에 따라 결과로 변환되며 예외로 전파되지 않습니다.
   *
   * @param key Rate Limit 키 (예: "p:42", "a:203.0.113.7")
   */
  ConsumeResult allow(Deadline deadline, String key);

  /** 키의 현재 윈도우 상태 제거 */
  void reset(Deadline deadline, String key);

  RateLimitPolicy policy();
}
