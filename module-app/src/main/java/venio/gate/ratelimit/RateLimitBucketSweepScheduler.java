package venio.gate.ratelimit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** 장기간 접근이 없는 인메모리 버킷을 주기적으로 회수합니다. */
@Slf4j
@Component
@RequiredArgsConstructor
public class RateLimitBucketSweepScheduler {

  private final RateLimiterRegistry registry;

  @Scheduled(fixedDelayString = "${ratelimit.sweep-interval:PT1M}")
  public void sweep() {
    int removed = registry.sweep();
    if (removed > 0) {
      log.debug("[RateLimit-Sweep] removed {} idle buckets", removed);
    }
  }
}
