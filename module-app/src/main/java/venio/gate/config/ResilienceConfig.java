package venio.gate.config;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import venio.gate.error.exception.StoreUnavailableException;

/**
 * Resilience4j Retry Bean 등록
 *
 * <p>권한 해석과 Refresh 처리의 저장소 읽기는 같은 {@code storeRead} 인스턴스를 공유합니다. 재시도 가능한 {@link
 * StoreUnavailableException}만 1회 재시도하며 대기 시간은 {@code gate.permission.retry-backoff}를 따릅니다.
 */
@Configuration
public class ResilienceConfig {

  public static final String STORE_READ = "storeRead";

  @Bean
  public RetryRegistry retryRegistry(PermissionProperties properties) {
    return RetryRegistry.of(storeReadRetryConfig(properties.getRetryBackoff()));
  }

  @Bean
  public Retry storeReadRetry(RetryRegistry retryRegistry) {
    return retryRegistry.retry(STORE_READ);
  }

  /** 저장소 읽기 재시도 정책 (최초 1회 + 재시도 1회) */
  public static RetryConfig storeReadRetryConfig(Duration backoff) {
    return RetryConfig.custom()
        .maxAttempts(2)
        .waitDuration(backoff)
        .retryOnException(ResilienceConfig::isRetryable)
        .build();
  }

  private static boolean isRetryable(Throwable e) {
    return e instanceof StoreUnavailableException store && store.isRetryable();
  }
}
