package venio.gate.config;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import venio.gate.core.port.out.SharedKeyValueStore;
import venio.gate.infrastructure.executor.LogicExecutor;
import venio.gate.infrastructure.ratelimit.FailureMode;
import venio.gate.infrastructure.ratelimit.RateLimitBackend;
import venio.gate.infrastructure.ratelimit.RateLimiterFactory;
import venio.gate.ratelimit.RateLimiterRegistry;

@Configuration
public class RateLimitConfig {

  @Bean
  public RateLimiterFactory rateLimiterFactory(
      RateLimitProperties properties,
      SharedKeyValueStore store,
      LogicExecutor executor,
      MeterRegistry meterRegistry,
      Clock clock) {
    return new RateLimiterFactory(
        RateLimitBackend.from(properties.getBackend()),
        FailureMode.from(properties.getFailureMode()),
        properties.getKeyPrefix(),
        properties.getIdleWindows(),
        store,
        executor,
        meterRegistry,
        clock);
  }

  @Bean
  public RateLimiterRegistry rateLimiterRegistry(
      RateLimiterFactory factory, RateLimitProperties properties) {
    return new RateLimiterRegistry(factory, properties);
  }
}
