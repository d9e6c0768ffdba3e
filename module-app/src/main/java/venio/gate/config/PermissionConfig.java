package venio.gate.config;

import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import venio.gate.core.port.out.AccessDirectory;
import venio.gate.permission.PermissionResolver;

@Configuration
public class PermissionConfig {

  @Bean
  public PermissionResolver permissionResolver(
      AccessDirectory directory,
      Clock clock,
      MeterRegistry meterRegistry,
      PermissionProperties properties,
      Retry storeReadRetry) {
    return new PermissionResolver(
        directory,
        clock,
        meterRegistry,
        properties.getCacheTtl(),
        properties.getCacheMaxSize(),
        properties.getFollowerTimeout(),
        properties.getInvalidationRetention(),
        storeReadRetry);
  }
}
