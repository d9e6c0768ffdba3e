package venio.gate.config;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import venio.gate.infrastructure.executor.DefaultLogicExecutor;
import venio.gate.infrastructure.executor.LogicExecutor;
import venio.gate.infrastructure.persistence.InMemoryAccessDirectory;
import venio.gate.token.TokenSettings;

/** 공통 빈: 시계, 실행 템플릿, 토큰 설정, 접근 디렉터리 */
@Configuration
public class GateConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public LogicExecutor logicExecutor(MeterRegistry meterRegistry) {
    return new DefaultLogicExecutor(meterRegistry);
  }

  /** 설정이 잘못되면 ConfigurationException으로 컨텍스트 기동이 중단됩니다. */
  @Bean
  public TokenSettings tokenSettings(AuthTokenProperties properties) {
    return TokenSettings.from(properties);
  }

  @Bean
  public InMemoryAccessDirectory accessDirectory() {
    return new InMemoryAccessDirectory();
  }
}
