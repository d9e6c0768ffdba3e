package venio.gate.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import venio.gate.auth.AuthGate;
import venio.gate.web.AuthGateFilter;
import venio.gate.web.ClientAddressResolver;

@Configuration
public class WebConfig {

  @Bean
  public ClientAddressResolver clientAddressResolver(RateLimitProperties properties) {
    return new ClientAddressResolver(properties.getTrustedHeaders());
  }

  /** 필터는 빈으로 만들지 않고 등록 빈 안에서 생성합니다 (서블릿 컨테이너 중복 등록 방지). */
  @Bean
  public FilterRegistrationBean<AuthGateFilter> authGateFilter(
      AuthGate authGate,
      GateRouteProperties routeProperties,
      ClientAddressResolver addressResolver,
      StoreProperties storeProperties,
      Clock clock,
      ObjectMapper objectMapper) {
    AuthGateFilter filter =
        new AuthGateFilter(
            authGate,
            routeProperties,
            addressResolver,
            clock,
            storeProperties.getRequestTimeout(),
            objectMapper);
    FilterRegistrationBean<AuthGateFilter> registration = new FilterRegistrationBean<>(filter);
    registration.addUrlPatterns("/*");
    registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
    return registration;
  }
}
