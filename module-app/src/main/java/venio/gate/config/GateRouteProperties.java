package venio.gate.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import venio.gate.ratelimit.RouteClass;

/**
 * 경로별 게이트 규칙
 *
 * <p>먼저 일치한 규칙이 적용되며, 일치하는 규칙이 없으면 인증 필수 + GENERAL 등급입니다.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "gate.http")
public class GateRouteProperties {

  /** 게이트를 전혀 거치지 않는 경로 (health check 등) */
  private List<String> bypassPaths = List.of("/actuator/health", "/actuator/info");

  @Valid private List<Rule> routes = new ArrayList<>();

  @Getter
  @Setter
  public static class Rule {

    /** Ant 스타일 경로 패턴 */
    @NotBlank private String pattern;

    @NotNull private RouteClass routeClass = RouteClass.GENERAL;

    /** 필요한 권한 (없으면 인증만 확인) */
    private String permission;

    /** false면 토큰 없이 IP/주소 기준 한도만 적용 (로그인, 토큰 갱신 등) */
    private boolean authenticated = true;
  }
}
