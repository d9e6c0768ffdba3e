package venio.gate.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.List;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import venio.gate.ratelimit.KeyStrategy;

/**
 * Rate Limiting 설정 프로퍼티
 *
 * <p>백엔드와 장애 정책은 기동 시 한 번 결정됩니다.
 *
 * <ul>
 *   <li>backend: memory (인스턴스별 Bucket4j) / redis (공유 저장소 Lua 카운터)
 *   <li>failure-mode: fail-open (저장소 장애 시 허용) / fail-close (저장소 장애 시 거부)
 * </ul>
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "ratelimit")
public class RateLimitProperties {

  @NotBlank private String backend = "memory";

  @NotBlank private String failureMode = "fail-open";

  /** 키 접두사 (Redis Cluster Hash Tag 포함) */
  @NotBlank private String keyPrefix = "{ratelimit}";

  /** 이 윈도우 수만큼 접근이 없는 로컬 버킷은 회수 */
  @Min(1)
  private int idleWindows = 2;

  /** 신뢰할 수 있는 프록시 헤더 (순서대로 확인) */
  private List<String> trustedHeaders = List.of("X-Forwarded-For", "X-Real-IP");

  /** 인증 전 IP 기준 거친 한도 */
  @Valid @NotNull private Policy ip = new Policy(300, Duration.ofMinutes(1), KeyStrategy.ADDRESS);

  @Valid @NotNull private Policy auth = new Policy(5, Duration.ofMinutes(1), KeyStrategy.ADDRESS);

  @Valid @NotNull
  private Policy general = new Policy(100, Duration.ofMinutes(1), KeyStrategy.PRINCIPAL);

  @Valid @NotNull
  private Policy admin = new Policy(200, Duration.ofMinutes(1), KeyStrategy.PRINCIPAL);

  @Valid @NotNull
  private Policy strict = new Policy(3, Duration.ofMinutes(5), KeyStrategy.ADDRESS);

  @Getter
  @Setter
  @NoArgsConstructor
  public static class Policy {

    @Min(1)
    private int limit;

    @NotNull private Duration window;

    @NotNull private KeyStrategy keyBy;

    public Policy(int limit, Duration window, KeyStrategy keyBy) {
      this.limit = limit;
      this.window = window;
      this.keyBy = keyBy;
    }
  }
}
