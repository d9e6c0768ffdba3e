package venio.gate.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * 세션 토큰 설정 프로퍼티
 *
 * <p>기동 시 한 번 검증되어 {@link venio.gate.token.TokenSettings}로 고정됩니다. 요청 처리 중에는 다시 읽지 않습니다.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "auth.jwt")
public class AuthTokenProperties {

  /** HS256 서명 키 (UTF-8 기준 최소 32바이트) */
  @NotBlank private String secret;

  /** iss 클레임 */
  @NotBlank private String issuer = "venio";

  /** Access Token 수명 */
  @NotNull private Duration accessTtl = Duration.ofHours(24);

  /** Refresh Token 수명 */
  @NotNull private Duration refreshTtl = Duration.ofDays(7);

  /** Access Token 최대 허용 수명 (검증 시 exp - iat 상한) */
  @NotNull private Duration maxAccessLifetime = Duration.ofHours(24);

  /** Refresh Token 최대 허용 수명 */
  @NotNull private Duration maxRefreshLifetime = Duration.ofDays(30);

  /**
   * Refresh Token Rotation 활성화 (기본: false)
   *
   * <p>활성화 시 Refresh Token은 1회용이며, 재사용이 감지되면 Family 전체를 무효화합니다. 공유 저장소가 필요합니다.
   */
  private boolean rotationEnabled = false;

  /** 회전 상태 저장 키 접두사 */
  @NotBlank private String ledgerKeyPrefix = "{auth}:refresh";
}
