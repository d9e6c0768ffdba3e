package venio.gate.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import venio.gate.infrastructure.ratelimit.FailureMode;

/** 권한 해석 캐시 및 저장소 재시도 설정 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "gate.permission")
public class PermissionProperties {

  /** 캐시 엔트리 TTL (무효화 신호 유실 시 stale 상한) */
  @NotNull private Duration cacheTtl = Duration.ofSeconds(30);

  @Min(1)
  private long cacheMaxSize = 10_000;

  /** Single-flight follower 대기 상한 */
  @NotNull private Duration followerTimeout = Duration.ofSeconds(3);

  /** 대상별 무효화 기록 보존 기간 (가장 긴 권한 로드보다 길어야 함) */
  @NotNull private Duration invalidationRetention = Duration.ofMinutes(1);

  /** 재시도 가능한 저장소 오류에 대한 재시도 대기 (최대 1회 재시도) */
  @NotNull private Duration retryBackoff = Duration.ofMillis(50);

  /**
   * 권한 조회 실패 시 동작 (기본: fail-close)
   *
   * <ul>
   *   <li>fail-close: 저장소 장애 시 503
   *   <li>fail-open: 저장소 장애 시 권한 검사를 건너뛰고 통과
   * </ul>
   */
  @NotBlank private String failureMode = "fail-close";

  public FailureMode failureModeValue() {
    return FailureMode.from(failureMode);
  }
}
