package venio.gate.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * 공유 저장소 설정
 *
 * <p>{@code backend=redis}이면 Redisson 클라이언트와 RTopic 무효화 전파를 사용하고, {@code memory}이면 단일 인스턴스용
 * 인메모리 구현을 사용합니다.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "gate.store")
public class StoreProperties {

  @NotBlank private String backend = "memory";

  /** 저장소 호출 1회의 대기 상한 (호출자 Deadline이 더 짧으면 Deadline 우선) */
  @NotNull private Duration callTimeout = Duration.ofSeconds(3);

  /** 요청 1건에 주어지는 전체 시간 */
  @NotNull private Duration requestTimeout = Duration.ofSeconds(5);

  @NotNull private Redis redis = new Redis();

  @Getter
  @Setter
  public static class Redis {

    private String address = "redis://localhost:6379";

    private String password;

    @NotNull private Duration connectTimeout = Duration.ofSeconds(5);

    /** 권한 무효화 토픽 */
    @NotBlank private String invalidationTopic = "{gate}:permission-invalidation";

    /** Self-skip 판정용 인스턴스 ID (미지정 시 기동마다 랜덤) */
    private String instanceId;

    /** 미지정이면 랜덤 ID를 한 번 정해 고정합니다. */
    public synchronized String resolvedInstanceId() {
      if (instanceId == null || instanceId.isBlank()) {
        instanceId = UUID.randomUUID().toString();
      }
      return instanceId;
    }
  }
}
