package venio.gate.infrastructure.ratelimit;

import java.util.Locale;

/**
 * 저장소 장애 시 동작
 *
 * <ul>
 *   <li>{@link #FAIL_OPEN}: 요청 허용 (가용성 우선), 경고 로그 + {@code ratelimit.failopen} 카운터
 *   <li>{@link #FAIL_CLOSE}: 요청 거부 (보안 우선), 경고 로그 + {@code ratelimit.failclose} 카운터
 * </ul>
 */
public enum FailureMode {
  FAIL_OPEN("fail-open"),
  FAIL_CLOSE("fail-close");

  private final String value;

  FailureMode(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /** 설정 문자열("fail-open" / "fail-close") 파싱 */
  public static FailureMode from(String value) {
    String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    for (FailureMode mode : values()) {
      if (mode.value.equals(normalized)) {
        return mode;
      }
    }
    throw new IllegalArgumentException("Unknown failure mode: " + value);
  }
}
