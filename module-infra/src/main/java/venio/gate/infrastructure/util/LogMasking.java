package venio.gate.infrastructure.util;

/**
 * 로그 출력용 마스킹 유틸리티
 *
 * <p>토큰, 주소, 저장소 키는 원문 그대로 로그에 남기지 않습니다.
 */
public final class LogMasking {

  private LogMasking() {}

  /** 키 마스킹: 앞 4자 + *** + 뒤 4자 */
  public static String maskKey(String key) {
    if (key == null) {
      return "null";
    }
    if (key.length() <= 8) {
      return "***";
    }
    return key.substring(0, 4) + "***" + key.substring(key.length() - 4);
  }

  /** 토큰 마스킹: 앞 6자만 */
  public static String maskToken(String token) {
    if (token == null || token.length() < 10) {
      return "***";
    }
    return token.substring(0, 6) + "...";
  }

  /** IPv4는 마지막 옥텟, IPv6는 앞 두 그룹 이후를 가린다 */
  public static String maskAddress(String address) {
    if (address == null || address.isBlank()) {
      return "unknown";
    }
    int lastDot = address.lastIndexOf('.');
    if (lastDot > 0 && address.indexOf(':') < 0) {
      return address.substring(0, lastDot) + ".***";
    }
    String[] groups = address.split(":");
    if (groups.length > 2) {
      return groups[0] + ":" + groups[1] + ":***";
    }
    return "***";
  }
}
