package venio.gate.auth;

import java.util.Locale;
import java.util.Optional;

/** {@code Authorization: Bearer <token>} 헤더에서 토큰을 꺼냅니다. */
public final class BearerTokenExtractor {

  private static final String SCHEME = "bearer";

  private BearerTokenExtractor() {}

  /**
   * 스킴은 대소문자를 구분하지 않으며, 스킴 뒤에 공백이 있어야 합니다.
   *
   * @param authorizationHeader 헤더 값 (null 가능)
   * @return 토큰, 헤더가 없거나 형식이 다르면 empty
   */
  public static Optional<String> extract(String authorizationHeader) {
    if (authorizationHeader == null || authorizationHeader.isBlank()) {
      return Optional.empty();
    }
    String trimmed = authorizationHeader.strip();
    if (trimmed.length() <= SCHEME.length()
        || !trimmed.substring(0, SCHEME.length()).toLowerCase(Locale.ROOT).equals(SCHEME)
        || !Character.isWhitespace(trimmed.charAt(SCHEME.length()))) {
      return Optional.empty();
    }
    String token = trimmed.substring(SCHEME.length()).strip();
    return token.isEmpty() ? Optional.empty() : Optional.of(token);
  }
}
