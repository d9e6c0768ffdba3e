package venio.gate.token;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import venio.gate.config.AuthTokenProperties;
import venio.gate.core.domain.model.TokenKind;
import venio.gate.error.exception.ConfigurationException;

/**
 * 검증을 마친 불변 토큰 설정
 *
 * <p>서명 키는 기동 시 한 번 로드되어 프로세스 수명 동안 바뀌지 않습니다.
 */
public record TokenSettings(
    byte[] secret,
    String issuer,
    Duration accessTtl,
    Duration refreshTtl,
    Duration maxAccessLifetime,
    Duration maxRefreshLifetime,
    boolean rotationEnabled,
    String ledgerKeyPrefix) {

  /** HS256 최소 키 길이 (바이트) */
  public static final int MIN_SECRET_BYTES = 32;

  public TokenSettings {
    if (secret == null || secret.length < MIN_SECRET_BYTES) {
      throw new ConfigurationException(
          "auth.jwt.secret must be at least " + MIN_SECRET_BYTES + " bytes");
    }
    if (issuer == null || issuer.isBlank()) {
      throw new ConfigurationException("auth.jwt.issuer is required");
    }
    requirePositive("auth.jwt.access-ttl", accessTtl);
    requirePositive("auth.jwt.refresh-ttl", refreshTtl);
    requirePositive("auth.jwt.max-access-lifetime", maxAccessLifetime);
    requirePositive("auth.jwt.max-refresh-lifetime", maxRefreshLifetime);
    if (accessTtl.compareTo(maxAccessLifetime) > 0) {
      throw new ConfigurationException("auth.jwt.access-ttl exceeds max-access-lifetime");
    }
    if (refreshTtl.compareTo(maxRefreshLifetime) > 0) {
      throw new ConfigurationException("auth.jwt.refresh-ttl exceeds max-refresh-lifetime");
    }
    if (accessTtl.getSeconds() < 1 || refreshTtl.getSeconds() < 1) {
      throw new ConfigurationException("token TTLs must be at least one second");
    }
    secret = secret.clone();
  }

  public static TokenSettings from(AuthTokenProperties properties) {
    String secret = properties.getSecret();
    return new TokenSettings(
        secret == null ? null : secret.getBytes(StandardCharsets.UTF_8),
        properties.getIssuer(),
        properties.getAccessTtl(),
        properties.getRefreshTtl(),
        properties.getMaxAccessLifetime(),
        properties.getMaxRefreshLifetime(),
        properties.isRotationEnabled(),
        properties.getLedgerKeyPrefix());
  }

  private static void requirePositive(String name, Duration value) {
    if (value == null || value.isNegative() || value.isZero()) {
      throw new ConfigurationException(name + " must be positive");
    }
  }

  @Override
  public byte[] secret() {
    return secret.clone();
  }

  public Duration ttlFor(TokenKind kind) {
    return kind == TokenKind.ACCESS ? accessTtl : refreshTtl;
  }

  public Duration maxLifetimeFor(TokenKind kind) {
    return kind == TokenKind.ACCESS ? maxAccessLifetime : maxRefreshLifetime;
  }

  @Override
  public String toString() {
    return "TokenSettings[issuer="
        + issuer
        + ", accessTtl="
        + accessTtl
        + ", refreshTtl="
        + refreshTtl
        + ", rotationEnabled="
        + rotationEnabled
        + "]";
  }
}
