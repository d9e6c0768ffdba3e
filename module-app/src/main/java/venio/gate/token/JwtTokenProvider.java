package venio.gate.token;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.PrematureJwtException;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.io.Encoders;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SecurityException;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import javax.crypto.SecretKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import venio.gate.core.domain.model.TokenClaims;
import venio.gate.core.domain.model.TokenKind;
import venio.gate.error.TokenFailureReason;
import venio.gate.error.exception.InvalidTokenException;

/**
 * JWT 서명 및 검증
 *
 * <p>JJWT 0.12.x 기반:
 *
 * <ul>
 *   <li>HS256 고정. 서명 검증 전에 헤더의 alg를 먼저 확인하여 {@code none}/타 알고리즘을 거부
 *   <li>parseSignedClaims() 사용, 파서 시계는 주입된 {@link Clock}
 *   <li>유효 구간은 {@code nbf <= now < exp}
 * </ul>
 *
 * <p>실패 사유는 {@link TokenFailureReason}으로만 구분되며, 클라이언트에는 노출되지 않습니다.
 */
@Slf4j
@Component
public class JwtTokenProvider {

  static final String EXPECTED_ALG = "HS256";

  private static final String CLAIM_UID = "uid";
  private static final String CLAIM_HANDLE = "handle";
  private static final String CLAIM_EMAIL = "email";
  private static final String CLAIM_ROLES = "roles";
  private static final String CLAIM_KIND = "kind";
  private static final String CLAIM_FAMILY = "fid";

  private static final ObjectMapper HEADER_MAPPER = new ObjectMapper();

  private final TokenSettings settings;
  private final Clock clock;
  private final SecretKey secretKey;
  private final JwtParser parser;

  public JwtTokenProvider(TokenSettings settings, Clock clock) {
    this.settings = settings;
    this.clock = clock;
    this.secretKey = Keys.hmacShaKeyFor(settings.secret());
    this.parser =
        Jwts.parser().verifyWith(secretKey).clock(() -> Date.from(clock.instant())).build();
    log.info("[JWT] TokenProvider initialized: {}", settings);
  }

  /** 클레임 집합을 HS256으로 서명합니다. */
  public String sign(TokenClaims claims) {
    var builder =
        Jwts.builder()
            .issuer(claims.issuer())
            .subject(claims.subject())
            .id(claims.tokenId())
            .claim(CLAIM_UID, claims.principalId())
            .claim(CLAIM_HANDLE, claims.handle())
            .claim(CLAIM_EMAIL, claims.email())
            .claim(CLAIM_ROLES, claims.roles())
            .claim(CLAIM_KIND, claims.kind().claimValue())
            .issuedAt(Date.from(claims.issuedAt()))
            .notBefore(Date.from(claims.notBefore()))
            .expiration(Date.from(claims.expiresAt()));
    if (claims.familyId() != null) {
      builder.claim(CLAIM_FAMILY, claims.familyId());
    }
    return builder.signWith(secretKey, Jwts.SIG.HS256).compact();
  }

  /**
   * 토큰을 검증하고 클레임을 돌려줍니다.
   *
   * @throws InvalidTokenException 검증 실패 (사유 포함)
   */
  public TokenClaims verify(String token) {
    if (token == null || token.isBlank()) {
      throw new InvalidTokenException(TokenFailureReason.MALFORMED);
    }
    requireExpectedAlgorithm(token);
    requireCanonicalSignature(token);

    Claims claims;
    try {
      claims = parser.parseSignedClaims(token).getPayload();
    } catch (SecurityException e) {
      throw new InvalidTokenException(TokenFailureReason.BAD_SIGNATURE, e);
    } catch (ExpiredJwtException e) {
      throw new InvalidTokenException(TokenFailureReason.EXPIRED, e);
    } catch (PrematureJwtException e) {
      throw new InvalidTokenException(TokenFailureReason.NOT_YET_VALID, e);
    } catch (JwtException | IllegalArgumentException e) {
      throw new InvalidTokenException(TokenFailureReason.MALFORMED, e);
    }

    TokenClaims result = toTokenClaims(claims);
    requireWithinValidity(result);
    return result;
  }

  /** 서명 검증 전에 헤더만 디코딩하여 alg를 확인합니다. */
  private void requireExpectedAlgorithm(String token) {
    int firstDot = token.indexOf('.');
    if (firstDot <= 0) {
      throw new InvalidTokenException(TokenFailureReason.MALFORMED);
    }

    JsonNode header;
    try {
      header = HEADER_MAPPER.readTree(Decoders.BASE64URL.decode(token.substring(0, firstDot)));
    } catch (IOException | RuntimeException e) {
      throw new InvalidTokenException(TokenFailureReason.MALFORMED, e);
    }
    if (header == null || !header.isObject()) {
      throw new InvalidTokenException(TokenFailureReason.MALFORMED);
    }

    JsonNode alg = header.get("alg");
    if (alg == null || !alg.isTextual() || !EXPECTED_ALG.equals(alg.asText())) {
      log.debug("[JWT] rejected algorithm: {}", alg);
      throw new InvalidTokenException(TokenFailureReason.BAD_SIGNATURE);
    }
  }

  /**
   * 서명 세그먼트는 정규 base64url이어야 합니다.
   *
   * <p>디코더는 마지막 문자의 남는 비트와 앞뒤의 허용되지 않는 문자를 무시하므로, 디코딩 후 재인코딩한 값이 원문과 다르면 변조로 봅니다.
   */
  private void requireCanonicalSignature(String token) {
    int lastDot = token.lastIndexOf('.');
    if (lastDot == token.indexOf('.')) {
      throw new InvalidTokenException(TokenFailureReason.MALFORMED);
    }
    String signature = token.substring(lastDot + 1);
    if (signature.isEmpty()) {
      throw new InvalidTokenException(TokenFailureReason.BAD_SIGNATURE);
    }

    String canonical;
    try {
      canonical = Encoders.BASE64URL.encode(Decoders.BASE64URL.decode(signature));
    } catch (RuntimeException e) {
      throw new InvalidTokenException(TokenFailureReason.BAD_SIGNATURE, e);
    }
    if (!canonical.equals(signature)) {
      log.debug("[JWT] non-canonical signature encoding");
      throw new InvalidTokenException(TokenFailureReason.BAD_SIGNATURE);
    }
  }

  private TokenClaims toTokenClaims(Claims claims) {
    try {
      TokenKind kind = TokenKind.fromClaim(claims.get(CLAIM_KIND, String.class));
      if (kind == null) {
        throw malformed("unknown kind");
      }
      if (!settings.issuer().equals(claims.getIssuer())) {
        throw malformed("issuer mismatch");
      }

      long principalId = requireUid(claims);
      String subject = claims.getSubject();
      if (subject == null || Long.parseLong(subject) != principalId) {
        throw malformed("subject mismatch");
      }

      String handle = requireText(claims.get(CLAIM_HANDLE, String.class), CLAIM_HANDLE);
      String tokenId = requireText(claims.getId(), "jti");
      String email = claims.get(CLAIM_EMAIL, String.class);
      String familyId = claims.get(CLAIM_FAMILY, String.class);
      if (kind == TokenKind.REFRESH) {
        requireText(familyId, CLAIM_FAMILY);
      }

      Date issuedAt = claims.getIssuedAt();
      Date notBefore = claims.getNotBefore();
      Date expiresAt = claims.getExpiration();
      if (issuedAt == null || notBefore == null || expiresAt == null) {
        throw malformed("missing timestamp");
      }

      return new TokenClaims(
          principalId,
          handle,
          email,
          readRoles(claims.get(CLAIM_ROLES)),
          kind,
          issuedAt.toInstant(),
          notBefore.toInstant(),
          expiresAt.toInstant(),
          claims.getIssuer(),
          subject,
          tokenId,
          kind == TokenKind.REFRESH ? familyId : null);
    } catch (InvalidTokenException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new InvalidTokenException(TokenFailureReason.MALFORMED, e);
    }
  }

  private void requireWithinValidity(TokenClaims claims) {
    Duration lifetime = Duration.between(claims.issuedAt(), claims.expiresAt());
    if (lifetime.compareTo(settings.maxLifetimeFor(claims.kind())) > 0) {
      throw malformed("lifetime exceeds maximum");
    }

    Instant now = clock.instant();
    if (now.isBefore(claims.notBefore())) {
      throw new InvalidTokenException(TokenFailureReason.NOT_YET_VALID);
    }
    if (!now.isBefore(claims.expiresAt())) {
      throw new InvalidTokenException(TokenFailureReason.EXPIRED);
    }
  }

  private static long requireUid(Claims claims) {
    Object uid = claims.get(CLAIM_UID);
    if (uid instanceof Integer || uid instanceof Long) {
      return ((Number) uid).longValue();
    }
    throw malformed("uid");
  }

  private static String requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw malformed(name);
    }
    return value;
  }

  private static List<String> readRoles(Object raw) {
    if (raw == null) {
      return List.of();
    }
    if (!(raw instanceof List<?> values)) {
      throw malformed(CLAIM_ROLES);
    }
    List<String> roles = new ArrayList<>(values.size());
    for (Object value : values) {
      if (!(value instanceof String role)) {
        throw malformed(CLAIM_ROLES);
      }
      roles.add(role);
    }
    return roles;
  }

  private static InvalidTokenException malformed(String detail) {
    log.debug("[JWT] malformed claims: {}", detail);
    return new InvalidTokenException(TokenFailureReason.MALFORMED);
  }
}
