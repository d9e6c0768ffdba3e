package venio.gate.core.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * Verified claim set of a session token.
 *
 * <p>Invariant: {@code notBefore <= issuedAt < expiresAt}.
 *
 * @param principalId principal the token was issued to
 * @param handle principal handle at issuance
 * @param email principal email at issuance
 * @param roles role names at issuance (the permission check re-reads live data)
 * @param kind access or refresh
 * @param issuedAt iat
 * @param notBefore nbf
 * @param expiresAt exp
 * @param issuer iss
 * @param subject sub, the decimal principal id
 * @param tokenId jti
 * @param familyId refresh family; {@code null} for access tokens
 */
public record TokenClaims(
    long principalId,
    String handle,
    String email,
    List<String> roles,
    TokenKind kind,
    Instant issuedAt,
    Instant notBefore,
    Instant expiresAt,
    String issuer,
    String subject,
    String tokenId,
    String familyId) {

  public TokenClaims {
    if (kind == null || issuedAt == null || notBefore == null || expiresAt == null) {
      throw new IllegalArgumentException("kind and timestamps are required");
    }
    if (notBefore.isAfter(issuedAt) || !issuedAt.isBefore(expiresAt)) {
      throw new IllegalArgumentException("expected notBefore <= issuedAt < expiresAt");
    }
    roles = roles == null ? List.of() : List.copyOf(roles);
  }

  public boolean isAccess() {
    return kind == TokenKind.ACCESS;
  }

  public boolean isRefresh() {
    return kind == TokenKind.REFRESH;
  }
}
