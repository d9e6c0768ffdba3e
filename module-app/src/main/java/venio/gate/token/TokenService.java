package venio.gate.token;

import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import venio.gate.core.concurrency.Deadline;
import venio.gate.core.domain.model.IssuedTokens;
import venio.gate.core.domain.model.Principal;
import venio.gate.core.domain.model.Role;
import venio.gate.core.domain.model.TokenClaims;
import venio.gate.core.domain.model.TokenKind;
import venio.gate.core.port.out.AccessDirectory;
import venio.gate.error.TokenFailureReason;
import venio.gate.error.exception.InvalidTokenException;
import venio.gate.error.exception.PrincipalInactiveException;
import venio.gate.error.exception.TokenAlreadyUsedException;
import venio.gate.infrastructure.util.LogMasking;

/**
 * 세션 토큰 서비스
 *
 * <h4>상태 전이</h4>
 *
 * <pre>
 * Issued → Valid → Expired         (시간 경과)
 *                → Revoked         (rotation 모드에서만)
 * </pre>
 *
 * <h4>Refresh Rotation ({@code auth.jwt.rotation-enabled})</h4>
 *
 * <ol>
 *   <li>Refresh Token 사용 시 jti를 원자적으로 사용 처리 ({@code SET NX})
 *   <li>같은 familyId로 새 Refresh Token 발급
 *   <li>이미 사용된 jti 재제출 시 탈취로 간주하고 Family 전체 무효화
 * </ol>
 *
 * <p>비활성 시 Refresh Token은 만료까지 재사용 가능하며 서버 상태를 두지 않습니다.
 */
@Slf4j
@Service
public class TokenService {

  private final JwtTokenProvider tokenProvider;
  private final TokenSettings settings;
  private final AccessDirectory directory;
  private final RefreshTokenLedger ledger;
  private final Clock clock;
  private final MeterRegistry meterRegistry;
  private final Retry storeReadRetry;

  public TokenService(
      JwtTokenProvider tokenProvider,
      TokenSettings settings,
      AccessDirectory directory,
      RefreshTokenLedger ledger,
      Clock clock,
      MeterRegistry meterRegistry,
      Retry storeReadRetry) {
    this.tokenProvider = tokenProvider;
    this.settings = settings;
    this.directory = directory;
    this.ledger = ledger;
    this.clock = clock;
    this.meterRegistry = meterRegistry;
    this.storeReadRetry = storeReadRetry;
  }

  /**
   * 토큰 1개 발급
   *
   * <p>REFRESH 토큰은 새 Family를 시작합니다.
   */
  public String issue(Principal principal, List<String> roles, TokenKind kind) {
    String familyId = kind == TokenKind.REFRESH ? newId() : null;
    return issue(principal, roles, kind, familyId);
  }

  /** 로그인 응답용 Access + Refresh 쌍 발급 (새 Family) */
  public IssuedTokens issuePair(Principal principal, List<String> roles) {
    String accessToken = issue(principal, roles, TokenKind.ACCESS, null);
    String refreshToken = issue(principal, roles, TokenKind.REFRESH, newId());
    return new IssuedTokens(accessToken, refreshToken);
  }

  /**
   * 토큰 검증
   *
   * @throws InvalidTokenException MALFORMED / BAD_SIGNATURE / EXPIRED / NOT_YET_VALID
   */
  public TokenClaims validate(String token) {
    try {
      TokenClaims claims = tokenProvider.verify(token);
      countValidation("valid");
      return claims;
    } catch (InvalidTokenException e) {
      countValidation(e.getReason().name().toLowerCase(Locale.ROOT));
      log.debug(
          "[TokenService] validation failed: reason={}, token={}",
          e.getReason(),
          LogMasking.maskToken(token));
      throw e;
    }
  }

  /**
   * Refresh Token으로 새 토큰 발급
   *
   * <p>활성 상태, principal 속성, 역할은 저장소에서 다시 읽습니다. 재시도 가능한 저장소 오류는 권한 조회와 같은 정책으로
   * 재시도합니다. rotation 비활성 시 제출된 Refresh Token을 그대로 돌려줍니다.
   *
   * @throws InvalidTokenException 검증 실패 또는 REFRESH 토큰이 아님
   * @throws TokenAlreadyUsedException 이미 사용되었거나 무효화된 Family (rotation 모드)
   * @throws PrincipalInactiveException 비활성 또는 알 수 없는 principal
   */
  public IssuedTokens refresh(Deadline deadline, String refreshToken) {
    TokenClaims claims = requireRefresh(validate(refreshToken));

    if (settings.rotationEnabled() && ledger.isFamilyRevoked(deadline, claims.familyId())) {
      log.warn(
          "[TokenService] refresh on revoked family: principal={}, familyId={}",
          claims.principalId(),
          claims.familyId());
      throw new TokenAlreadyUsedException();
    }

    long principalId = claims.principalId();
    if (!readStore(() -> directory.isPrincipalActive(deadline, principalId))) {
      throw new PrincipalInactiveException(principalId);
    }
    Principal principal =
        readStore(() -> directory.findPrincipal(deadline, principalId))
            .orElseThrow(() -> new PrincipalInactiveException(principalId));
    List<String> roles =
        readStore(() -> directory.getRolesForPrincipal(deadline, principalId)).stream()
            .map(Role::name)
            .toList();

    if (!settings.rotationEnabled()) {
      return new IssuedTokens(issue(principal, roles, TokenKind.ACCESS, null), refreshToken);
    }

    if (!ledger.consume(deadline, claims)) {
      log.warn(
          "[TokenService] refresh token reuse detected, possible theft: principal={}, familyId={}",
          principalId,
          claims.familyId());
      ledger.revokeFamily(deadline, claims.familyId());
      throw new TokenAlreadyUsedException();
    }

    return new IssuedTokens(
        issue(principal, roles, TokenKind.ACCESS, null),
        issue(principal, roles, TokenKind.REFRESH, claims.familyId()));
  }

  /**
   * 로그아웃: Refresh Token의 Family를 무효화합니다.
   *
   * <p>rotation 비활성 시 서버 상태가 없으므로 아무 것도 하지 않습니다 (토큰은 만료까지 유효).
   */
  public void revoke(Deadline deadline, String refreshToken) {
    TokenClaims claims = requireRefresh(validate(refreshToken));
    if (!settings.rotationEnabled()) {
      log.info(
          "[TokenService] revoke ignored, rotation disabled: principal={}", claims.principalId());
      return;
    }
    ledger.consume(deadline, claims);
    ledger.revokeFamily(deadline, claims.familyId());
  }

  private String issue(Principal principal, List<String> roles, TokenKind kind, String familyId) {
    Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
    TokenClaims claims =
        new TokenClaims(
            principal.id(),
            principal.handle(),
            principal.email(),
            roles,
            kind,
            now,
            now,
            now.plus(settings.ttlFor(kind)),
            settings.issuer(),
            Long.toString(principal.id()),
            newId(),
            familyId);
    return tokenProvider.sign(claims);
  }

  private <T> T readStore(Supplier<T> call) {
    return Retry.decorateSupplier(storeReadRetry, call).get();
  }

  private static TokenClaims requireRefresh(TokenClaims claims) {
    if (!claims.isRefresh()) {
      log.debug("[TokenService] expected refresh token, got {}", claims.kind());
      throw new InvalidTokenException(TokenFailureReason.MALFORMED);
    }
    return claims;
  }

  private void countValidation(String result) {
    meterRegistry.counter("auth.token.validate", "result", result).increment();
  }

  private static String newId() {
    return UUID.randomUUID().toString();
  }
}
