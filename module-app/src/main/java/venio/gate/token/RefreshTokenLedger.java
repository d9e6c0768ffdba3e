package venio.gate.token;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import venio.gate.core.concurrency.Deadline;
import venio.gate.core.domain.model.TokenClaims;
import venio.gate.core.port.out.SharedKeyValueStore;

/**
 * Refresh Token 회전 상태 기록부
 *
 * <p>공유 저장소에 두 종류의 키를 둡니다.
 *
 * <pre>
 * {prefix}:jti:{tokenId}     → "used"    (TTL = 토큰 잔여 수명)
 * {prefix}:family:{familyId} → "revoked" (TTL = refresh 수명)
 * </pre>
 *
 * <p>사용 처리는 {@code SET NX} 한 번이라 동시에 같은 토큰을 제출해도 하나만 성공합니다.
 */
@Slf4j
@Component
public class RefreshTokenLedger {

  private static final Duration MIN_TTL = Duration.ofSeconds(1);

  private final SharedKeyValueStore store;
  private final TokenSettings settings;
  private final Clock clock;

  public RefreshTokenLedger(SharedKeyValueStore store, TokenSettings settings, Clock clock) {
    this.store = store;
    this.settings = settings;
    this.clock = clock;
  }

  /**
   * 토큰 ID를 사용 처리합니다.
   *
   * @return 이번 호출이 처음 사용한 경우 true, 이미 사용된 토큰이면 false
   */
  public boolean consume(Deadline deadline, TokenClaims claims) {
    return store.setIfAbsent(deadline, jtiKey(claims.tokenId()), "used", remaining(claims));
  }

  /** Family 전체를 무효화합니다. 이후 같은 family의 토큰은 갱신할 수 없습니다. */
  public void revokeFamily(Deadline deadline, String familyId) {
    store.set(deadline, familyKey(familyId), "revoked", settings.refreshTtl());
    log.warn("[TokenService] refresh family revoked: familyId={}", familyId);
  }

  public boolean isFamilyRevoked(Deadline deadline, String familyId) {
    return store.get(deadline, familyKey(familyId)).isPresent();
  }

  private Duration remaining(TokenClaims claims) {
    Duration left = Duration.between(Instant.now(clock), claims.expiresAt());
    return left.compareTo(MIN_TTL) < 0 ? MIN_TTL : left;
  }

  private String jtiKey(String tokenId) {
    return settings.ledgerKeyPrefix() + ":jti:" + tokenId;
  }

  private String familyKey(String familyId) {
    return settings.ledgerKeyPrefix() + ":family:" + familyId;
  }
}
