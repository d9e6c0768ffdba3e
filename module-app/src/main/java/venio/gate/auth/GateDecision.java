package venio.gate.auth;

import venio.gate.core.domain.model.TokenClaims;
import venio.gate.infrastructure.ratelimit.ConsumeResult;

/**
 * 게이트 판정
 *
 * @param outcome 결과
 * @param claims 검증된 클레임 (ADMITTED이고 인증 경로일 때만)
 * @param rateLimit 마지막으로 평가된 한도 결과 (헤더용, 없으면 null)
 */
public record GateDecision(GateOutcome outcome, TokenClaims claims, ConsumeResult rateLimit) {

  public static GateDecision admitted(TokenClaims claims, ConsumeResult rateLimit) {
    return new GateDecision(GateOutcome.ADMITTED, claims, rateLimit);
  }

  public static GateDecision rejected(GateOutcome outcome, ConsumeResult rateLimit) {
    if (outcome == GateOutcome.ADMITTED) {
      throw new IllegalArgumentException("rejected decision cannot be ADMITTED");
    }
    return new GateDecision(outcome, null, rateLimit);
  }

  public boolean isAdmitted() {
    return outcome == GateOutcome.ADMITTED;
  }
}
