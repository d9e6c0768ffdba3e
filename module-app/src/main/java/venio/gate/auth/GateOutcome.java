package venio.gate.auth;

/** 게이트 판정 결과. 클라이언트에는 이 수준의 구분만 노출됩니다. */
public enum GateOutcome {
  ADMITTED,
  UNAUTHENTICATED,
  FORBIDDEN,
  RATE_LIMITED,
  UNAVAILABLE
}
