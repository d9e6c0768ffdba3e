package venio.gate.error;

/**
 * 토큰 검증 실패 사유
 *
 * <p>내부 로깅/메트릭 전용입니다. 클라이언트에는 {@link CommonErrorCode#UNAUTHENTICATED}만 노출합니다.
 */
public enum TokenFailureReason {
  /** 구조 손상, 필수 claim 누락, 알 수 없는 kind/issuer */
  MALFORMED,
  /** 서명 불일치 또는 허용되지 않은 알고리즘 (alg=none 포함) */
  BAD_SIGNATURE,
  /** now >= exp */
  EXPIRED,
  /** now < nbf */
  NOT_YET_VALID
}
