package venio.gate.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 게이트 전 구간에서 공유하는 에러 코드
 *
 * <p>클라이언트에 노출되는 메시지는 일반화된 문구만 사용합니다. 토큰 실패 사유(만료, 서명 불일치 등)는 {@link
 * TokenFailureReason}으로 로그와 메트릭에만 남깁니다.
 */
@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {
  // === Client Errors (4xx) ===
  INVALID_INPUT_VALUE("C001", "잘못된 입력값입니다: %s", HttpStatus.BAD_REQUEST),
  UNAUTHENTICATED("A001", "인증이 필요합니다.", HttpStatus.UNAUTHORIZED),
  FORBIDDEN("A002", "접근 권한이 없습니다.", HttpStatus.FORBIDDEN),
  TOKEN_ALREADY_USED("A003", "인증이 필요합니다.", HttpStatus.UNAUTHORIZED),
  PRINCIPAL_INACTIVE("A004", "인증이 필요합니다.", HttpStatus.UNAUTHORIZED),
  RATE_LIMITED("R001", "요청 한도를 초과했습니다. %s초 후 다시 시도해주세요.", HttpStatus.TOO_MANY_REQUESTS),

  // === Server Errors (5xx) ===
  INTERNAL_SERVER_ERROR("S001", "서버 내부 오류가 발생했습니다.", HttpStatus.INTERNAL_SERVER_ERROR),
  CONFIGURATION_ERROR("S002", "설정 오류 (%s)", HttpStatus.INTERNAL_SERVER_ERROR),
  STORE_UNAVAILABLE("S003", "일시적으로 서비스를 이용할 수 없습니다.", HttpStatus.SERVICE_UNAVAILABLE);

  private final String code;
  private final String message;
  private final HttpStatus status;
}
