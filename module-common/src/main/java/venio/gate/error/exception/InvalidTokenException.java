package venio.gate.error.exception;

import lombok.Getter;
import venio.gate.error.CommonErrorCode;
import venio.gate.error.TokenFailureReason;
import venio.gate.error.exception.base.ClientBaseException;

/**
 * 토큰 검증 실패 예외
 *
 * <p>{@link #getReason()}는 내부 분류용이며, 응답 코드는 항상 {@link CommonErrorCode#UNAUTHENTICATED}입니다.
 */
@Getter
public class InvalidTokenException extends ClientBaseException {

  private final TokenFailureReason reason;

  public InvalidTokenException(TokenFailureReason reason) {
    super(CommonErrorCode.UNAUTHENTICATED);
    this.reason = reason;
  }

  public InvalidTokenException(TokenFailureReason reason, Throwable cause) {
    this(reason);
    initCause(cause);
  }
}
