package venio.gate.error.exception.base;

import venio.gate.error.ErrorCode;

/**
 * ClientBaseException: 호출자의 요청이 거부될 때 발생하는 4xx 계열 예외입니다. 게이트에서는 인증/인가/한도 초과 판정이 여기에
 * 속하며, 응답에는 일반화된 코드만 실립니다.
 */
public abstract class ClientBaseException extends BaseException {

  public ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  public ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}
