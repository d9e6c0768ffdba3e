package venio.gate.error.exception.base;

import venio.gate.error.ErrorCode;

/**
 * ServerBaseException: 저장소 장애나 잘못된 설정 등 시스템 측 원인으로 발생하는 5xx 계열 예외입니다. 장애 회고를 위해 원인(cause)을
 * 함께 보존합니다.
 */
public abstract class ServerBaseException extends BaseException {

  public ServerBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  public ServerBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  public ServerBaseException(ErrorCode errorCode, Throwable cause) {
    super(errorCode, cause);
  }

  public ServerBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}
