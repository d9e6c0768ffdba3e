package venio.gate.error.exception;

import venio.gate.error.CommonErrorCode;
import venio.gate.error.exception.base.ClientBaseException;

public class UnauthenticatedException extends ClientBaseException {

  public UnauthenticatedException() {
    super(CommonErrorCode.UNAUTHENTICATED);
  }
}
