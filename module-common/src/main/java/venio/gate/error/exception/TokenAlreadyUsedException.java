package venio.gate.error.exception;

import venio.gate.error.CommonErrorCode;
import venio.gate.error.exception.base.ClientBaseException;

/** 이미 사용(회전)된 refresh token 재사용 또는 폐기된 token family 접근 */
public class TokenAlreadyUsedException extends ClientBaseException {

  public TokenAlreadyUsedException() {
    super(CommonErrorCode.TOKEN_ALREADY_USED);
  }
}
