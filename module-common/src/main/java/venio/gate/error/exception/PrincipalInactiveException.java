package venio.gate.error.exception;

import lombok.Getter;
import venio.gate.error.CommonErrorCode;
import venio.gate.error.exception.base.ClientBaseException;

/** 비활성화된 principal의 refresh 시도 */
@Getter
public class PrincipalInactiveException extends ClientBaseException {

  private final long principalId;

  public PrincipalInactiveException(long principalId) {
    super(CommonErrorCode.PRINCIPAL_INACTIVE);
    this.principalId = principalId;
  }
}
