package venio.gate.error.exception;

import lombok.Getter;
import venio.gate.error.CommonErrorCode;
import venio.gate.error.exception.base.ClientBaseException;

/**
 * 인가 실패 (403)
 *
 * <p>요구 권한은 로그용으로만 보존하고 응답 메시지에는 포함하지 않습니다.
 */
@Getter
public class PermissionDeniedException extends ClientBaseException {

  private final String requiredPermission;

  public PermissionDeniedException(String requiredPermission) {
    super(CommonErrorCode.FORBIDDEN);
    this.requiredPermission = requiredPermission;
  }
}
