package venio.gate.error.exception;

import venio.gate.error.CommonErrorCode;
import venio.gate.error.exception.base.ServerBaseException;

/** 기동 시 설정 검증 실패. 애플리케이션 컨텍스트가 올라오지 않습니다. */
public class ConfigurationException extends ServerBaseException {

  public ConfigurationException(String detail) {
    super(CommonErrorCode.CONFIGURATION_ERROR, detail);
  }
}
