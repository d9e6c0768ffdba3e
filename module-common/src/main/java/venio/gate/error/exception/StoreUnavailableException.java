package venio.gate.error.exception;

import lombok.Getter;
import venio.gate.error.CommonErrorCode;
import venio.gate.error.exception.base.ServerBaseException;

/**
 * 데이터 저장소(Directory, Shared KV Store) 호출 실패
 *
 * <h4>재시도 가능 여부</h4>
 *
 * <ul>
 *   <li>개별 호출 타임아웃, 연결 오류: retryable
 *   <li>호출자 deadline 만료, 취소, 인터럽트: non-retryable
 * </ul>
 */
@Getter
public class StoreUnavailableException extends ServerBaseException {

  private final String operation;
  private final boolean retryable;

  public StoreUnavailableException(String operation, boolean retryable, Throwable cause) {
    super(CommonErrorCode.STORE_UNAVAILABLE, cause);
    this.operation = operation;
    this.retryable = retryable;
  }

  public StoreUnavailableException(String operation, boolean retryable) {
    super(CommonErrorCode.STORE_UNAVAILABLE);
    this.operation = operation;
    this.retryable = retryable;
  }
}
