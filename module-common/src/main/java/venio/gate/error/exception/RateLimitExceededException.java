package venio.gate.error.exception;

import lombok.Getter;
import venio.gate.error.CommonErrorCode;
import venio.gate.error.exception.base.ClientBaseException;

/**
 * Rate Limit 초과 예외 (429)
 *
 * <p>응답 헤더 구성을 위해 한도와 재시도 대기 시간을 함께 보관합니다.
 */
@Getter
public class RateLimitExceededException extends ClientBaseException {

  private final long retryAfterSeconds;
  private final long limit;

  public RateLimitExceededException(long retryAfterSeconds, long limit) {
    super(CommonErrorCode.RATE_LIMITED, retryAfterSeconds);
    this.retryAfterSeconds = retryAfterSeconds;
    this.limit = limit;
  }
}
