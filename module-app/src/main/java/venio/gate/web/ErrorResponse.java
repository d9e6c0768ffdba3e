package venio.gate.web;

import java.time.LocalDateTime;
import lombok.Builder;
import venio.gate.error.ErrorCode;

/** 게이트 거부 응답 본문. 공통 코드와 기본 메시지만 담습니다. */
public record ErrorResponse(int status, String code, String message, LocalDateTime timestamp) {

  @Builder
  public ErrorResponse {}

  public static ErrorResponse of(ErrorCode errorCode, String message) {
    return ErrorResponse.builder()
        .status(errorCode.getStatus().value())
        .code(errorCode.getCode())
        .message(message)
        .timestamp(LocalDateTime.now())
        .build();
  }
}
