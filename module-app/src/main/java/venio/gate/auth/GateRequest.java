package venio.gate.auth;

import java.util.Objects;
import venio.gate.core.concurrency.Deadline;
import venio.gate.ratelimit.RouteClass;

/**
 * 게이트 입력
 *
 * @param deadline 요청 전체 시간 제한
 * @param authorization Authorization 헤더 원문 (null 가능)
 * @param clientAddress 클라이언트 주소
 * @param routeClass 경로 등급
 * @param requiredPermission 필요한 권한 (null이면 인증만 확인)
 */
public record GateRequest(
    Deadline deadline,
    String authorization,
    String clientAddress,
    RouteClass routeClass,
    String requiredPermission) {

  public GateRequest {
    Objects.requireNonNull(deadline, "deadline");
    Objects.requireNonNull(routeClass, "routeClass");
    if (clientAddress == null || clientAddress.isBlank()) {
      clientAddress = "unknown";
    }
  }

  public boolean requiresPermission() {
    return requiredPermission != null && !requiredPermission.isBlank();
  }
}
