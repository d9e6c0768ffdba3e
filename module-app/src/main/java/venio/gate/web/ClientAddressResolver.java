package venio.gate.web;

import jakarta.servlet.http.HttpServletRequest;
import java.util.List;

/**
 * 클라이언트 주소 추출
 *
 * <p>신뢰할 수 있는 프록시 헤더를 순서대로 확인하고, 없으면 직접 연결 주소를 사용합니다. X-Forwarded-For는 첫 번째 항목만 사용합니다.
 */
public class ClientAddressResolver {

  private final List<String> trustedHeaders;

  public ClientAddressResolver(List<String> trustedHeaders) {
    this.trustedHeaders = List.copyOf(trustedHeaders);
  }

  public String resolve(HttpServletRequest request) {
    for (String header : trustedHeaders) {
      String value = request.getHeader(header);
      if (value != null && !value.isBlank()) {
        String address = value.split(",")[0].trim();
        if (!address.isBlank()) {
          return address;
        }
      }
    }
    return request.getRemoteAddr();
  }
}
