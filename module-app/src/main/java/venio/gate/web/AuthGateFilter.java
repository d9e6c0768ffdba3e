package venio.gate.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;
import venio.gate.auth.AuthGate;
import venio.gate.auth.GateDecision;
import venio.gate.auth.GateRequest;
import venio.gate.config.GateRouteProperties;
import venio.gate.core.concurrency.Deadline;
import venio.gate.error.CommonErrorCode;
import venio.gate.infrastructure.ratelimit.ConsumeResult;
import venio.gate.ratelimit.RouteClass;

/**
 * {@link AuthGate} 서블릿 어댑터
 *
 * <h4>처리 흐름</h4>
 *
 * <ol>
 *   <li>bypass 경로는 그대로 통과
 *   <li>첫 번째로 일치한 경로 규칙으로 등급/필요 권한 결정 (없으면 인증 필수 + GENERAL)
 *   <li>판정을 401/403/429/503 으로 변환, 한도 헤더 부착
 *   <li>통과 시 검증된 클레임을 요청 속성 {@value #CLAIMS_ATTRIBUTE}에 저장
 * </ol>
 *
 * <p>요청마다 {@code gate.store.request-timeout} 기준 {@link Deadline}을 만듭니다. 동기 서블릿 필터는 클라이언트 연결 종료를
 * 관찰하지 못하므로 이 경로에서는 만료만 적용되고 {@link Deadline#cancel()}은 직접 호출하는 쪽에서 사용합니다.
 *
 * <p>@Component 대신 {@code FilterRegistrationBean}으로 등록합니다.
 */
@Slf4j
public class AuthGateFilter extends OncePerRequestFilter {

  public static final String CLAIMS_ATTRIBUTE = "venio.gate.claims";

  static final String HEADER_LIMIT = "X-RateLimit-Limit";
  static final String HEADER_REMAINING = "X-RateLimit-Remaining";
  static final String HEADER_RESET = "X-RateLimit-Reset";

  private final AuthGate authGate;
  private final GateRouteProperties routeProperties;
  private final ClientAddressResolver addressResolver;
  private final Clock clock;
  private final Duration requestTimeout;
  private final ObjectMapper objectMapper;
  private final AntPathMatcher pathMatcher = new AntPathMatcher();

  public AuthGateFilter(
      AuthGate authGate,
      GateRouteProperties routeProperties,
      ClientAddressResolver addressResolver,
      Clock clock,
      Duration requestTimeout,
      ObjectMapper objectMapper) {
    this.authGate = authGate;
    this.routeProperties = routeProperties;
    this.addressResolver = addressResolver;
    this.clock = clock;
    this.requestTimeout = requestTimeout;
    this.objectMapper = objectMapper;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getRequestURI();
    return routeProperties.getBypassPaths().stream()
        .anyMatch(pattern -> pathMatcher.match(pattern, path));
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {

    GateRouteProperties.Rule rule = matchRule(request.getRequestURI());
    GateRequest gateRequest =
        new GateRequest(
            Deadline.after(clock, requestTimeout),
            request.getHeader(HttpHeaders.AUTHORIZATION),
            addressResolver.resolve(request),
            rule == null ? RouteClass.GENERAL : rule.getRouteClass(),
            rule == null ? null : rule.getPermission());

    boolean authenticated = rule == null || rule.isAuthenticated();
    GateDecision decision =
        authenticated ? authGate.authorize(gateRequest) : authGate.admitAnonymous(gateRequest);

    addRateLimitHeaders(response, decision.rateLimit());
    if (!decision.isAdmitted()) {
      writeRejection(response, decision);
      return;
    }

    if (decision.claims() != null) {
      request.setAttribute(CLAIMS_ATTRIBUTE, decision.claims());
    }
    filterChain.doFilter(request, response);
  }

  private GateRouteProperties.Rule matchRule(String path) {
    List<GateRouteProperties.Rule> rules = routeProperties.getRoutes();
    for (GateRouteProperties.Rule rule : rules) {
      if (pathMatcher.match(rule.getPattern(), path)) {
        return rule;
      }
    }
    return null;
  }

  /** 장애 정책으로 결정된 결과(remaining &lt; 0)에는 한도 헤더를 붙이지 않습니다. */
  private void addRateLimitHeaders(HttpServletResponse response, ConsumeResult result) {
    if (result == null || result.degraded()) {
      return;
    }
    response.setHeader(HEADER_LIMIT, String.valueOf(result.limit()));
    response.setHeader(HEADER_REMAINING, String.valueOf(result.remaining()));
    response.setHeader(HEADER_RESET, String.valueOf(result.resetAt().getEpochSecond()));
  }

  private void writeRejection(HttpServletResponse response, GateDecision decision)
      throws IOException {
    ErrorResponse body =
        switch (decision.outcome()) {
          case UNAUTHENTICATED -> ErrorResponse.of(
              CommonErrorCode.UNAUTHENTICATED, CommonErrorCode.UNAUTHENTICATED.getMessage());
          case FORBIDDEN -> ErrorResponse.of(
              CommonErrorCode.FORBIDDEN, CommonErrorCode.FORBIDDEN.getMessage());
          case RATE_LIMITED -> rateLimited(response, decision.rateLimit());
          case UNAVAILABLE -> ErrorResponse.of(
              CommonErrorCode.STORE_UNAVAILABLE, CommonErrorCode.STORE_UNAVAILABLE.getMessage());
          case ADMITTED -> throw new IllegalStateException("admitted decision is not a rejection");
        };

    response.setStatus(body.status());
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.setCharacterEncoding("UTF-8");
    objectMapper.writeValue(response.getWriter(), body);
  }

  private ErrorResponse rateLimited(HttpServletResponse response, ConsumeResult result) {
    long retryAfter = result.retryAfterSeconds(clock.instant());
    response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfter));
    log.warn("[RateLimit-Exceeded] Retry-After={}s", retryAfter);
    return ErrorResponse.of(
        CommonErrorCode.RATE_LIMITED,
        String.format(CommonErrorCode.RATE_LIMITED.getMessage(), retryAfter));
  }
}
