package venio.gate.auth;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.Locale;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import venio.gate.config.PermissionProperties;
import venio.gate.core.concurrency.Deadline;
import venio.gate.core.domain.model.TokenClaims;
import venio.gate.error.exception.InvalidTokenException;
import venio.gate.error.exception.PermissionDeniedException;
import venio.gate.error.exception.RateLimitExceededException;
import venio.gate.error.exception.StoreUnavailableException;
import venio.gate.error.exception.UnauthenticatedException;
import venio.gate.infrastructure.ratelimit.ConsumeResult;
import venio.gate.infrastructure.ratelimit.FailureMode;
import venio.gate.infrastructure.util.LogMasking;
import venio.gate.permission.PermissionResolver;
import venio.gate.ratelimit.RateLimiterRegistry;
import venio.gate.ratelimit.RateLimiterRegistry.RouteLimiter;
import venio.gate.token.TokenService;

/**
 * 요청 단위 인증/인가 게이트
 *
 * <h4>처리 순서</h4>
 *
 * <ol>
 *   <li>인증 전 IP 기준 거친 한도 (토큰 파서 대상 무차별 대입 제한)
 *   <li>Bearer 토큰 추출 + 검증, ACCESS 토큰만 허용
 *   <li>필요 권한 확인 (현재 권한 집합 기준)
 *   <li>경로 등급별 한도 ({@code p:<principalId>} 또는 {@code a:<address>})
 * </ol>
 *
 * <p>인증이 인가보다, 인가가 경로 한도보다 먼저입니다. 인증되지 않은 요청이 신뢰된 식별자의 한도를 소모하지 않습니다.
 *
 * <p>세부 거부 사유는 로그와 {@code auth.gate.decision} 메트릭에만 남고, 판정에는 {@link GateOutcome}만 노출됩니다.
 */
@Slf4j
@Component
public class AuthGate {

  private final RateLimiterRegistry registry;
  private final TokenService tokenService;
  private final PermissionResolver permissionResolver;
  private final FailureMode permissionFailureMode;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  public AuthGate(
      RateLimiterRegistry registry,
      TokenService tokenService,
      PermissionResolver permissionResolver,
      PermissionProperties permissionProperties,
      MeterRegistry meterRegistry,
      Clock clock) {
    this.registry = registry;
    this.tokenService = tokenService;
    this.permissionResolver = permissionResolver;
    this.permissionFailureMode = permissionProperties.failureModeValue();
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  /** 인증이 필요한 경로의 판정 */
  public GateDecision authorize(GateRequest request) {
    Deadline deadline = request.deadline();

    ConsumeResult ipResult = checkAddressLimit(registry.ip(), request);
    if (!ipResult.allowed()) {
      return reject(request, limitOutcome(ipResult), "ip_limit", ipResult);
    }

    Optional<String> token = BearerTokenExtractor.extract(request.authorization());
    if (token.isEmpty()) {
      return reject(request, GateOutcome.UNAUTHENTICATED, "missing_token", null);
    }

    TokenClaims claims;
    try {
      claims = tokenService.validate(token.get());
    } catch (InvalidTokenException e) {
      return reject(
          request,
          GateOutcome.UNAUTHENTICATED,
          e.getReason().name().toLowerCase(Locale.ROOT),
          null);
    }
    if (!claims.isAccess()) {
      return reject(request, GateOutcome.UNAUTHENTICATED, "not_access_token", null);
    }

    if (request.requiresPermission()) {
      Optional<GateDecision> denied = checkPermission(request, claims);
      if (denied.isPresent()) {
        return denied.get();
      }
    }

    RouteLimiter route = registry.forRoute(request.routeClass());
    String routeKey = route.keyFor(claims.principalId(), request.clientAddress());
    ConsumeResult routeResult = route.limiter().allow(deadline, routeKey);
    if (!routeResult.allowed()) {
      return reject(request, limitOutcome(routeResult), "route_limit", routeResult);
    }

    count(GateOutcome.ADMITTED, "ok");
    return GateDecision.admitted(claims, routeResult);
  }

  /**
   * 토큰 없이 통과하는 공개 경로(로그인, 토큰 갱신)의 판정
   *
   * <p>IP 한도와 경로 등급 한도만 적용하며, 경로 한도는 항상 주소 기준입니다.
   */
  public GateDecision admitAnonymous(GateRequest request) {
    ConsumeResult ipResult = checkAddressLimit(registry.ip(), request);
    if (!ipResult.allowed()) {
      return reject(request, limitOutcome(ipResult), "ip_limit", ipResult);
    }

    ConsumeResult routeResult = checkAddressLimit(registry.forRoute(request.routeClass()), request);
    if (!routeResult.allowed()) {
      return reject(request, limitOutcome(routeResult), "route_limit", routeResult);
    }

    count(GateOutcome.ADMITTED, "anonymous");
    return GateDecision.admitted(null, routeResult);
  }

  /**
   * 거부 판정을 대응하는 클라이언트/서버 예외로 변환합니다.
   *
   * @return ADMITTED 판정
   */
  public GateDecision authorizeOrThrow(GateRequest request) {
    GateDecision decision = authorize(request);
    return switch (decision.outcome()) {
      case ADMITTED -> decision;
      case UNAUTHENTICATED -> throw new UnauthenticatedException();
      case FORBIDDEN -> throw new PermissionDeniedException(request.requiredPermission());
      case RATE_LIMITED ->
          throw new RateLimitExceededException(
              decision.rateLimit().retryAfterSeconds(clock.instant()),
              decision.rateLimit().limit());
      case UNAVAILABLE -> throw new StoreUnavailableException("authorize", false);
    };
  }

  private ConsumeResult checkAddressLimit(RouteLimiter limiter, GateRequest request) {
    return limiter.limiter().allow(request.deadline(), limiter.addressKey(request.clientAddress()));
  }

  /**
   * 저장소 장애 시: 재시도까지 실패한 경우에만 fail-open 정책을 적용하고, Deadline 만료/취소는 항상 UNAVAILABLE입니다.
   */
  private Optional<GateDecision> checkPermission(GateRequest request, TokenClaims claims) {
    try {
      if (permissionResolver.hasPermission(
          request.deadline(), claims.principalId(), request.requiredPermission())) {
        return Optional.empty();
      }
      return Optional.of(reject(request, GateOutcome.FORBIDDEN, "missing_permission", null));
    } catch (StoreUnavailableException e) {
      if (e.isRetryable() && permissionFailureMode == FailureMode.FAIL_OPEN) {
        log.warn(
            "[AuthGate-FailOpen] permission lookup failed, admitting: principal={}, permission={}",
            claims.principalId(),
            request.requiredPermission());
        meterRegistry.counter("auth.gate.permission.failopen").increment();
        return Optional.empty();
      }
      log.warn(
          "[AuthGate-FailClose] permission lookup failed: principal={}, operation={}, retryable={}",
          claims.principalId(),
          e.getOperation(),
          e.isRetryable());
      return Optional.of(reject(request, GateOutcome.UNAVAILABLE, "permission_store", null));
    }
  }

  /** 장애 정책으로 거부된 결과(remaining &lt; 0)는 한도 초과가 아니라 서비스 불가로 봅니다. */
  private static GateOutcome limitOutcome(ConsumeResult result) {
    return result.degraded() ? GateOutcome.UNAVAILABLE : GateOutcome.RATE_LIMITED;
  }

  private GateDecision reject(
      GateRequest request, GateOutcome outcome, String reason, ConsumeResult rateLimit) {
    count(outcome, reason);
    log.debug(
        "[AuthGate] rejected: outcome={}, reason={}, route={}, address={}",
        outcome,
        reason,
        request.routeClass(),
        LogMasking.maskAddress(request.clientAddress()));
    return GateDecision.rejected(outcome, rateLimit);
  }

  private void count(GateOutcome outcome, String reason) {
    meterRegistry
        .counter("auth.gate.decision", "outcome", outcome.name(), "reason", reason)
        .increment();
  }
}
