package venio.gate.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;

import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import venio.gate.config.PermissionProperties;
import venio.gate.config.ResilienceConfig;
import venio.gate.config.RateLimitProperties;
import venio.gate.config.RateLimitProperties.Policy;
import venio.gate.core.concurrency.Deadline;
import venio.gate.core.domain.model.IssuedTokens;
import venio.gate.core.domain.model.Principal;
import venio.gate.core.port.out.SharedKeyValueStore;
import venio.gate.core.support.MutableClock;
import venio.gate.error.exception.PermissionDeniedException;
import venio.gate.error.exception.RateLimitExceededException;
import venio.gate.error.exception.StoreUnavailableException;
import venio.gate.error.exception.UnauthenticatedException;
import venio.gate.infrastructure.executor.DefaultLogicExecutor;
import venio.gate.infrastructure.persistence.InMemoryAccessDirectory;
import venio.gate.infrastructure.ratelimit.FailureMode;
import venio.gate.infrastructure.ratelimit.RateLimitBackend;
import venio.gate.infrastructure.ratelimit.RateLimiterFactory;
import venio.gate.infrastructure.store.InMemorySharedKeyValueStore;
import venio.gate.permission.PermissionResolver;
import venio.gate.ratelimit.KeyStrategy;
import venio.gate.ratelimit.RateLimiterRegistry;
import venio.gate.ratelimit.RouteClass;
import venio.gate.token.JwtTokenProvider;
import venio.gate.token.RefreshTokenLedger;
import venio.gate.token.TokenService;
import venio.gate.token.TokenSettings;

@Tag("unit")
@DisplayName("AuthGate 테스트")
class AuthGateTest {

  private static final String SECRET = "test-secret-venio-gate-0123456789abcdef";
  private static final String ADDRESS = "203.0.113.7";

  private MutableClock clock;
  private SimpleMeterRegistry meterRegistry;
  private TokenService tokenService;
  private PermissionResolver permissionResolver;
  private Principal alice;
  private IssuedTokens tokens;

  @BeforeEach
  void setUp() {
    clock = MutableClock.at("2026-01-01T00:00:00Z");
    meterRegistry = new SimpleMeterRegistry();
    InMemoryAccessDirectory directory = new InMemoryAccessDirectory();
    alice = directory.savePrincipal("alice", "alice@venio.dev", true);

    TokenSettings settings =
        new TokenSettings(
            SECRET.getBytes(StandardCharsets.UTF_8),
            "venio",
            Duration.ofMinutes(15),
            Duration.ofDays(7),
            Duration.ofHours(24),
            Duration.ofDays(30),
            false,
            "{auth}:refresh");
    tokenService =
        new TokenService(
            new JwtTokenProvider(settings, clock),
            settings,
            directory,
            new RefreshTokenLedger(new InMemorySharedKeyValueStore(clock), settings, clock),
            clock,
            meterRegistry,
            Retry.of(
                ResilienceConfig.STORE_READ,
                ResilienceConfig.storeReadRetryConfig(Duration.ofMillis(1))));
    tokens = tokenService.issuePair(alice, List.of("user"));
    permissionResolver = mock(PermissionResolver.class);
  }

  private RateLimitProperties limits(int ipLimit, int generalLimit) {
    RateLimitProperties properties = new RateLimitProperties();
    properties.setIp(new Policy(ipLimit, Duration.ofMinutes(1), KeyStrategy.ADDRESS));
    properties.setGeneral(new Policy(generalLimit, Duration.ofMinutes(1), KeyStrategy.PRINCIPAL));
    return properties;
  }

  private AuthGate gate(RateLimiterFactory factory, RateLimitProperties limits, String permMode) {
    PermissionProperties permissionProperties = new PermissionProperties();
    permissionProperties.setFailureMode(permMode);
    return new AuthGate(
        new RateLimiterRegistry(factory, limits),
        tokenService,
        permissionResolver,
        permissionProperties,
        meterRegistry,
        clock);
  }

  private RateLimiterFactory memoryFactory() {
    return new RateLimiterFactory(
        RateLimitBackend.MEMORY,
        FailureMode.FAIL_OPEN,
        "{ratelimit}",
        2,
        null,
        new DefaultLogicExecutor(meterRegistry),
        meterRegistry,
        clock);
  }

  private AuthGate gate(int ipLimit, int generalLimit, String permissionFailureMode) {
    return gate(memoryFactory(), limits(ipLimit, generalLimit), permissionFailureMode);
  }

  private GateRequest request(String authorization, String permission) {
    return new GateRequest(
        Deadline.after(clock, Duration.ofSeconds(5)),
        authorization,
        ADDRESS,
        RouteClass.GENERAL,
        permission);
  }

  private String bearer(String token) {
    return "Bearer " + token;
  }

  private double decisions(GateOutcome outcome, String reason) {
    return meterRegistry
        .counter("auth.gate.decision", "outcome", outcome.name(), "reason", reason)
        .count();
  }

  @Nested
  @DisplayName("인증")
  class Authentication {

    @Test
    @DisplayName("유효한 access 토큰이면 클레임과 함께 통과한다")
    void admitsValidAccessToken() {
      GateDecision decision =
          gate(10, 10, "fail-close").authorize(request(bearer(tokens.accessToken()), null));

      assertThat(decision.isAdmitted()).isTrue();
      assertThat(decision.claims().principalId()).isEqualTo(alice.id());
      assertThat(decision.rateLimit().remaining()).isEqualTo(9);
      then(permissionResolver).shouldHaveNoInteractions();
    }

    @Test
    @DisplayName("토큰이 없으면 UNAUTHENTICATED")
    void missingToken() {
      GateDecision decision = gate(10, 10, "fail-close").authorize(request(null, null));

      assertThat(decision.outcome()).isEqualTo(GateOutcome.UNAUTHENTICATED);
      assertThat(decision.claims()).isNull();
      assertThat(decisions(GateOutcome.UNAUTHENTICATED, "missing_token")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("만료된 토큰은 사유를 메트릭에만 남긴다")
    void expiredToken() {
      AuthGate gate = gate(10, 10, "fail-close");
      clock.advance(Duration.ofMinutes(15));

      GateDecision decision = gate.authorize(request(bearer(tokens.accessToken()), null));

      assertThat(decision.outcome()).isEqualTo(GateOutcome.UNAUTHENTICATED);
      assertThat(decisions(GateOutcome.UNAUTHENTICATED, "expired")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("refresh 토큰으로는 보호 경로에 접근할 수 없다")
    void refreshTokenRejected() {
      GateDecision decision =
          gate(10, 10, "fail-close").authorize(request(bearer(tokens.refreshToken()), null));

      assertThat(decision.outcome()).isEqualTo(GateOutcome.UNAUTHENTICATED);
      assertThat(decisions(GateOutcome.UNAUTHENTICATED, "not_access_token")).isEqualTo(1.0);
    }
  }

  @Nested
  @DisplayName("처리 순서")
  class Ordering {

    @Test
    @DisplayName("IP 한도는 토큰 검증보다 먼저 적용된다")
    void ipLimitBeforeToken() {
      AuthGate gate = gate(2, 10, "fail-close");
      gate.authorize(request("Bearer garbage", null));
      gate.authorize(request("Bearer garbage", null));

      GateDecision decision = gate.authorize(request(bearer(tokens.accessToken()), null));

      assertThat(decision.outcome()).isEqualTo(GateOutcome.RATE_LIMITED);
      assertThat(decision.rateLimit().remaining()).isZero();
      assertThat(decisions(GateOutcome.RATE_LIMITED, "ip_limit")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("인증 실패 요청은 principal 경로 한도를 소모하지 않는다")
    void rejectedRequestsDoNotConsumeRouteLimit() {
      AuthGate gate = gate(100, 1, "fail-close");
      gate.authorize(request("Bearer garbage", null));
      gate.authorize(request(null, null));

      assertThat(gate.authorize(request(bearer(tokens.accessToken()), null)).isAdmitted())
          .isTrue();
    }

    @Test
    @DisplayName("권한이 없으면 FORBIDDEN이며 경로 한도를 소모하지 않는다")
    void forbiddenBeforeRouteLimit() {
      given(permissionResolver.hasPermission(any(), eq(alice.id()), eq("users:delete")))
          .willReturn(false);
      given(permissionResolver.hasPermission(any(), eq(alice.id()), eq("users:read")))
          .willReturn(true);
      AuthGate gate = gate(100, 1, "fail-close");

      String header = bearer(tokens.accessToken());
      GateDecision denied = gate.authorize(request(header, "users:delete"));
      GateDecision admitted = gate.authorize(request(header, "users:read"));

      assertThat(denied.outcome()).isEqualTo(GateOutcome.FORBIDDEN);
      assertThat(admitted.isAdmitted()).isTrue();
    }
  }

  @Nested
  @DisplayName("경로 한도")
  class RouteLimit {

    @Test
    @DisplayName("한도를 넘으면 RATE_LIMITED와 한도 메타데이터를 돌려준다")
    void routeLimitExceeded() {
      AuthGate gate = gate(100, 2, "fail-close");
      String header = bearer(tokens.accessToken());
      gate.authorize(request(header, null));
      gate.authorize(request(header, null));

      GateDecision decision = gate.authorize(request(header, null));

      assertThat(decision.outcome()).isEqualTo(GateOutcome.RATE_LIMITED);
      assertThat(decision.rateLimit().limit()).isEqualTo(2);
      assertThat(decision.rateLimit().retryAfterSeconds(clock.instant())).isBetween(1L, 60L);
    }

    @Test
    @DisplayName("공유 저장소 장애 + fail-close는 RATE_LIMITED가 아니라 UNAVAILABLE")
    void degradedLimiterIsUnavailable() {
      SharedKeyValueStore store = mock(SharedKeyValueStore.class);
      given(store.incrementWithExpiry(any(), anyString(), any()))
          .willThrow(new StoreUnavailableException("incr", true));
      RateLimiterFactory factory =
          new RateLimiterFactory(
              RateLimitBackend.REDIS,
              FailureMode.FAIL_CLOSE,
              "{ratelimit}",
              2,
              store,
              new DefaultLogicExecutor(meterRegistry),
              meterRegistry,
              clock);

      GateDecision decision =
          gate(factory, limits(10, 10), "fail-close")
              .authorize(request(bearer(tokens.accessToken()), null));

      assertThat(decision.outcome()).isEqualTo(GateOutcome.UNAVAILABLE);
      assertThat(decision.rateLimit().degraded()).isTrue();
    }

    @Test
    @DisplayName("공개 경로는 주소 기준 한도만 적용한다")
    void anonymousRoute() {
      AuthGate gate = gate(100, 10, "fail-close");
      GateRequest login =
          new GateRequest(
              Deadline.after(clock, Duration.ofSeconds(5)), null, ADDRESS, RouteClass.AUTH, null);
      for (int i = 0; i < 5; i++) {
        assertThat(gate.admitAnonymous(login).isAdmitted()).isTrue();
      }

      GateDecision decision = gate.admitAnonymous(login);

      assertThat(decision.outcome()).isEqualTo(GateOutcome.RATE_LIMITED);
      assertThat(decision.claims()).isNull();
    }
  }

  @Nested
  @DisplayName("권한 저장소 장애")
  class PermissionStoreFailure {

    @Test
    @DisplayName("fail-close면 UNAVAILABLE")
    void failClose() {
      given(permissionResolver.hasPermission(any(), anyLong(), anyString()))
          .willThrow(new StoreUnavailableException("roles", true));

      GateDecision decision =
          gate(10, 10, "fail-close")
              .authorize(request(bearer(tokens.accessToken()), "users:read"));

      assertThat(decision.outcome()).isEqualTo(GateOutcome.UNAVAILABLE);
    }

    @Test
    @DisplayName("fail-open이면 재시도 소진 오류에 한해 통과시킨다")
    void failOpen() {
      given(permissionResolver.hasPermission(any(), anyLong(), anyString()))
          .willThrow(new StoreUnavailableException("roles", true));

      GateDecision decision =
          gate(10, 10, "fail-open")
              .authorize(request(bearer(tokens.accessToken()), "users:read"));

      assertThat(decision.isAdmitted()).isTrue();
      assertThat(meterRegistry.counter("auth.gate.permission.failopen").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("fail-open이어도 deadline 만료는 UNAVAILABLE")
    void deadlineIsNeverFailOpen() {
      given(permissionResolver.hasPermission(any(), anyLong(), anyString()))
          .willThrow(new StoreUnavailableException("roles", false));

      GateDecision decision =
          gate(10, 10, "fail-open")
              .authorize(request(bearer(tokens.accessToken()), "users:read"));

      assertThat(decision.outcome()).isEqualTo(GateOutcome.UNAVAILABLE);
    }

    @Test
    @DisplayName("호출자가 취소한 deadline은 fail-open이어도 UNAVAILABLE")
    void cancelledDeadlineIsNeverFailOpen() {
      given(permissionResolver.hasPermission(any(), anyLong(), anyString()))
          .willAnswer(
              invocation -> {
                invocation.<Deadline>getArgument(0).throwIfDone("roles");
                return true;
              });
      GateRequest request = request(bearer(tokens.accessToken()), "users:read");
      request.deadline().cancel();

      GateDecision decision = gate(10, 10, "fail-open").authorize(request);

      assertThat(decision.outcome()).isEqualTo(GateOutcome.UNAVAILABLE);
      assertThat(meterRegistry.counter("auth.gate.permission.failopen").count()).isZero();
    }
  }

  @Nested
  @DisplayName("authorizeOrThrow")
  class OrThrow {

    @Test
    @DisplayName("판정을 대응 예외로 바꾼다")
    void mapsOutcomesToExceptions() {
      given(permissionResolver.hasPermission(any(), anyLong(), eq("audit:read")))
          .willReturn(false);
      AuthGate gate = gate(100, 1, "fail-close");
      String header = bearer(tokens.accessToken());

      assertThatThrownBy(() -> gate.authorizeOrThrow(request(null, null)))
          .isInstanceOf(UnauthenticatedException.class);
      assertThatThrownBy(() -> gate.authorizeOrThrow(request(header, "audit:read")))
          .isInstanceOf(PermissionDeniedException.class)
          .extracting(e -> ((PermissionDeniedException) e).getRequiredPermission())
          .isEqualTo("audit:read");
      assertThat(gate.authorizeOrThrow(request(header, null)).isAdmitted()).isTrue();
      assertThatThrownBy(() -> gate.authorizeOrThrow(request(header, null)))
          .isInstanceOf(RateLimitExceededException.class)
          .extracting(e -> ((RateLimitExceededException) e).getLimit())
          .isEqualTo(1L);
      then(permissionResolver).should(never()).hasPermission(any(), anyLong(), eq("users:read"));
    }

    @Test
    @DisplayName("UNAVAILABLE 판정은 재시도 불가 StoreUnavailableException이 된다")
    void unavailableBecomesStoreUnavailable() {
      given(permissionResolver.hasPermission(any(), anyLong(), anyString()))
          .willThrow(new StoreUnavailableException("roles", true));
      AuthGate gate = gate(10, 10, "fail-close");

      assertThatThrownBy(
              () -> gate.authorizeOrThrow(request(bearer(tokens.accessToken()), "users:read")))
          .isInstanceOf(StoreUnavailableException.class)
          .extracting(e -> ((StoreUnavailableException) e).isRetryable())
          .isEqualTo(false);
    }
  }
}
