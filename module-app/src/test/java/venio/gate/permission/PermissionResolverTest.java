package venio.gate.permission;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import venio.gate.config.ResilienceConfig;
import venio.gate.core.concurrency.Deadline;
import venio.gate.core.domain.model.Permission;
import venio.gate.core.domain.model.Principal;
import venio.gate.core.domain.model.Role;
import venio.gate.core.port.out.AccessDirectory;
import venio.gate.core.support.MutableClock;
import venio.gate.error.exception.StoreUnavailableException;
import venio.gate.infrastructure.cache.invalidation.PermissionInvalidationEvent;
import venio.gate.infrastructure.cache.invalidation.impl.LocalPermissionInvalidationPublisher;
import venio.gate.infrastructure.persistence.InMemoryAccessDirectory;

@Tag("unit")
@DisplayName("PermissionResolver 테스트")
class PermissionResolverTest {

  private static final Duration TTL = Duration.ofSeconds(30);
  private static final Duration RETENTION = Duration.ofMinutes(1);

  private MutableClock clock;
  private SimpleMeterRegistry meterRegistry;

  @BeforeEach
  void setUp() {
    clock = MutableClock.at("2026-01-01T00:00:00Z");
    meterRegistry = new SimpleMeterRegistry();
  }

  private PermissionResolver resolver(AccessDirectory directory) {
    return new PermissionResolver(
        directory,
        clock,
        meterRegistry,
        TTL,
        1_000,
        Duration.ofSeconds(3),
        RETENTION,
        Retry.of(
            ResilienceConfig.STORE_READ,
            ResilienceConfig.storeReadRetryConfig(Duration.ofMillis(1))));
  }

  private Deadline deadline() {
    return Deadline.after(clock, Duration.ofSeconds(5));
  }

  @Nested
  @DisplayName("권한 확장")
  class Expand {

    private InMemoryAccessDirectory directory;
    private PermissionResolver resolver;
    private Principal alice;
    private Role user;
    private Role moderator;

    @BeforeEach
    void setUp() {
      directory = new InMemoryAccessDirectory();
      resolver = resolver(directory);
      alice = directory.savePrincipal("alice", "alice@venio.dev", true);
      user = directory.saveRole("user", "Regular user");
      moderator = directory.saveRole("moderator", "Moderator");
      Permission usersRead = directory.savePermission("users:read", "");
      Permission contentWrite = directory.savePermission("content:write", "");
      Permission contentModerate = directory.savePermission("content:moderate", "");
      directory.grantPermission(user.id(), usersRead.id());
      directory.grantPermission(user.id(), contentWrite.id());
      directory.grantPermission(moderator.id(), usersRead.id());
      directory.grantPermission(moderator.id(), contentModerate.id());
      directory.assignRole(alice.id(), user.id());
      directory.assignRole(alice.id(), moderator.id());
    }

    @Test
    @DisplayName("보유 역할 권한의 합집합을 돌려준다")
    void unionOfRolePermissions() {
      Set<String> permissions = resolver.expand(deadline(), alice.id());

      assertThat(permissions)
          .containsExactlyInAnyOrder("users:read", "content:write", "content:moderate");
      assertThat(resolver.roles(deadline(), alice.id()))
          .containsExactlyInAnyOrder("user", "moderator");
    }

    @Test
    @DisplayName("역할이 없는 principal은 빈 집합")
    void noRoles() {
      Principal bob = directory.savePrincipal("bob", "", true);

      assertThat(resolver.expand(deadline(), bob.id())).isEmpty();
      assertThat(resolver.hasPermission(deadline(), bob.id(), "users:read")).isFalse();
    }

    @Test
    @DisplayName("any/all 검사의 빈 목록 규칙")
    void anyAndAll() {
      long id = alice.id();

      assertThat(resolver.hasAnyPermission(deadline(), id, List.of("x", "users:read"))).isTrue();
      assertThat(resolver.hasAnyPermission(deadline(), id, List.of())).isFalse();
      assertThat(resolver.hasAllPermissions(deadline(), id, List.of("users:read", "x")))
          .isFalse();
      assertThat(resolver.hasAllPermissions(deadline(), id, List.of())).isTrue();
      assertThat(resolver.hasRole(deadline(), id, "moderator")).isTrue();
      assertThat(resolver.hasAnyRole(deadline(), id, List.of("admin", "guest"))).isFalse();
    }

    @Test
    @DisplayName("TTL 안에서는 캐시를 쓰고 TTL이 지나면 다시 읽는다")
    void cacheHitThenExpiry() {
      resolver.expand(deadline(), alice.id());
      directory.revokeRole(alice.id(), moderator.id());
      resolver.invalidate(PermissionInvalidationEvent.all());
      resolver.expand(deadline(), alice.id());

      Permission audit = directory.savePermission("audit:read", "");
      directory.grantPermission(user.id(), audit.id());
      assertThat(resolver.hasPermission(deadline(), alice.id(), "audit:read")).isFalse();

      clock.advance(TTL);

      assertThat(resolver.hasPermission(deadline(), alice.id(), "audit:read")).isTrue();
      assertThat(resolver.hasPermission(deadline(), alice.id(), "content:moderate")).isFalse();
      assertThat(meterRegistry.counter("permission.cache", "result", "hit").count())
          .isEqualTo(2.0);
      assertThat(meterRegistry.counter("permission.cache", "result", "miss").count())
          .isEqualTo(3.0);
    }

    @Test
    @DisplayName("principal 무효화 후 다음 조회는 저장소 값을 반영한다")
    void invalidatePrincipal() {
      resolver.expand(deadline(), alice.id());
      directory.revokeRole(alice.id(), user.id());

      resolver.invalidatePrincipal(alice.id());

      assertThat(resolver.hasPermission(deadline(), alice.id(), "content:write")).isFalse();
    }

    @Test
    @DisplayName("역할 무효화는 그 역할을 가진 엔트리만 제거한다")
    void invalidateRole() {
      Principal bob = directory.savePrincipal("bob", "", true);
      resolver.expand(deadline(), alice.id());
      resolver.expand(deadline(), bob.id());

      resolver.onInvalidation(PermissionInvalidationEvent.forRole(moderator.id()));

      assertThat(resolver.cachedEntry(alice.id())).isNull();
      assertThat(resolver.cachedEntry(bob.id())).isNotNull();
    }

    @Test
    @DisplayName("권한 부여 변경 이벤트를 받으면 TTL 전이라도 다음 조회에 반영된다")
    void grantIsVisibleOnNextCall() {
      // given
      LocalPermissionInvalidationPublisher publisher =
          new LocalPermissionInvalidationPublisher(List.of(resolver));
      directory.addChangeListener(publisher::publish);
      Permission auditRead = directory.savePermission("audit:read", "");
      assertThat(resolver.hasPermission(deadline(), alice.id(), "audit:read")).isFalse();

      // when
      directory.grantPermission(moderator.id(), auditRead.id());

      // then
      assertThat(resolver.hasPermission(deadline(), alice.id(), "audit:read")).isTrue();
    }

    @Test
    @DisplayName("대상별 무효화 기록은 보존 기간이 지나면 사라진다")
    void invalidationRecordsExpire() {
      // given
      for (long id = 1; id <= 100; id++) {
        resolver.invalidatePrincipal(id);
        resolver.invalidateRole(id);
      }
      assertThat(resolver.trackedInvalidationCount()).isEqualTo(200);

      // when
      clock.advance(RETENTION.plusSeconds(1));

      // then
      assertThat(resolver.trackedInvalidationCount()).isZero();
      assertThat(resolver.expand(deadline(), alice.id())).contains("content:moderate");
      assertThat(resolver.cachedEntry(alice.id())).isNotNull();
    }
  }

  @Nested
  @DisplayName("동시성")
  class Concurrency {

    @Test
    @DisplayName("동시에 16개 요청이 와도 저장소 조회는 1번")
    void stampedeLoadsOnce() throws Exception {
      AccessDirectory directory = mock(AccessDirectory.class);
      CountDownLatch release = new CountDownLatch(1);
      AtomicInteger fetches = new AtomicInteger();
      given(directory.getRolesForPrincipal(any(), eq(1L)))
          .willAnswer(
              invocation -> {
                fetches.incrementAndGet();
                release.await(5, TimeUnit.SECONDS);
                return List.of(new Role(10L, "user", ""));
              });
      given(directory.getPermissionsForRole(any(), eq(10L)))
          .willReturn(List.of(new Permission(100L, "content:read", "")));
      PermissionResolver resolver = resolver(directory);

      int threads = 16;
      ExecutorService pool = Executors.newFixedThreadPool(threads);
      CountDownLatch ready = new CountDownLatch(threads);
      List<Future<Set<String>>> results = new ArrayList<>();
      try {
        for (int i = 0; i < threads; i++) {
          results.add(
              pool.submit(
                  () -> {
                    ready.countDown();
                    return resolver.expand(deadline(), 1L);
                  }));
        }
        ready.await(5, TimeUnit.SECONDS);
        Thread.sleep(100);
        release.countDown();

        for (Future<Set<String>> result : results) {
          assertThat(result.get(5, TimeUnit.SECONDS)).containsExactly("content:read");
        }
      } finally {
        pool.shutdownNow();
      }
      assertThat(fetches.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("로드 도중 무효화되면 결과를 캐시에 넣지 않는다")
    void supersededLoadIsNotCached() {
      AccessDirectory directory = mock(AccessDirectory.class);
      PermissionResolver[] holder = new PermissionResolver[1];
      given(directory.getRolesForPrincipal(any(), eq(1L)))
          .willAnswer(
              invocation -> {
                holder[0].invalidatePrincipal(1L);
                return List.of(new Role(10L, "user", ""));
              });
      given(directory.getPermissionsForRole(any(), eq(10L))).willReturn(List.of());
      holder[0] = resolver(directory);

      assertThat(holder[0].roles(deadline(), 1L)).containsExactly("user");
      assertThat(holder[0].cachedEntry(1L)).isNull();
    }

    @Test
    @DisplayName("앞선 leader가 캐시를 채웠으면 다음 leader는 다시 읽지 않는다")
    void lateLeaderReusesFreshEntry() {
      AccessDirectory directory = mock(AccessDirectory.class);
      given(directory.getRolesForPrincipal(any(), eq(1L)))
          .willReturn(List.of(new Role(10L, "user", "")));
      given(directory.getPermissionsForRole(any(), eq(10L)))
          .willReturn(List.of(new Permission(100L, "content:read", "")));
      PermissionResolver resolver = resolver(directory);
      resolver.expand(deadline(), 1L);

      PermissionCacheEntry entry = resolver.loadIfAbsent(deadline(), 1L);

      assertThat(entry.permissions()).containsExactly("content:read");
      verify(directory, times(1)).getRolesForPrincipal(any(), eq(1L));
    }
  }

  @Nested
  @DisplayName("저장소 오류")
  class StoreFailure {

    @Test
    @DisplayName("재시도 가능한 오류는 1회 재시도한다")
    void retriesOnce() {
      AccessDirectory directory = mock(AccessDirectory.class);
      given(directory.getRolesForPrincipal(any(), anyLong()))
          .willThrow(new StoreUnavailableException("roles", true))
          .willReturn(List.of());
      PermissionResolver resolver = resolver(directory);

      assertThat(resolver.expand(deadline(), 1L)).isEmpty();
      verify(directory, times(2)).getRolesForPrincipal(any(), eq(1L));
    }

    @Test
    @DisplayName("재시도 후에도 실패하면 예외를 전파하고 캐시하지 않는다")
    void exhaustedRetryPropagates() {
      AccessDirectory directory = mock(AccessDirectory.class);
      given(directory.getRolesForPrincipal(any(), anyLong()))
          .willThrow(new StoreUnavailableException("roles", true));
      PermissionResolver resolver = resolver(directory);

      assertThatThrownBy(() -> resolver.expand(deadline(), 1L))
          .isInstanceOf(StoreUnavailableException.class);
      verify(directory, times(2)).getRolesForPrincipal(any(), eq(1L));
      assertThat(resolver.cachedCount()).isZero();
    }

    @Test
    @DisplayName("deadline 만료 같은 재시도 불가 오류는 재시도하지 않는다")
    void nonRetryableIsNotRetried() {
      AccessDirectory directory = mock(AccessDirectory.class);
      given(directory.getRolesForPrincipal(any(), anyLong()))
          .willThrow(new StoreUnavailableException("roles", false));
      PermissionResolver resolver = resolver(directory);

      assertThatThrownBy(() -> resolver.expand(deadline(), 1L))
          .isInstanceOf(StoreUnavailableException.class)
          .extracting(e -> ((StoreUnavailableException) e).isRetryable())
          .isEqualTo(false);
      verify(directory, times(1)).getRolesForPrincipal(any(), eq(1L));
    }
  }
}
