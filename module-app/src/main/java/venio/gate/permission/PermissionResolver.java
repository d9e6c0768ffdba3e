package venio.gate.permission;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import venio.gate.core.concurrency.Deadline;
import venio.gate.core.domain.model.Permission;
import venio.gate.core.domain.model.Role;
import venio.gate.core.port.out.AccessDirectory;
import venio.gate.error.exception.StoreUnavailableException;
import venio.gate.infrastructure.cache.invalidation.PermissionInvalidationEvent;
import venio.gate.infrastructure.cache.invalidation.PermissionInvalidationHandler;
import venio.gate.infrastructure.concurrency.SingleFlightExecutor;

/**
 * principal의 유효 권한 집합 해석기
 *
 * <h4>조회 흐름</h4>
 *
 * <ol>
 *   <li>Caffeine 캐시 확인 (주입된 Clock 기준 신선도 재확인)
 *   <li>Miss 시 principal 단위 Single-flight로 1회만 로드
 *   <li>역할 조회 → 역할별 권한 조회 → 합집합
 * </ol>
 *
 * <h4>무효화</h4>
 *
 * <p>무효화마다 세대 번호를 올리고 대상별 최종 무효화 세대를 기록합니다. 로드가 시작된 뒤 대상(principal, 보유 역할, 전체)이 무효화되었다면 그
 * 결과는 호출자에게만 반환하고 캐시에 넣지 않습니다. 대상별 기록은 {@code invalidationRetention} 동안만 유지하므로 이 값은 가장 긴 로드보다
 * 길어야 합니다.
 *
 * <h4>저장소 오류</h4>
 *
 * <p>주입된 {@link Retry} 정책을 따릅니다 (재시도 가능한 {@link StoreUnavailableException}만 1회). Deadline
 * 만료/취소는 재시도하지 않으며, 최종 실패는 호출자에게 전파됩니다.
 */
@Slf4j
public class PermissionResolver implements PermissionInvalidationHandler {

  private final AccessDirectory directory;
  private final Clock clock;
  private final MeterRegistry meterRegistry;
  private final Duration ttl;
  private final Cache<Long, PermissionCacheEntry> cache;
  private final SingleFlightExecutor<PermissionCacheEntry> singleFlight;
  private final Retry retry;

  private final AtomicLong generation = new AtomicLong();
  private final Cache<Long, Long> principalInvalidatedAt;
  private final Cache<Long, Long> roleInvalidatedAt;
  private volatile long allInvalidatedAt;

  public PermissionResolver(
      AccessDirectory directory,
      Clock clock,
      MeterRegistry meterRegistry,
      Duration ttl,
      long maxSize,
      Duration followerTimeout,
      Duration invalidationRetention,
      Retry retry) {
    this.directory = directory;
    this.clock = clock;
    this.meterRegistry = meterRegistry;
    this.ttl = ttl;
    this.cache = Caffeine.newBuilder().maximumSize(maxSize).expireAfterWrite(ttl).build();
    this.singleFlight = new SingleFlightExecutor<>(followerTimeout);
    this.principalInvalidatedAt = invalidationLog(invalidationRetention);
    this.roleInvalidatedAt = invalidationLog(invalidationRetention);
    this.retry = retry;
  }

  private Cache<Long, Long> invalidationLog(Duration retention) {
    Ticker ticker =
        () -> {
          Instant now = clock.instant();
          return now.getEpochSecond() * 1_000_000_000L + now.getNano();
        };
    return Caffeine.newBuilder().expireAfterWrite(retention).ticker(ticker).build();
  }

  // ==================== 조회 ====================

  /** 유효 권한 집합 */
  public Set<String> expand(Deadline deadline, long principalId) {
    return entry(deadline, principalId).permissions();
  }

  public boolean hasPermission(Deadline deadline, long principalId, String permission) {
    return expand(deadline, principalId).contains(permission);
  }

  /** 하나라도 가지면 true (빈 목록은 false) */
  public boolean hasAnyPermission(
      Deadline deadline, long principalId, Collection<String> permissions) {
    Set<String> granted = expand(deadline, principalId);
    return permissions.stream().anyMatch(granted::contains);
  }

  /** 모두 가지면 true (빈 목록은 true) */
  public boolean hasAllPermissions(
      Deadline deadline, long principalId, Collection<String> permissions) {
    return expand(deadline, principalId).containsAll(permissions);
  }

  /** 현재 역할 이름 집합 */
  public Set<String> roles(Deadline deadline, long principalId) {
    return entry(deadline, principalId).roleNames();
  }

  public boolean hasRole(Deadline deadline, long principalId, String role) {
    return roles(deadline, principalId).contains(role);
  }

  public boolean hasAnyRole(Deadline deadline, long principalId, Collection<String> roles) {
    Set<String> held = roles(deadline, principalId);
    return roles.stream().anyMatch(held::contains);
  }

  private PermissionCacheEntry entry(Deadline deadline, long principalId) {
    PermissionCacheEntry cached = cache.getIfPresent(principalId);
    if (cached != null && cached.isFresh(clock.instant())) {
      countCache("hit");
      return cached;
    }
    countCache("miss");
    return singleFlight.execute(
        deadline, Long.toString(principalId), () -> loadIfAbsent(deadline, principalId));
  }

  /** 앞선 leader가 방금 채운 엔트리가 있으면 다시 읽지 않습니다. */
  PermissionCacheEntry loadIfAbsent(Deadline deadline, long principalId) {
    PermissionCacheEntry cached = cachedEntry(principalId);
    if (cached != null) {
      return cached;
    }
    return load(deadline, principalId);
  }

  private PermissionCacheEntry load(Deadline deadline, long principalId) {
    long startedAt = generation.get();

    List<Role> roles = withRetry(() -> directory.getRolesForPrincipal(deadline, principalId));
    Set<Long> roleIds = new HashSet<>();
    Set<String> roleNames = new HashSet<>();
    Set<String> permissions = new HashSet<>();
    for (Role role : roles) {
      roleIds.add(role.id());
      roleNames.add(role.name());
      for (Permission permission :
          withRetry(() -> directory.getPermissionsForRole(deadline, role.id()))) {
        permissions.add(permission.name());
      }
    }

    PermissionCacheEntry entry =
        new PermissionCacheEntry(
            principalId, roleIds, roleNames, permissions, clock.instant(), ttl);
    if (invalidatedSince(startedAt, entry)) {
      log.debug("[Permission] load superseded by invalidation: principal={}", principalId);
    } else {
      cache.put(principalId, entry);
    }
    return entry;
  }

  private <T> T withRetry(Supplier<T> call) {
    return Retry.decorateSupplier(retry, call).get();
  }

  private boolean invalidatedSince(long startedAt, PermissionCacheEntry entry) {
    if (allInvalidatedAt > startedAt) {
      return true;
    }
    if (principalInvalidatedAt.asMap().getOrDefault(entry.principalId(), 0L) > startedAt) {
      return true;
    }
    return entry.roleIds().stream()
        .anyMatch(roleId -> roleInvalidatedAt.asMap().getOrDefault(roleId, 0L) > startedAt);
  }

  // ==================== 무효화 ====================

  public void invalidatePrincipal(long principalId) {
    long gen = generation.incrementAndGet();
    principalInvalidatedAt.asMap().merge(principalId, gen, Math::max);
    cache.invalidate(principalId);
    singleFlight.forget(Long.toString(principalId));
    log.debug("[Permission] invalidated principal={}", principalId);
  }

  /** 역할을 보유한 모든 캐시 엔트리와 진행 중인 로드를 무효화합니다. */
  public void invalidateRole(long roleId) {
    long gen = generation.incrementAndGet();
    roleInvalidatedAt.asMap().merge(roleId, gen, Math::max);
    cache.asMap().values().removeIf(entry -> entry.holdsRole(roleId));
    singleFlight.forgetAll();
    log.debug("[Permission] invalidated role={}", roleId);
  }

  public void invalidateAll() {
    long gen = generation.incrementAndGet();
    allInvalidatedAt = gen;
    principalInvalidatedAt.asMap().values().removeIf(at -> at <= gen);
    roleInvalidatedAt.asMap().values().removeIf(at -> at <= gen);
    cache.invalidateAll();
    singleFlight.forgetAll();
    log.debug("[Permission] invalidated all entries");
  }

  public void invalidate(PermissionInvalidationEvent event) {
    switch (event.type()) {
      case PRINCIPAL -> invalidatePrincipal(event.principalId());
      case ROLE -> invalidateRole(event.roleId());
      case ALL -> invalidateAll();
    }
  }

  @Override
  public void onInvalidation(PermissionInvalidationEvent event) {
    invalidate(event);
  }

  /** 현재 캐시 엔트리 수 (모니터링용) */
  public long cachedCount() {
    cache.cleanUp();
    return cache.estimatedSize();
  }

  private void countCache(String result) {
    meterRegistry.counter("permission.cache", "result", result).increment();
  }

  /** 보존 중인 대상별 무효화 기록 수 */
  long trackedInvalidationCount() {
    principalInvalidatedAt.cleanUp();
    roleInvalidatedAt.cleanUp();
    return principalInvalidatedAt.estimatedSize() + roleInvalidatedAt.estimatedSize();
  }

  /** 현재 시각 기준 캐시 엔트리 (테스트/모니터링용) */
  PermissionCacheEntry cachedEntry(long principalId) {
    PermissionCacheEntry cached = cache.getIfPresent(principalId);
    Instant now = clock.instant();
    return cached != null && cached.isFresh(now) ? cached : null;
  }
}
