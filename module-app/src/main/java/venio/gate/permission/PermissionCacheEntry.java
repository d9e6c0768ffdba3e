package venio.gate.permission;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/**
 * principal 1명의 해석 결과 스냅샷
 *
 * @param principalId 대상 principal
 * @param roleIds 로드 시점의 역할 ID (역할 단위 무효화 판정용)
 * @param roleNames 로드 시점의 역할 이름
 * @param permissions 역할 권한의 합집합
 * @param fetchedAt 로드 완료 시각
 * @param ttl 유효 기간
 */
public record PermissionCacheEntry(
    long principalId,
    Set<Long> roleIds,
    Set<String> roleNames,
    Set<String> permissions,
    Instant fetchedAt,
    Duration ttl) {

  public PermissionCacheEntry {
    roleIds = Set.copyOf(roleIds);
    roleNames = Set.copyOf(roleNames);
    permissions = Set.copyOf(permissions);
  }

  /** {@code now < fetchedAt + ttl} */
  public boolean isFresh(Instant now) {
    return now.isBefore(fetchedAt.plus(ttl));
  }

  public boolean holdsRole(long roleId) {
    return roleIds.contains(roleId);
  }
}
