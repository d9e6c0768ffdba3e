package venio.gate.infrastructure.cache.invalidation;

/**
 * 권한 캐시 무효화 이벤트
 *
 * <p>RTopic으로 다른 인스턴스에 전파될 때 JSON으로 직렬화됩니다.
 *
 * @param type 무효화 유형
 * @param principalId PRINCIPAL 유형일 때 대상
 * @param roleId ROLE 유형일 때 대상
 * @param sourceInstanceId 발행 인스턴스 (Self-skip 판정용)
 * @param timestamp 발행 시각 (epoch millis)
 */
public record PermissionInvalidationEvent(
    InvalidationType type, Long principalId, Long roleId, String sourceInstanceId, long timestamp) {

  public static PermissionInvalidationEvent forPrincipal(long principalId) {
    return new PermissionInvalidationEvent(
        InvalidationType.PRINCIPAL, principalId, null, null, System.currentTimeMillis());
  }

  public static PermissionInvalidationEvent forRole(long roleId) {
    return new PermissionInvalidationEvent(
        InvalidationType.ROLE, null, roleId, null, System.currentTimeMillis());
  }

  public static PermissionInvalidationEvent all() {
    return new PermissionInvalidationEvent(
        InvalidationType.ALL, null, null, null, System.currentTimeMillis());
  }

  public PermissionInvalidationEvent withSource(String instanceId) {
    return new PermissionInvalidationEvent(type, principalId, roleId, instanceId, timestamp);
  }
}
