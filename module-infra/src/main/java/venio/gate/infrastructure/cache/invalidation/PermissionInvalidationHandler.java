package venio.gate.infrastructure.cache.invalidation;

/** 무효화 이벤트를 실제 캐시에 적용하는 쪽 */
@FunctionalInterface
public interface PermissionInvalidationHandler {
  void onInvalidation(PermissionInvalidationEvent event);
}
