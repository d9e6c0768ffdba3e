package venio.gate.infrastructure.cache.invalidation;

/**
 * 권한 캐시 무효화 이벤트 발행자
 *
 * <p>발행은 로컬 캐시에 먼저 적용된 뒤 반환되어야 합니다. 원격 전파 실패는 예외로 전파하지 않고 로그로 남기며, 다른 인스턴스는 캐시 TTL
 * 안에 수렴합니다.
 */
public interface PermissionInvalidationPublisher {

  void publish(PermissionInvalidationEvent event);
}
