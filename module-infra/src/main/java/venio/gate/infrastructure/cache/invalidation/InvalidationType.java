package venio.gate.infrastructure.cache.invalidation;

/**
 * 권한 캐시 무효화 유형
 *
 * <ul>
 *   <li>{@link #PRINCIPAL}: 특정 principal의 역할 할당 변경
 *   <li>{@link #ROLE}: 특정 역할의 권한 부여 변경 (역할을 가진 모든 principal 대상)
 *   <li>{@link #ALL}: 전체 무효화
 * </ul>
 */
public enum InvalidationType {
  PRINCIPAL,
  ROLE,
  ALL
}
