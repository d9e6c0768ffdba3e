package venio.gate.ratelimit;

/**
 * 경로 등급
 *
 * <ul>
 *   <li>AUTH: 로그인/토큰 갱신 (기본 5회/분, 주소 기준)
 *   <li>GENERAL: 일반 API (기본 100회/분, principal 기준)
 *   <li>ADMIN: 관리 API (기본 200회/분, principal 기준)
 *   <li>STRICT: 민감 작업 (기본 3회/5분, 주소 기준)
 * </ul>
 */
public enum RouteClass {
  AUTH,
  GENERAL,
  ADMIN,
  STRICT
}
