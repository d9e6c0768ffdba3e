package venio.gate.infrastructure.redis.script;

/**
 * Redis Lua Script 모음
 *
 * <p>모든 스크립트는 단일 키만 다루므로 Cluster Hash Tag 제약을 받지 않습니다.
 */
public final class LuaScripts {

  private LuaScripts() {}

  /**
   * 원자적 카운터 증가 + 윈도우 만료 설정
   *
   * <pre>
   * KEYS[1] = 카운터 키
   * ARGV[1] = 윈도우 (밀리초)
   * return  = {count, pttl}
   * </pre>
   *
   * <p>첫 증가이거나 만료가 빠진 카운터(PTTL &lt; 0)에는 PEXPIRE를 건다. INCR과 PEXPIRE 사이에 다른 클라이언트가 끼어들 수
   * 없다.
   */
  public static final String INCREMENT_WITH_EXPIRY =
      """
      local current = redis.call('INCR', KEYS[1])
      local ttl = redis.call('PTTL', KEYS[1])
      if current == 1 or ttl < 0 then
        redis.call('PEXPIRE', KEYS[1], ARGV[1])
        ttl = tonumber(ARGV[1])
      end
      return {tostring(current), tostring(ttl)}
      """;
}
