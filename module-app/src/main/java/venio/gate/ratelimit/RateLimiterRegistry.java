package venio.gate.ratelimit;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import venio.gate.config.RateLimitProperties;
import venio.gate.infrastructure.ratelimit.RateLimitPolicy;
import venio.gate.infrastructure.ratelimit.RateLimiter;
import venio.gate.infrastructure.ratelimit.RateLimiterFactory;
import venio.gate.infrastructure.ratelimit.strategy.LocalBucketRateLimiter;

/**
 * 경로 등급별 {@link RateLimiter} 모음
 *
 * <p>기동 시 프로퍼티로 한 번 구성되며 이후 변경되지 않습니다.
 */
@Slf4j
public class RateLimiterRegistry {

  public static final String IP_POLICY = "ip";

  private final RouteLimiter ipLimiter;
  private final Map<RouteClass, RouteLimiter> routeLimiters;

  /** 한도 + 키 전략 */
  public record RouteLimiter(RateLimiter limiter, KeyStrategy keyBy) {

    /** 키 전략에 맞는 버킷 키 ({@code p:<id>} 또는 {@code a:<address>}) */
    public String keyFor(long principalId, String clientAddress) {
      return keyBy == KeyStrategy.PRINCIPAL ? "p:" + principalId : "a:" + clientAddress;
    }

    public String addressKey(String clientAddress) {
      return "a:" + clientAddress;
    }
  }

  public RateLimiterRegistry(RateLimiterFactory factory, RateLimitProperties properties) {
    Objects.requireNonNull(factory, "factory");
    this.ipLimiter = build(factory, IP_POLICY, properties.getIp());

    Map<RouteClass, RouteLimiter> limiters = new EnumMap<>(RouteClass.class);
    limiters.put(RouteClass.AUTH, build(factory, "auth", properties.getAuth()));
    limiters.put(RouteClass.GENERAL, build(factory, "general", properties.getGeneral()));
    limiters.put(RouteClass.ADMIN, build(factory, "admin", properties.getAdmin()));
    limiters.put(RouteClass.STRICT, build(factory, "strict", properties.getStrict()));
    this.routeLimiters = Map.copyOf(limiters);
  }

  private static RouteLimiter build(
      RateLimiterFactory factory, String name, RateLimitProperties.Policy policy) {
    RateLimiter limiter =
        factory.create(RateLimitPolicy.of(name, policy.getLimit(), policy.getWindow()));
    return new RouteLimiter(limiter, policy.getKeyBy());
  }

  public RouteLimiter ip() {
    return ipLimiter;
  }

  public RouteLimiter forRoute(RouteClass routeClass) {
    return routeLimiters.get(Objects.requireNonNull(routeClass, "routeClass"));
  }

  /**
   * 로컬 버킷 회수
   *
   * @return 회수된 버킷 수 (공유 저장소 백엔드는 항상 0)
   */
  public int sweep() {
    int removed = sweep(ipLimiter);
    for (RouteLimiter routeLimiter : all()) {
      removed += sweep(routeLimiter);
    }
    return removed;
  }

  private Collection<RouteLimiter> all() {
    return routeLimiters.values();
  }

  private static int sweep(RouteLimiter routeLimiter) {
    if (routeLimiter.limiter() instanceof LocalBucketRateLimiter local) {
      return local.sweep();
    }
    return 0;
  }
}
