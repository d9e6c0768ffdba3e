package venio.gate.config;

import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import venio.gate.core.port.out.SharedKeyValueStore;
import venio.gate.infrastructure.cache.invalidation.PermissionInvalidationHandler;
import venio.gate.infrastructure.cache.invalidation.PermissionInvalidationPublisher;
import venio.gate.infrastructure.cache.invalidation.impl.LocalPermissionInvalidationPublisher;
import venio.gate.infrastructure.cache.invalidation.impl.RedisPermissionInvalidationPublisher;
import venio.gate.infrastructure.cache.invalidation.impl.RedisPermissionInvalidationSubscriber;
import venio.gate.infrastructure.executor.LogicExecutor;
import venio.gate.infrastructure.persistence.InMemoryAccessDirectory;
import venio.gate.infrastructure.redis.RedissonSharedKeyValueStore;
import venio.gate.infrastructure.store.InMemorySharedKeyValueStore;

/**
 * 공유 저장소와 권한 무효화 전파 구성
 *
 * <ul>
 *   <li>{@code gate.store.backend=memory} (기본): 인메모리 저장소 + 로컬 발행자
 *   <li>{@code gate.store.backend=redis}: Redisson 저장소 + RTopic 발행/구독
 * </ul>
 *
 * <p>디렉터리 변경은 발행자로 연결되어 권한 캐시를 무효화합니다.
 */
@Slf4j
@Configuration
public class StoreConfig {

  private static final String PREFIX = "gate.store";

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnProperty(
      prefix = PREFIX,
      name = "backend",
      havingValue = "memory",
      matchIfMissing = true)
  static class MemoryStoreConfig {

    @Bean
    public InMemorySharedKeyValueStore sharedKeyValueStore(Clock clock) {
      log.info("[Store] backend=memory (single instance)");
      return new InMemorySharedKeyValueStore(clock);
    }

    @Bean
    public InMemoryStorePurgeScheduler inMemoryStorePurgeScheduler(
        InMemorySharedKeyValueStore store) {
      return new InMemoryStorePurgeScheduler(store);
    }

    @Bean
    public PermissionInvalidationPublisher permissionInvalidationPublisher(
        List<PermissionInvalidationHandler> handlers, InMemoryAccessDirectory directory) {
      PermissionInvalidationPublisher publisher =
          new LocalPermissionInvalidationPublisher(handlers);
      directory.addChangeListener(publisher::publish);
      return publisher;
    }
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnProperty(prefix = PREFIX, name = "backend", havingValue = "redis")
  static class RedisStoreConfig {

    @Bean(destroyMethod = "shutdown")
    public RedissonClient redissonClient(StoreProperties properties) {
      StoreProperties.Redis redis = properties.getRedis();
      Config config = new Config();
      SingleServerConfig server =
          config
              .useSingleServer()
              .setAddress(redis.getAddress())
              .setTimeout((int) properties.getCallTimeout().toMillis())
              .setConnectTimeout((int) redis.getConnectTimeout().toMillis())
              .setRetryAttempts(1)
              .setRetryInterval(100);
      if (redis.getPassword() != null && !redis.getPassword().isBlank()) {
        server.setPassword(redis.getPassword());
      }
      log.info("[Store] backend=redis, instanceId={}", redis.resolvedInstanceId());
      return Redisson.create(config);
    }

    @Bean
    public SharedKeyValueStore sharedKeyValueStore(
        RedissonClient redissonClient, LogicExecutor executor, StoreProperties properties) {
      return new RedissonSharedKeyValueStore(
          redissonClient, executor, properties.getCallTimeout());
    }

    @Bean
    public PermissionInvalidationPublisher permissionInvalidationPublisher(
        RedissonClient redissonClient,
        StoreProperties properties,
        List<PermissionInvalidationHandler> handlers,
        LogicExecutor executor,
        MeterRegistry meterRegistry,
        InMemoryAccessDirectory directory) {
      StoreProperties.Redis redis = properties.getRedis();
      PermissionInvalidationPublisher publisher =
          new RedisPermissionInvalidationPublisher(
              redissonClient,
              redis.getInvalidationTopic(),
              redis.resolvedInstanceId(),
              handlers,
              executor,
              meterRegistry);
      directory.addChangeListener(publisher::publish);
      return publisher;
    }

    @Bean
    public RedisPermissionInvalidationSubscriber permissionInvalidationSubscriber(
        RedissonClient redissonClient,
        StoreProperties properties,
        List<PermissionInvalidationHandler> handlers,
        LogicExecutor executor,
        MeterRegistry meterRegistry) {
      StoreProperties.Redis redis = properties.getRedis();
      return new RedisPermissionInvalidationSubscriber(
          redissonClient,
          redis.getInvalidationTopic(),
          redis.resolvedInstanceId(),
          handlers,
          executor,
          meterRegistry);
    }
  }
}
