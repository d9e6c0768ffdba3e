package venio.gate.infrastructure.cache.invalidation.impl;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RTopic;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import venio.gate.infrastructure.cache.invalidation.PermissionInvalidationEvent;
import venio.gate.infrastructure.cache.invalidation.PermissionInvalidationHandler;
import venio.gate.infrastructure.cache.invalidation.PermissionInvalidationPublisher;
import venio.gate.infrastructure.executor.LogicExecutor;
import venio.gate.infrastructure.executor.TaskContext;

/**
 * Redis RTopic 기반 권한 캐시 무효화 발행자
 *
 * <h4>흐름</h4>
 *
 * <ol>
 *   <li>로컬 핸들러에 먼저 적용 (발행 인스턴스는 즉시 일관)
 *   <li>sourceInstanceId를 붙여 RTopic으로 브로드캐스트
 *   <li>다른 인스턴스의 {@link RedisPermissionInvalidationSubscriber}가 수신 후 적용
 * </ol>
 *
 * <p>Pub/Sub 유실 시 캐시 TTL이 최종 상한입니다.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisPermissionInvalidationPublisher implements PermissionInvalidationPublisher {

  private final RedissonClient redissonClient;
  private final String topicName;
  private final String instanceId;
  private final List<PermissionInvalidationHandler> localHandlers;
  private final LogicExecutor executor;
  private final MeterRegistry meterRegistry;

  @Override
  public void publish(PermissionInvalidationEvent event) {
    PermissionInvalidationEvent stamped = event.withSource(instanceId);
    localHandlers.forEach(handler -> handler.onInvalidation(stamped));

    executor.executeOrDefault(
        () -> {
          RTopic topic = redissonClient.getTopic(topicName, StringCodec.INSTANCE);
          long receivers = topic.publish(PermissionInvalidationCodec.encode(stamped));
          meterRegistry
              .counter("permission.invalidation.published", "type", stamped.type().name())
              .increment();
          log.debug(
              "[PermissionInvalidation] published: type={}, receivers={}",
              stamped.type(),
              receivers);
          return receivers;
        },
        0L,
        TaskContext.of("PermissionInvalidation", "Publish", stamped.type().name()));
  }
}
