package venio.gate.infrastructure.cache.invalidation.impl;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RTopic;
import org.redisson.api.RedissonClient;
import org.redisson.api.listener.MessageListener;
import org.redisson.client.codec.StringCodec;
import venio.gate.infrastructure.cache.invalidation.PermissionInvalidationEvent;
import venio.gate.infrastructure.cache.invalidation.PermissionInvalidationHandler;
import venio.gate.infrastructure.executor.LogicExecutor;
import venio.gate.infrastructure.executor.TaskContext;

/**
 * Redis RTopic 기반 권한 캐시 무효화 구독자
 *
 * <ul>
 *   <li>다른 인스턴스가 발행한 이벤트를 로컬 핸들러에 적용
 *   <li>Self-skip: 자기 자신이 발행한 이벤트는 이미 로컬에 적용되었으므로 무시
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class RedisPermissionInvalidationSubscriber {

  private final RedissonClient redissonClient;
  private final String topicName;
  private final String instanceId;
  private final List<PermissionInvalidationHandler> handlers;
  private final LogicExecutor executor;
  private final MeterRegistry meterRegistry;

  private volatile Integer listenerId;
  private volatile RTopic topic;

  @PostConstruct
  public void subscribe() {
    executor.executeVoid(
        () -> {
          topic = redissonClient.getTopic(topicName, StringCodec.INSTANCE);
          listenerId = topic.addListener(String.class, createMessageListener());
          log.info(
              "[PermissionInvalidation] Subscribed to topic: {}, instanceId={}",
              topicName,
              instanceId);
        },
        TaskContext.of("PermissionInvalidation", "Subscribe", instanceId));
  }

  private MessageListener<String> createMessageListener() {
    return (channel, payload) -> onMessage(payload);
  }

  private void onMessage(String payload) {
    PermissionInvalidationEvent event =
        executor.executeOrDefault(
            () -> PermissionInvalidationCodec.decode(payload),
            null,
            TaskContext.of("PermissionInvalidation", "Decode"));
    if (event != null) {
      onEvent(event);
    }
  }

  public void onEvent(PermissionInvalidationEvent event) {
    if (instanceId.equals(event.sourceInstanceId())) {
      log.trace("[PermissionInvalidation] Self-skip: type={}", event.type());
      return;
    }

    executor.executeVoid(
        () -> {
          handlers.forEach(handler -> handler.onInvalidation(event));
          meterRegistry
              .counter("permission.invalidation.received", "type", event.type().name())
              .increment();
        },
        TaskContext.of("PermissionInvalidation", "OnEvent", event.type().name()));
  }

  @PreDestroy
  public void unsubscribe() {
    executor.executeVoid(
        () -> {
          if (topic != null && listenerId != null) {
            topic.removeListener(listenerId);
            log.info("[PermissionInvalidation] Unsubscribed: instanceId={}", instanceId);
          }
        },
        TaskContext.of("PermissionInvalidation", "Unsubscribe", instanceId));
  }
}
