package venio.gate.infrastructure.cache.invalidation.impl;

import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import venio.gate.infrastructure.cache.invalidation.PermissionInvalidationEvent;
import venio.gate.infrastructure.cache.invalidation.PermissionInvalidationHandler;
import venio.gate.infrastructure.cache.invalidation.PermissionInvalidationPublisher;

/** 단일 인스턴스용 발행자: 등록된 핸들러에 동기 전달 */
@Slf4j
@RequiredArgsConstructor
public class LocalPermissionInvalidationPublisher implements PermissionInvalidationPublisher {

  private final List<PermissionInvalidationHandler> handlers;

  @Override
  public void publish(PermissionInvalidationEvent event) {
    log.debug(
        "[PermissionInvalidation] local: type={}, principal={}, role={}",
        event.type(),
        event.principalId(),
        event.roleId());
    handlers.forEach(handler -> handler.onInvalidation(event));
  }
}
