package venio.gate.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import venio.gate.infrastructure.store.InMemorySharedKeyValueStore;

/** 인메모리 저장소의 만료 키를 주기적으로 정리합니다. memory 백엔드에서만 등록됩니다. */
@Slf4j
@RequiredArgsConstructor
public class InMemoryStorePurgeScheduler {

  private final InMemorySharedKeyValueStore store;

  @Scheduled(fixedDelayString = "${gate.store.purge-interval:PT1M}")
  public void purge() {
    int removed = store.purgeExpired();
    if (removed > 0) {
      log.debug("[Store-Purge] removed {} expired keys", removed);
    }
  }
}
