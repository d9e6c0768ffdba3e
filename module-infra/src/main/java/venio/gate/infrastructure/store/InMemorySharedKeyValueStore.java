package venio.gate.infrastructure.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import venio.gate.core.concurrency.Deadline;
import venio.gate.core.port.out.SharedKeyValueStore;
import venio.gate.core.port.out.WindowCounter;

/**
 * 단일 인스턴스용 공유 KV 저장소
 *
 * <p>{@link ConcurrentHashMap#compute}로 키 단위 원자성을 보장합니다. 만료는 주입된 Clock 기준으로 읽기/쓰기 시점에 판정하며,
 * {@link #purgeExpired()}로 만료 엔트리를 회수합니다.
 */
public class InMemorySharedKeyValueStore implements SharedKeyValueStore {

  private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
  private final Clock clock;

  private record Entry(String value, Instant expiresAt) {
    boolean isExpired(Instant now) {
      return !now.isBefore(expiresAt);
    }
  }

  public InMemorySharedKeyValueStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public WindowCounter incrementWithExpiry(Deadline deadline, String key, Duration window) {
    deadline.throwIfDone("incr");
    Instant now = clock.instant();
    Entry updated =
        entries.compute(
            key,
            (k, existing) -> {
              if (existing == null || existing.isExpired(now)) {
                return new Entry("1", now.plus(window));
              }
              long next = Long.parseLong(existing.value()) + 1;
              return new Entry(Long.toString(next), existing.expiresAt());
            });
    return new WindowCounter(
        Long.parseLong(updated.value()), Duration.between(now, updated.expiresAt()));
  }

  @Override
  public Optional<String> get(Deadline deadline, String key) {
    deadline.throwIfDone("get");
    Instant now = clock.instant();
    Entry entry = entries.get(key);
    if (entry == null || entry.isExpired(now)) {
      return Optional.empty();
    }
    return Optional.of(entry.value());
  }

  @Override
  public void set(Deadline deadline, String key, String value, Duration ttl) {
    deadline.throwIfDone("set");
    entries.put(key, new Entry(value, clock.instant().plus(ttl)));
  }

  @Override
  public boolean setIfAbsent(Deadline deadline, String key, String value, Duration ttl) {
    deadline.throwIfDone("setnx");
    Instant now = clock.instant();
    AtomicBoolean stored = new AtomicBoolean(false);
    entries.compute(
        key,
        (k, existing) -> {
          if (existing == null || existing.isExpired(now)) {
            stored.set(true);
            return new Entry(value, now.plus(ttl));
          }
          return existing;
        });
    return stored.get();
  }

  @Override
  public boolean delete(Deadline deadline, String key) {
    deadline.throwIfDone("delete");
    Instant now = clock.instant();
    AtomicReference<Entry> removed = new AtomicReference<>();
    entries.computeIfPresent(
        key,
        (k, existing) -> {
          removed.set(existing);
          return null;
        });
    return removed.get() != null && !removed.get().isExpired(now);
  }

  /** @return 회수된 엔트리 수 */
  public int purgeExpired() {
    Instant now = clock.instant();
    int before = entries.size();
    entries.values().removeIf(entry -> entry.isExpired(now));
    return Math.max(0, before - entries.size());
  }
}
