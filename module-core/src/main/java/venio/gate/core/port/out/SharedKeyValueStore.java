package venio.gate.core.port.out;

import java.time.Duration;
import java.util.Optional;
import venio.gate.core.concurrency.Deadline;

/**
 * Key-value store shared by every gate instance.
 *
 * <p>Backs the shared-store rate limiter and refresh token rotation. Failures surface as {@link
 * venio.gate.error.exception.StoreUnavailableException}.
 */
public interface SharedKeyValueStore {

  /**
   * Atomically increment a counter and, when this increment created it, set its expiry.
   *
   * <p>Must be a single atomic step: a counter is never left without expiry, and concurrent
   * callers never observe the same count.
   *
   * @param window expiry applied on the first increment
   * @return count after the increment and remaining time to live
   */
  WindowCounter incrementWithExpiry(Deadline deadline, String key, Duration window);

  Optional<String> get(Deadline deadline, String key);

  void set(Deadline deadline, String key, String value, Duration ttl);

  /**
   * Set only when the key is absent.
   *
   * @return true when this call stored the value
   */
  boolean setIfAbsent(Deadline deadline, String key, String value, Duration ttl);

  /** @return true when a key was removed */
  boolean delete(Deadline deadline, String key);
}
