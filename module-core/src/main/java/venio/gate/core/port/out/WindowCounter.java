package venio.gate.core.port.out;

import java.time.Duration;

/**
 * Counter state returned by {@link SharedKeyValueStore#incrementWithExpiry}.
 *
 * @param count value after the increment
 * @param ttl time until the counter expires
 */
public record WindowCounter(long count, Duration ttl) {}
