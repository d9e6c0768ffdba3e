package venio.gate.infrastructure.cache.invalidation.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import venio.gate.infrastructure.cache.invalidation.PermissionInvalidationEvent;

/** RTopic 메시지 직렬화 (StringCodec + Jackson JSON) */
final class PermissionInvalidationCodec {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private PermissionInvalidationCodec() {}

  static String encode(PermissionInvalidationEvent event) throws JsonProcessingException {
    return MAPPER.writeValueAsString(event);
  }

  static PermissionInvalidationEvent decode(String payload) throws JsonProcessingException {
    return MAPPER.readValue(payload, PermissionInvalidationEvent.class);
  }
}
