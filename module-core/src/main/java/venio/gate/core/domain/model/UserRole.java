package venio.gate.core.domain.model;

/** Association record: principal {@code principalId} holds role {@code roleId}. */
public record UserRole(long principalId, long roleId) {}
