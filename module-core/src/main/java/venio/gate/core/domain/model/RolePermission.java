package venio.gate.core.domain.model;

/** Association record: role {@code roleId} grants permission {@code permissionId}. */
public record RolePermission(long roleId, long permissionId) {}
