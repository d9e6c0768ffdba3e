package venio.gate.core.domain.model;

/** Named role. Grants permissions through {@link RolePermission} associations. */
public record Role(long id, String name, String description) {
  public Role {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("role name cannot be null or blank");
    }
  }
}
