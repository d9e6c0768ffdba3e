package venio.gate.core.domain.model;

/**
 * Named capability such as {@code users:read} or {@code admin.roles:write}.
 *
 * @param id permission identifier
 * @param name scoped permission name, compared by exact match
 * @param description free text
 */
public record Permission(long id, String name, String description) {
  public Permission {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("permission name cannot be null or blank");
    }
  }
}
