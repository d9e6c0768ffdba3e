package venio.gate.core.domain.model;

/**
 * Authenticated identity.
 *
 * <p>Pure domain model - no external dependencies.
 *
 * @param id stable principal identifier
 * @param handle stable user name
 * @param email contact address
 */
public record Principal(long id, String handle, String email) {
  public Principal {
    if (handle == null || handle.isBlank()) {
      throw new IllegalArgumentException("handle cannot be null or blank");
    }
    if (email == null) {
      email = "";
    }
  }
}
