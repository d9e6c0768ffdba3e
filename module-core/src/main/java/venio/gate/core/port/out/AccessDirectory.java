package venio.gate.core.port.out;

import java.util.List;
import java.util.Optional;
import venio.gate.core.concurrency.Deadline;
import venio.gate.core.domain.model.Permission;
import venio.gate.core.domain.model.Principal;
import venio.gate.core.domain.model.Role;

/**
 * Read side of the data store that owns principals, roles and permissions.
 *
 * <p>Implemented by module-infra adapters. Every call may block and is bounded by the caller's
 * {@link Deadline}; failures surface as {@link
 * venio.gate.error.exception.StoreUnavailableException}.
 */
public interface AccessDirectory {

  /**
   * Roles currently assigned to the principal.
   *
   * @return assigned roles, empty when none (or the principal is unknown)
   */
  List<Role> getRolesForPrincipal(Deadline deadline, long principalId);

  /**
   * Permissions granted by a role.
   *
   * @return granted permissions, empty when none
   */
  List<Permission> getPermissionsForRole(Deadline deadline, long roleId);

  /**
   * Whether the principal may still authenticate.
   *
   * @return false for disabled or unknown principals
   */
  boolean isPrincipalActive(Deadline deadline, long principalId);

  /** Current identity attributes of the principal. */
  Optional<Principal> findPrincipal(Deadline deadline, long principalId);
}
