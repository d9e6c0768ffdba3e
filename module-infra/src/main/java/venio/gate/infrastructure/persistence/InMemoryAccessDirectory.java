package venio.gate.infrastructure.persistence;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import venio.gate.core.concurrency.Deadline;
import venio.gate.core.domain.model.Permission;
import venio.gate.core.domain.model.Principal;
import venio.gate.core.domain.model.Role;
import venio.gate.core.domain.model.RolePermission;
import venio.gate.core.domain.model.UserRole;
import venio.gate.core.port.out.AccessDirectory;
import venio.gate.infrastructure.cache.invalidation.PermissionInvalidationEvent;

/**
 * 메모리 기반 AccessDirectory 레퍼런스 구현
 *
 * <p>principal/role/permission 엔티티와 {@link UserRole}, {@link RolePermission} 연관 레코드를 보관합니다. 객체
 * 참조 그래프 대신 연관 레코드를 명시적으로 조인해 조회합니다.
 *
 * <h4>변경 알림</h4>
 *
 * <p>역할 할당/권한 부여 변경 시 등록된 리스너에 {@link PermissionInvalidationEvent}를 전달합니다. 권한 캐시 무효화 발행자가
 * 리스너로 연결됩니다.
 */
@Slf4j
public class InMemoryAccessDirectory implements AccessDirectory {

  private final Map<Long, PrincipalRecord> principals = new ConcurrentHashMap<>();
  private final Map<Long, Role> roles = new ConcurrentHashMap<>();
  private final Map<Long, Permission> permissions = new ConcurrentHashMap<>();
  private final Set<UserRole> userRoles = ConcurrentHashMap.newKeySet();
  private final Set<RolePermission> rolePermissions = ConcurrentHashMap.newKeySet();
  private final List<Consumer<PermissionInvalidationEvent>> listeners =
      new CopyOnWriteArrayList<>();
  private final AtomicLong sequence = new AtomicLong();

  private record PrincipalRecord(Principal principal, boolean active) {}

  // ==================== AccessDirectory ====================

  @Override
  public List<Role> getRolesForPrincipal(Deadline deadline, long principalId) {
    deadline.throwIfDone("roles-for-principal");
    List<Role> result = new ArrayList<>();
    for (UserRole assignment : userRoles) {
      if (assignment.principalId() == principalId) {
        Role role = roles.get(assignment.roleId());
        if (role != null) {
          result.add(role);
        }
      }
    }
    result.sort(Comparator.comparingLong(Role::id));
    return List.copyOf(result);
  }

  @Override
  public List<Permission> getPermissionsForRole(Deadline deadline, long roleId) {
    deadline.throwIfDone("permissions-for-role");
    List<Permission> result = new ArrayList<>();
    for (RolePermission grant : rolePermissions) {
      if (grant.roleId() == roleId) {
        Permission permission = permissions.get(grant.permissionId());
        if (permission != null) {
          result.add(permission);
        }
      }
    }
    result.sort(Comparator.comparingLong(Permission::id));
    return List.copyOf(result);
  }

  @Override
  public boolean isPrincipalActive(Deadline deadline, long principalId) {
    deadline.throwIfDone("principal-active");
    PrincipalRecord record = principals.get(principalId);
    return record != null && record.active();
  }

  @Override
  public Optional<Principal> findPrincipal(Deadline deadline, long principalId) {
    deadline.throwIfDone("find-principal");
    return Optional.ofNullable(principals.get(principalId)).map(PrincipalRecord::principal);
  }

  // ==================== Mutations ====================

  public void addChangeListener(Consumer<PermissionInvalidationEvent> listener) {
    listeners.add(listener);
  }

  public Principal savePrincipal(String handle, String email, boolean active) {
    Principal principal = new Principal(sequence.incrementAndGet(), handle, email);
    principals.put(principal.id(), new PrincipalRecord(principal, active));
    return principal;
  }

  public void setPrincipalActive(long principalId, boolean active) {
    principals.computeIfPresent(
        principalId, (id, record) -> new PrincipalRecord(record.principal(), active));
  }

  public Role saveRole(String name, String description) {
    Optional<Role> existing = findRoleByName(name);
    if (existing.isPresent()) {
      return existing.get();
    }
    Role role = new Role(sequence.incrementAndGet(), name, description);
    roles.put(role.id(), role);
    return role;
  }

  public Permission savePermission(String name, String description) {
    Optional<Permission> existing =
        permissions.values().stream().filter(p -> p.name().equals(name)).findFirst();
    if (existing.isPresent()) {
      return existing.get();
    }
    Permission permission = new Permission(sequence.incrementAndGet(), name, description);
    permissions.put(permission.id(), permission);
    return permission;
  }

  public Optional<Role> findRoleByName(String name) {
    return roles.values().stream().filter(r -> r.name().equals(name)).findFirst();
  }

  public void assignRole(long principalId, long roleId) {
    if (userRoles.add(new UserRole(principalId, roleId))) {
      notifyListeners(PermissionInvalidationEvent.forPrincipal(principalId));
    }
  }

  public void revokeRole(long principalId, long roleId) {
    if (userRoles.remove(new UserRole(principalId, roleId))) {
      notifyListeners(PermissionInvalidationEvent.forPrincipal(principalId));
    }
  }

  public void grantPermission(long roleId, long permissionId) {
    if (rolePermissions.add(new RolePermission(roleId, permissionId))) {
      notifyListeners(PermissionInvalidationEvent.forRole(roleId));
    }
  }

  public void revokePermission(long roleId, long permissionId) {
    if (rolePermissions.remove(new RolePermission(roleId, permissionId))) {
      notifyListeners(PermissionInvalidationEvent.forRole(roleId));
    }
  }

  /** 역할 삭제: 연관 레코드까지 제거 */
  public void deleteRole(long roleId) {
    if (roles.remove(roleId) == null) {
      return;
    }
    userRoles.removeIf(assignment -> assignment.roleId() == roleId);
    rolePermissions.removeIf(grant -> grant.roleId() == roleId);
    notifyListeners(PermissionInvalidationEvent.forRole(roleId));
  }

  private void notifyListeners(PermissionInvalidationEvent event) {
    log.debug(
        "[AccessDirectory] change: type={}, principal={}, role={}",
        event.type(),
        event.principalId(),
        event.roleId());
    listeners.forEach(listener -> listener.accept(event));
  }
}
