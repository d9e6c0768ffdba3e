package venio.gate.seed;

import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import venio.gate.core.domain.model.Permission;
import venio.gate.core.domain.model.Principal;
import venio.gate.core.domain.model.Role;
import venio.gate.infrastructure.persistence.InMemoryAccessDirectory;

/**
 * 기본 역할/권한/테스트 계정 적재 ({@code gate.seed.enabled=true})
 *
 * <ul>
 *   <li>admin: 모든 권한
 *   <li>moderator: users:read, content:read, content:moderate, audit:read
 *   <li>user: users:read, content:read, content:write
 *   <li>guest: users:read, content:read, settings:read
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "gate.seed", name = "enabled", havingValue = "true")
public class DefaultRoleSeeder implements ApplicationRunner {

  static final Map<String, String> PERMISSIONS =
      Map.ofEntries(
          Map.entry("users:read", "Read user information"),
          Map.entry("users:write", "Create and edit users"),
          Map.entry("users:delete", "Delete users"),
          Map.entry("roles:read", "Read roles"),
          Map.entry("roles:write", "Create and edit roles"),
          Map.entry("roles:delete", "Delete roles"),
          Map.entry("permissions:read", "Read permissions"),
          Map.entry("permissions:write", "Create and edit permissions"),
          Map.entry("permissions:delete", "Delete permissions"),
          Map.entry("content:read", "Read content"),
          Map.entry("content:write", "Create and edit content"),
          Map.entry("content:delete", "Delete content"),
          Map.entry("content:moderate", "Moderate content"),
          Map.entry("settings:read", "Read application settings"),
          Map.entry("settings:write", "Modify application settings"),
          Map.entry("audit:read", "Read audit logs"));

  static final Map<String, List<String>> ROLE_GRANTS =
      Map.of(
          "admin", List.copyOf(PERMISSIONS.keySet()),
          "moderator", List.of("users:read", "content:read", "content:moderate", "audit:read"),
          "user", List.of("users:read", "content:read", "content:write"),
          "guest", List.of("users:read", "content:read", "settings:read"));

  private static final Map<String, String> ROLE_DESCRIPTIONS =
      Map.of(
          "admin", "Administrator with full access",
          "moderator", "Moderator with moderation capabilities",
          "user", "Regular user with basic access",
          "guest", "Guest with read-only access");

  private final InMemoryAccessDirectory directory;

  @Override
  public void run(ApplicationArguments args) {
    seed();
  }

  void seed() {
    PERMISSIONS.forEach(directory::savePermission);

    for (Map.Entry<String, List<String>> grant : ROLE_GRANTS.entrySet()) {
      String roleName = grant.getKey();
      Role role = directory.saveRole(roleName, ROLE_DESCRIPTIONS.get(roleName));
      for (String permissionName : grant.getValue()) {
        Permission permission =
            directory.savePermission(permissionName, PERMISSIONS.get(permissionName));
        directory.grantPermission(role.id(), permission.id());
      }

      Principal principal = directory.savePrincipal(roleName, roleName + "@test.local", true);
      directory.assignRole(principal.id(), role.id());
    }
    log.info(
        "[Seed] roles={}, permissions={}, test principals={}",
        ROLE_GRANTS.size(),
        PERMISSIONS.size(),
        ROLE_GRANTS.size());
  }
}
