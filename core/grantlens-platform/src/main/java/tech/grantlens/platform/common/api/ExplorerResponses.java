package tech.grantlens.platform.common.api;

import org.eclipse.microprofile.openapi.annotations.media.Schema;
import tech.grantlens.platform.graph.EffectivePrivilege;
import tech.grantlens.platform.graph.ObjectAccessEntry;
import tech.grantlens.platform.graph.ObjectScope;
import tech.grantlens.platform.graph.RoleClosureEntry;
import tech.grantlens.platform.snapshot.PrincipalKind;
import tech.grantlens.platform.snapshot.PrincipalRef;
import tech.grantlens.platform.snapshot.RawGrant;
import tech.grantlens.platform.snapshot.RawSettingsProfile;

import java.util.List;

/**
 * Response DTOs for the RBAC explorer endpoints.
 */
public final class ExplorerResponses {

    private ExplorerResponses() {}

    // ========================================================================
    // Users
    // ========================================================================

    @Schema(description = "User in a snapshot")
    public record UserSummary(
        @Schema(description = "User name", example = "alice")
        String name,
        @Schema(description = "Authentication method", example = "sha256_password")
        String authType,
        @Schema(description = "Allowed source addresses; empty means any")
        List<String> hostIp,
        @Schema(description = "Roles in the user's transitive closure")
        int roleCount,
        @Schema(description = "Privileges granted to the user itself, partial revokes excluded")
        int directGrantCount
    ) {}

    @Schema(description = "User with resolved roles and effective privileges")
    public record UserDetail(
        String name,
        String authType,
        boolean defaultRolesAll,
        List<String> hostIp,
        List<String> defaultRoles,
        @Schema(description = "Transitive role closure in discovery order")
        List<RoleClosureEntry> allRoles,
        @Schema(description = "Effective privileges with provenance")
        List<EffectivePrivilege> effectivePrivileges,
        @Schema(description = "Settings profiles assigned to the user")
        List<RawSettingsProfile> settingsProfiles
    ) {}

    // ========================================================================
    // Roles
    // ========================================================================

    @Schema(description = "Role in a snapshot")
    public record RoleSummary(
        @Schema(description = "Role name", example = "analyst")
        String name,
        @Schema(description = "Users and roles granted this role")
        int memberCount,
        @Schema(description = "Privileges granted to the role itself, partial revokes excluded")
        int directGrantCount
    ) {}

    @Schema(description = "Principal holding a role")
    public record RoleMember(
        String name,
        @Schema(description = "user or role")
        PrincipalKind type
    ) {
        public static RoleMember from(PrincipalRef ref) {
            return new RoleMember(ref.name(), ref.kind());
        }
    }

    @Schema(description = "Role reached from another role")
    public record InheritedRole(
        String roleName,
        @Schema(description = "Role chain from the inspected role, inclusive of this one")
        List<String> path
    ) {
        public static InheritedRole from(RoleClosureEntry entry) {
            return new InheritedRole(entry.roleName(), entry.path());
        }
    }

    @Schema(description = "Privilege granted directly")
    public record GrantDto(
        @Schema(example = "SELECT")
        String accessType,
        @Schema(description = "Database; null for global scope")
        String database,
        @Schema(description = "Table; null for every table of the database")
        String table,
        @Schema(description = "Column; null for every column of the table")
        String column,
        boolean grantOption
    ) {
        public static GrantDto from(RawGrant grant) {
            return new GrantDto(grant.accessType(), grant.database(), grant.table(), grant.column(),
                grant.grantOption());
        }
    }

    @Schema(description = "Role with members, inherited roles and direct grants")
    public record RoleDetail(
        String name,
        List<RoleMember> members,
        List<InheritedRole> inheritedRoles,
        List<GrantDto> directGrants
    ) {}

    // ========================================================================
    // Objects
    // ========================================================================

    @Schema(description = "Principals with access to a database or table")
    public record ObjectAccessResponse(
        @Schema(example = "analytics")
        String database,
        @Schema(description = "Table; null when the whole database was looked up", example = "sales")
        String table,
        @Schema(description = "exact or covering")
        ObjectScope.Mode scope,
        List<ObjectAccessEntry> entries
    ) {}
}
