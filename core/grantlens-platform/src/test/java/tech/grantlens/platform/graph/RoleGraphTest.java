package tech.grantlens.platform.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.grantlens.platform.snapshot.PrincipalRef;
import tech.grantlens.platform.snapshot.RawEntities;
import tech.grantlens.platform.snapshot.RawGrant;
import tech.grantlens.platform.snapshot.RawRoleGrant;
import tech.grantlens.platform.snapshot.RawSettingsProfile;
import tech.grantlens.platform.snapshot.RawUser;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static tech.grantlens.platform.test.RawEntitiesBuilder.entities;

/**
 * Unit tests for RoleGraph construction and resolution.
 */
class RoleGraphTest {

    private static final String SNAPSHOT = "snp_0HZTEST000001";

    private static RoleGraph graph(RawEntities raw) {
        return RoleGraph.build(SNAPSHOT, raw);
    }

    // ========================================
    // Role closure
    // ========================================

    @Test
    @DisplayName("resolve should follow two hops with provenance paths")
    void resolve_shouldFollowTwoHops_withProvenancePaths() {
        RoleGraph graph = graph(entities()
            .users("user_a")
            .roles("role_x", "role_y")
            .userInRole("user_a", "role_x")
            .roleInRole("role_x", "role_y")
            .roleGrant("role_y", "SYSTEM", null, null)
            .build());

        ResolvedPrincipal resolved = graph.resolve(PrincipalRef.user("user_a"));

        assertThat(resolved.roles()).containsExactly(
            new RoleClosureEntry("role_x", true, false, List.of("role_x")),
            new RoleClosureEntry("role_y", false, false, List.of("role_x", "role_y")));
        assertThat(resolved.privileges()).containsExactly(
            new EffectivePrivilege("SYSTEM", null, null, null, false, PrivilegeSource.ROLE, "role_y",
                List.of("role_x", "role_y")));
        assertThat(graph.anomalies()).isEmpty();
    }

    @Test
    @DisplayName("resolve should terminate on a role cycle without duplicating roles")
    void resolve_shouldTerminate_whenRolesFormCycle() {
        RoleGraph graph = graph(entities()
            .users("alice")
            .roles("role_a", "role_b")
            .userInRole("alice", "role_a")
            .roleInRole("role_a", "role_b")
            .roleInRole("role_b", "role_a")
            .build());

        ResolvedPrincipal resolved = graph.resolve(PrincipalRef.user("alice"));

        assertThat(resolved.roles()).extracting(RoleClosureEntry::roleName)
            .containsExactly("role_a", "role_b");
        assertThat(graph.anomalies()).extracting(GraphAnomaly::kind)
            .containsExactly(GraphAnomaly.Kind.ROLE_CYCLE);
    }

    @Test
    @DisplayName("resolve should never put the start role in its own closure")
    void resolve_shouldExcludeStartRole_whenResolvingRole() {
        RoleGraph graph = graph(entities()
            .roles("role_a", "role_b", "role_c")
            .roleInRole("role_a", "role_b")
            .roleInRole("role_b", "role_c")
            .roleInRole("role_c", "role_a")
            .roleInRole("role_a", "role_a")
            .build());

        ResolvedPrincipal resolved = graph.resolve(PrincipalRef.role("role_a"));

        assertThat(resolved.roles()).extracting(RoleClosureEntry::roleName)
            .containsExactly("role_b", "role_c");
        assertThat(resolved.roles()).allMatch(entry -> !entry.path().contains("role_a"));
    }

    @Test
    @DisplayName("resolve should keep the first discovered path when a role is reachable twice")
    void resolve_shouldKeepShortestPath_whenRoleReachableTwice() {
        RoleGraph graph = graph(entities()
            .users("bob")
            .roles("ops", "dev", "base")
            .userInRole("bob", "ops")
            .userInRole("bob", "dev")
            .roleInRole("ops", "dev")
            .roleInRole("dev", "base")
            .roleInRole("ops", "base")
            .build());

        ResolvedPrincipal resolved = graph.resolve(PrincipalRef.user("bob"));

        assertThat(resolved.roles()).containsExactly(
            new RoleClosureEntry("ops", true, false, List.of("ops")),
            new RoleClosureEntry("dev", true, false, List.of("dev")),
            new RoleClosureEntry("base", false, false, List.of("ops", "base")));
    }

    @Test
    @DisplayName("resolve should mark default roles only one level below direct roles")
    void resolve_shouldPropagateDefaultFlag_onlyFromDirectRoles() {
        RoleGraph graph = graph(entities()
            .user(new RawUser("carol", null, List.of("10.0.0.1"), false, List.of("reader", "nested", "deep")))
            .roles("reader", "nested", "deep", "other")
            .userInRole("carol", "reader")
            .roleInRole("reader", "nested")
            .roleInRole("nested", "deep")
            .roleGrant(new RawRoleGrant(PrincipalRef.user("carol"), "other", true, false))
            .build());

        ResolvedPrincipal resolved = graph.resolve(PrincipalRef.user("carol"));

        assertThat(resolved.roles()).extracting(RoleClosureEntry::roleName, RoleClosureEntry::isDefault)
            .containsExactly(
                tuple("reader", true),
                tuple("other", true),
                tuple("nested", true),
                tuple("deep", false));
    }

    @Test
    @DisplayName("resolve should mark every direct role default when all roles are default")
    void resolve_shouldMarkDirectRolesDefault_whenDefaultRolesAll() {
        RoleGraph graph = graph(entities()
            .user(new RawUser("dave", null, List.of(), true, List.of()))
            .roles("r1", "r2")
            .userInRole("dave", "r1")
            .roleInRole("r1", "r2")
            .build());

        ResolvedPrincipal resolved = graph.resolve(PrincipalRef.user("dave"));

        assertThat(resolved.roles()).extracting(RoleClosureEntry::roleName, RoleClosureEntry::isDefault)
            .containsExactly(tuple("r1", true), tuple("r2", false));
    }

    @Test
    @DisplayName("resolve should reject principals outside the snapshot")
    void resolve_shouldThrow_whenPrincipalUnknown() {
        RoleGraph graph = graph(entities().users("alice").build());

        assertThatThrownBy(() -> graph.resolve(PrincipalRef.user("mallory")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("user:mallory");
    }

    @Test
    @DisplayName("users and roles sharing a name should stay separate principals")
    void resolve_shouldSeparateUserAndRole_withSameName() {
        RoleGraph graph = graph(entities()
            .users("analytics")
            .roles("analytics")
            .userGrant("analytics", "SELECT", "db1", null)
            .roleGrant("analytics", "INSERT", "db1", null)
            .build());

        assertThat(graph.resolve(PrincipalRef.user("analytics")).privileges())
            .extracting(EffectivePrivilege::accessType).containsExactly("SELECT");
        assertThat(graph.resolve(PrincipalRef.role("analytics")).privileges())
            .extracting(EffectivePrivilege::accessType).containsExactly("INSERT");
    }

    // ========================================
    // Effective privileges
    // ========================================

    @Test
    @DisplayName("privileges should list direct grants before role grants")
    void privileges_shouldListDirectFirst() {
        RoleGraph graph = graph(entities()
            .users("erin")
            .roles("reader")
            .userInRole("erin", "reader")
            .roleGrant("reader", "SELECT", "sales", null)
            .userGrant("erin", "INSERT", "sales", "orders")
            .build());

        assertThat(graph.resolve(PrincipalRef.user("erin")).privileges())
            .extracting(EffectivePrivilege::accessType, EffectivePrivilege::source, EffectivePrivilege::sourceName)
            .containsExactly(
                tuple("INSERT", PrivilegeSource.DIRECT, "erin"),
                tuple("SELECT", PrivilegeSource.ROLE, "reader"));
    }

    @Test
    @DisplayName("privileges should collapse only identical keys and keep overlapping grants")
    void privileges_shouldCollapseOnlyIdenticalKeys() {
        RoleGraph graph = graph(entities()
            .users("frank")
            .roles("r1", "r2")
            .userInRole("frank", "r1")
            .userInRole("frank", "r2")
            .roleGrant("r1", "SELECT", "db", null)
            .roleGrant("r1", "SELECT", "db", null)
            .roleGrant("r2", "SELECT", "db", null)
            .roleGrant("r2", "SELECT", "db", "t1")
            .build());

        assertThat(graph.resolve(PrincipalRef.user("frank")).privileges())
            .extracting(EffectivePrivilege::sourceName, EffectivePrivilege::table)
            .containsExactly(tuple("r1", null), tuple("r2", null), tuple("r2", "t1"));
    }

    @Test
    @DisplayName("privileges should keep the grant option when a duplicate carries it")
    void privileges_shouldUpgradeGrantOption_whenDuplicateHasIt() {
        RoleGraph graph = graph(entities()
            .users("gina")
            .userGrant("gina", "SELECT", "db", null)
            .grant(new RawGrant(PrincipalRef.user("gina"), "SELECT", "db", null, null, true, false))
            .build());

        assertThat(graph.resolve(PrincipalRef.user("gina")).privileges())
            .singleElement()
            .extracting(EffectivePrivilege::grantOption)
            .isEqualTo(true);
    }

    @Test
    @DisplayName("partial revoke should remove the covered grants of the same holder only")
    void privileges_shouldApplyPartialRevoke_perHolder() {
        RoleGraph graph = graph(entities()
            .users("hank")
            .roles("reader")
            .userInRole("hank", "reader")
            .userGrant("hank", "SELECT", "finance", "ledger")
            .userGrant("hank", "SELECT", "finance", "budget")
            .grant(new RawGrant(PrincipalRef.user("hank"), "SELECT", "finance", "ledger", null, false, true))
            .roleGrant("reader", "SELECT", "finance", "ledger")
            .build());

        assertThat(graph.resolve(PrincipalRef.user("hank")).privileges())
            .extracting(EffectivePrivilege::table, EffectivePrivilege::sourceName)
            .containsExactly(tuple("budget", "hank"), tuple("ledger", "reader"));
    }

    @Test
    @DisplayName("partial revoke without scope should cover every grant of that access type")
    void isRevoked_shouldMatchAnyScope_whenRevokeHasNoDatabase() {
        RawGrant revoke = new RawGrant(PrincipalRef.role("r"), "INSERT", null, null, null, false, true);

        assertThat(RoleGraph.isRevoked(RawGrant.of(PrincipalRef.role("r"), "INSERT", "a", "b"), List.of(revoke)))
            .isTrue();
        assertThat(RoleGraph.isRevoked(RawGrant.of(PrincipalRef.role("r"), "SELECT", "a", "b"), List.of(revoke)))
            .isFalse();
    }

    @Test
    @DisplayName("column revoke should only remove the grant on that column")
    void privileges_shouldApplyColumnRevoke_toMatchingColumnOnly() {
        PrincipalRef kim = PrincipalRef.user("kim");
        RoleGraph graph = graph(entities()
            .users("kim")
            .grant(new RawGrant(kim, "SELECT", "hr", "staff", "name", false, false))
            .grant(new RawGrant(kim, "SELECT", "hr", "staff", "salary", false, false))
            .grant(new RawGrant(kim, "SELECT", "hr", "staff", "salary", false, true))
            .build());

        assertThat(graph.resolve(kim).privileges())
            .extracting(EffectivePrivilege::table, EffectivePrivilege::column)
            .containsExactly(tuple("staff", "name"));
    }

    @Test
    @DisplayName("table revoke should cover every column grant of the table")
    void isRevoked_shouldCoverColumns_whenRevokeHasNoColumn() {
        PrincipalRef kim = PrincipalRef.user("kim");
        RawGrant revoke = new RawGrant(kim, "SELECT", "hr", "staff", null, false, true);

        assertThat(RoleGraph.isRevoked(new RawGrant(kim, "SELECT", "hr", "staff", "salary", false, false),
            List.of(revoke))).isTrue();
        assertThat(RoleGraph.isRevoked(new RawGrant(kim, "SELECT", "hr", "payroll", "salary", false, false),
            List.of(revoke))).isFalse();
    }

    // ========================================
    // Settings profiles
    // ========================================

    @Test
    @DisplayName("settingsProfiles should return profiles listing the user or applying to all")
    void settingsProfiles_shouldReturnAssignedProfiles() {
        RoleGraph graph = graph(entities()
            .users("lena", "max")
            .settingsProfile(RawSettingsProfile.forUsers("readonly", "lena"))
            .settingsProfile(new RawSettingsProfile("default", true, List.of(), List.of("max")))
            .settingsProfile(RawSettingsProfile.forUsers("etl", "max"))
            .build());

        assertThat(graph.settingsProfiles("lena"))
            .extracting(RawSettingsProfile::name).containsExactly("readonly", "default");
        assertThat(graph.settingsProfiles("max"))
            .extracting(RawSettingsProfile::name).containsExactly("etl");
        assertThat(graph.settingsProfiles("nobody"))
            .extracting(RawSettingsProfile::name).containsExactly("default");
    }

    // ========================================
    // Malformed input
    // ========================================

    @Test
    @DisplayName("build should skip dangling references and record anomalies")
    void build_shouldSkipDanglingReferences() {
        RoleGraph graph = graph(entities()
            .users("ivy")
            .roles("known")
            .userInRole("ivy", "missing_role")
            .userInRole("ghost", "known")
            .userInRole("ivy", "known")
            .roleGrant("phantom", "SELECT", "db", null)
            .build());

        assertThat(graph.anomalies()).extracting(GraphAnomaly::kind).containsExactly(
            GraphAnomaly.Kind.DANGLING_ROLE,
            GraphAnomaly.Kind.DANGLING_GRANTEE,
            GraphAnomaly.Kind.DANGLING_PRIVILEGE_GRANTEE);
        assertThat(graph.members("known")).containsExactly(PrincipalRef.user("ivy"));
        assertThat(graph.resolve(PrincipalRef.user("ivy")).roles())
            .extracting(RoleClosureEntry::roleName).containsExactly("known");
    }

    @Test
    @DisplayName("build should keep the first of duplicated principals")
    void build_shouldKeepFirstPrincipal_whenNameDuplicated() {
        RoleGraph graph = graph(entities()
            .user(new RawUser("jack", "plaintext_password", List.of(), false, List.of()))
            .user(new RawUser("jack", "sha256_password", List.of(), false, List.of()))
            .roles("r", "r")
            .build());

        assertThat(graph.userNames()).containsExactly("jack");
        assertThat(graph.roleNames()).containsExactly("r");
        assertThat(graph.user("jack")).get().extracting(RawUser::authType).isEqualTo("plaintext_password");
        assertThat(graph.anomalies()).extracting(GraphAnomaly::kind)
            .containsExactly(GraphAnomaly.Kind.DUPLICATE_PRINCIPAL, GraphAnomaly.Kind.DUPLICATE_PRINCIPAL);
    }

    @Test
    @DisplayName("members should list distinct users and roles in grant order")
    void members_shouldListDistinctMembers() {
        RoleGraph graph = graph(entities()
            .users("u1")
            .roles("parent", "child")
            .roleInRole("child", "parent")
            .userInRole("u1", "parent")
            .userInRole("u1", "parent")
            .build());

        assertThat(graph.members("parent"))
            .containsExactly(PrincipalRef.role("child"), PrincipalRef.user("u1"));
        assertThat(graph.members("child")).isEmpty();
        assertThat(graph.members("unknown")).isEmpty();
    }
}
