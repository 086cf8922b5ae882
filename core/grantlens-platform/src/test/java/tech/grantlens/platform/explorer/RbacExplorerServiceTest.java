package tech.grantlens.platform.explorer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.grantlens.platform.cache.ResolutionCache;
import tech.grantlens.platform.common.api.ExplorerResponses.GrantDto;
import tech.grantlens.platform.common.api.ExplorerResponses.InheritedRole;
import tech.grantlens.platform.common.api.ExplorerResponses.ObjectAccessResponse;
import tech.grantlens.platform.common.api.ExplorerResponses.RoleDetail;
import tech.grantlens.platform.common.api.ExplorerResponses.RoleMember;
import tech.grantlens.platform.common.api.ExplorerResponses.RoleSummary;
import tech.grantlens.platform.common.api.ExplorerResponses.UserDetail;
import tech.grantlens.platform.common.api.ExplorerResponses.UserSummary;
import tech.grantlens.platform.common.errors.ExplorerError;
import tech.grantlens.platform.common.errors.ExplorerException;
import tech.grantlens.platform.diff.SnapshotDiff;
import tech.grantlens.platform.diff.SnapshotDiffEngine;
import tech.grantlens.platform.graph.EffectivePrivilege;
import tech.grantlens.platform.graph.ObjectAccessEntry;
import tech.grantlens.platform.graph.ObjectScope;
import tech.grantlens.platform.graph.PrivilegeSource;
import tech.grantlens.platform.graph.RoleClosureEntry;
import tech.grantlens.platform.graph.RoleGraphResolver;
import tech.grantlens.platform.risk.RiskAnalyzer;
import tech.grantlens.platform.risk.RiskFinding;
import tech.grantlens.platform.risk.RiskPolicy;
import tech.grantlens.platform.risk.RiskType;
import tech.grantlens.platform.snapshot.PrincipalKind;
import tech.grantlens.platform.snapshot.PrincipalRef;
import tech.grantlens.platform.snapshot.RawEntities;
import tech.grantlens.platform.snapshot.RawGrant;
import tech.grantlens.platform.snapshot.RawRoleGrant;
import tech.grantlens.platform.snapshot.RawSettingsProfile;
import tech.grantlens.platform.snapshot.SnapshotService;
import tech.grantlens.platform.snapshot.SnapshotStatus;
import tech.grantlens.platform.test.TestSnapshots;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static tech.grantlens.platform.test.RawEntitiesBuilder.entities;
import static tech.grantlens.platform.test.TestSnapshots.completed;
import static tech.grantlens.platform.test.TestSnapshots.snapshot;

/**
 * Unit tests for RbacExplorerService.
 * The snapshot store is mocked; resolver, risk analyzer and diff engine are real.
 */
@ExtendWith(MockitoExtension.class)
class RbacExplorerServiceTest {

    private static final String CLUSTER = "prod-eu";
    private static final String S1 = "snp_0HZTEST000001";
    private static final String S2 = "snp_0HZTEST000002";

    @Mock
    private SnapshotService snapshotService;

    private RbacExplorerService service;

    private final RawEntities s1 = entities()
        .users("user_a", "member")
        .roles("role_x", "role_y", "role_z")
        .userInRole("user_a", "role_x")
        .roleInRole("role_x", "role_y")
        .roleGrant("role_y", "SYSTEM", null, null)
        .userInRole("member", "role_z")
        .roleGrant("role_z", "SELECT", "analytics", "sales")
        .grant(new RawGrant(PrincipalRef.role("role_z"), "INSERT", "analytics", "sales", null, false, true))
        .userGrant("user_a", "SELECT", "analytics", "sales")
        .userGrant("user_a", "INSERT", "analytics", null)
        .build();

    private final RawEntities s2 = entities()
        .users("user_a", "member")
        .roles("role_x", "role_y", "role_z")
        .userInRole("user_a", "role_x")
        .roleInRole("role_x", "role_y")
        .roleGrant("role_y", "SYSTEM", null, null)
        .roleGrant("role_z", "SELECT", "analytics", "sales")
        .grant(new RawGrant(PrincipalRef.role("role_z"), "INSERT", "analytics", "sales", null, false, true))
        .userGrant("user_a", "SELECT", "analytics", "sales")
        .userGrant("user_a", "INSERT", "analytics", null)
        .build();

    @BeforeEach
    void setUp() {
        ResolutionCache cache = TestSnapshots.cache();
        RoleGraphResolver resolver = new RoleGraphResolver(snapshotService, cache);

        service = new RbacExplorerService();
        service.snapshotService = snapshotService;
        service.resolver = resolver;
        service.riskAnalyzer = new RiskAnalyzer(resolver, cache, RiskPolicy.defaults());
        service.diffEngine = new SnapshotDiffEngine();
        service.cache = cache;
    }

    private void givenLatest(String snapshotId, RawEntities raw) {
        when(snapshotService.select(CLUSTER, null)).thenReturn(completed(snapshotId, CLUSTER));
        when(snapshotService.getRawEntities(snapshotId)).thenReturn(raw);
    }

    // ========================================
    // Users
    // ========================================

    @Test
    @DisplayName("listUsers should count closure roles and non-revoke direct grants")
    void listUsers_shouldSummarizeUsers() {
        givenLatest(S1, s1);

        List<UserSummary> users = service.listUsers(CLUSTER, null);

        assertThat(users).extracting(UserSummary::name, UserSummary::roleCount, UserSummary::directGrantCount)
            .containsExactly(tuple("user_a", 2, 2), tuple("member", 1, 0));
    }

    @Test
    @DisplayName("getUserDetail should expose closure and effective privileges")
    void getUserDetail_shouldResolveUser() {
        givenLatest(S1, s1);

        UserDetail detail = service.getUserDetail(CLUSTER, null, "user_a");

        assertThat(detail.allRoles()).extracting(RoleClosureEntry::roleName, RoleClosureEntry::isDirect, RoleClosureEntry::path)
            .containsExactly(
                tuple("role_x", true, List.of("role_x")),
                tuple("role_y", false, List.of("role_x", "role_y")));
        assertThat(detail.effectivePrivileges()).contains(
            new EffectivePrivilege("SYSTEM", null, null, null, false, PrivilegeSource.ROLE, "role_y",
                List.of("role_x", "role_y")));
    }

    @Test
    @DisplayName("getUserDetail should list the settings profiles assigned to the user")
    void getUserDetail_shouldListSettingsProfiles() {
        givenLatest(S1, entities()
            .users("user_a", "member")
            .settingsProfile(RawSettingsProfile.forUsers("readonly", "member"))
            .settingsProfile(new RawSettingsProfile("default", true, List.of(), List.of()))
            .build());

        UserDetail detail = service.getUserDetail(CLUSTER, null, "user_a");

        assertThat(detail.settingsProfiles()).extracting(RawSettingsProfile::name).containsExactly("default");
    }

    @Test
    @DisplayName("getUserDetail should throw NotFound for unknown user")
    void getUserDetail_shouldThrowNotFound_whenUserUnknown() {
        givenLatest(S1, s1);

        assertThatThrownBy(() -> service.getUserDetail(CLUSTER, null, "nobody"))
            .isInstanceOf(ExplorerException.class)
            .hasMessage("User not found: nobody");
    }

    @Test
    @DisplayName("getUserRisks should flag the two-hop SYSTEM privilege")
    void getUserRisks_shouldFlagInheritedAdmin() {
        givenLatest(S1, s1);

        assertThat(service.getUserRisks(CLUSTER, null, "user_a"))
            .extracting(RiskFinding::type).containsExactly(RiskType.INHERITED_ADMIN_PRIVILEGE);
    }

    // ========================================
    // Roles
    // ========================================

    @Test
    @DisplayName("listRoles should count members and direct grants without revokes")
    void listRoles_shouldSummarizeRoles() {
        givenLatest(S1, s1);

        assertThat(service.listRoles(CLUSTER, null))
            .containsExactly(
                new RoleSummary("role_x", 1, 0),
                new RoleSummary("role_y", 1, 1),
                new RoleSummary("role_z", 1, 1));
    }

    @Test
    @DisplayName("getRoleDetail should list members, inherited roles and grants")
    void getRoleDetail_shouldDescribeRole() {
        givenLatest(S1, s1);

        RoleDetail detail = service.getRoleDetail(CLUSTER, null, "role_x");

        assertThat(detail.members()).containsExactly(new RoleMember("user_a", PrincipalKind.USER));
        assertThat(detail.inheritedRoles()).containsExactly(new InheritedRole("role_y", List.of("role_y")));
        assertThat(detail.directGrants()).isEmpty();
        assertThat(service.getRoleDetail(CLUSTER, null, "role_z").directGrants())
            .containsExactly(new GrantDto("SELECT", "analytics", "sales", null, false));
    }

    @Test
    @DisplayName("getRoleDetail should throw NotFound for a user name")
    void getRoleDetail_shouldThrowNotFound_whenRoleUnknown() {
        givenLatest(S1, s1);

        assertThatThrownBy(() -> service.getRoleDetail(CLUSTER, null, "user_a"))
            .hasMessage("Role not found: user_a");
    }

    @Test
    @DisplayName("getRoleEffectivePrivileges should include inherited privileges")
    void getRoleEffectivePrivileges_shouldResolveRole() {
        givenLatest(S1, s1);

        assertThat(service.getRoleEffectivePrivileges(CLUSTER, null, "role_x"))
            .containsExactly(new EffectivePrivilege("SYSTEM", null, null, null, false, PrivilegeSource.ROLE, "role_y",
                List.of("role_y")));
    }

    // ========================================
    // Objects
    // ========================================

    @Test
    @DisplayName("getObjectAccess should list every principal with access to analytics.sales")
    void getObjectAccess_shouldListPrincipalsOnTable() {
        givenLatest(S1, s1);

        ObjectAccessResponse response = service.getObjectAccess(CLUSTER, null, "analytics", "sales", null);

        assertThat(response.database()).isEqualTo("analytics");
        assertThat(response.table()).isEqualTo("sales");
        assertThat(response.scope()).isEqualTo(ObjectScope.Mode.EXACT);
        assertThat(response.entries()).containsExactly(
            new ObjectAccessEntry("user_a", PrincipalKind.USER, List.of("SELECT"), "user_a"),
            new ObjectAccessEntry("member", PrincipalKind.USER, List.of("SELECT"), "role_z"),
            new ObjectAccessEntry("role_z", PrincipalKind.ROLE, List.of("SELECT"), "role_z"));
    }

    @Test
    @DisplayName("getObjectAccess should reject an unknown scope before touching snapshots")
    void getObjectAccess_shouldThrowValidation_whenScopeUnknown() {
        assertThatThrownBy(() -> service.getObjectAccess(CLUSTER, null, "analytics", "sales", "fuzzy"))
            .isInstanceOf(ExplorerException.class)
            .satisfies(thrown -> assertThat(((ExplorerException) thrown).getError())
                .isInstanceOf(ExplorerError.ValidationError.class));
        verifyNoInteractions(snapshotService);
    }

    // ========================================
    // Risk summary and diff
    // ========================================

    @Test
    @DisplayName("removing the only member of role_z should show in diff and orphan roles")
    void diffAndRisk_shouldReportRemovedMembership() {
        when(snapshotService.getSnapshot(S1)).thenReturn(completed(S1, CLUSTER));
        when(snapshotService.getSnapshot(S2)).thenReturn(completed(S2, CLUSTER));
        when(snapshotService.getRawEntities(S1)).thenReturn(s1);
        when(snapshotService.getRawEntities(S2)).thenReturn(s2);
        when(snapshotService.select(CLUSTER, S2)).thenReturn(completed(S2, CLUSTER));

        SnapshotDiff diff = service.diffSnapshots(S1, S2);

        assertThat(diff.roleGrants().removed())
            .containsExactly(RawRoleGrant.of(PrincipalRef.user("member"), "role_z"));
        assertThat(diff.roleGrants().added()).isEmpty();
        assertThat(service.getRiskSummary(CLUSTER, S2).orphanRoles()).contains("role_z");
    }

    @Test
    @DisplayName("diffSnapshots should reject comparing a snapshot with itself")
    void diffSnapshots_shouldThrowInvalidPair_whenSameSnapshot() {
        assertThatThrownBy(() -> service.diffSnapshots(S1, S1))
            .satisfies(thrown -> assertThat(((ExplorerException) thrown).getError())
                .isInstanceOf(ExplorerError.InvalidDiffPair.class));
        verifyNoInteractions(snapshotService);
    }

    @Test
    @DisplayName("diffSnapshots should reject snapshots of different clusters")
    void diffSnapshots_shouldThrowInvalidPair_whenClustersDiffer() {
        when(snapshotService.getSnapshot(S1)).thenReturn(completed(S1, CLUSTER));
        when(snapshotService.getSnapshot(S2)).thenReturn(completed(S2, "staging"));

        assertThatThrownBy(() -> service.diffSnapshots(S1, S2))
            .satisfies(thrown -> assertThat(((ExplorerException) thrown).getError())
                .isInstanceOf(ExplorerError.InvalidDiffPair.class));
        verify(snapshotService, never()).getRawEntities(any());
    }

    @Test
    @DisplayName("diffSnapshots should reject a pending snapshot")
    void diffSnapshots_shouldThrowNotReady_whenSnapshotPending() {
        when(snapshotService.getSnapshot(S1)).thenReturn(completed(S1, CLUSTER));
        when(snapshotService.getSnapshot(S2)).thenReturn(snapshot(S2, CLUSTER, SnapshotStatus.PENDING));

        assertThatThrownBy(() -> service.diffSnapshots(S1, S2))
            .satisfies(thrown -> assertThat(((ExplorerException) thrown).getError())
                .isInstanceOf(ExplorerError.SnapshotNotReady.class));
    }

    @Test
    @DisplayName("queries should surface SnapshotNotReady from snapshot selection")
    void listUsers_shouldPropagateNotReady() {
        when(snapshotService.select(CLUSTER, S2))
            .thenThrow(new ExplorerException(ExplorerError.snapshotNotReady(S2, "FAILED")));

        assertThatThrownBy(() -> service.listUsers(CLUSTER, S2))
            .hasMessageContaining("failed");
    }
}
