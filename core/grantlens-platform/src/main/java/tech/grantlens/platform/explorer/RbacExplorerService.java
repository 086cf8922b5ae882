package tech.grantlens.platform.explorer;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
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
import tech.grantlens.platform.graph.ObjectScope;
import tech.grantlens.platform.graph.ResolvedPrincipal;
import tech.grantlens.platform.graph.RoleGraph;
import tech.grantlens.platform.graph.RoleGraphResolver;
import tech.grantlens.platform.risk.RiskAnalyzer;
import tech.grantlens.platform.risk.RiskFinding;
import tech.grantlens.platform.risk.RiskSummary;
import tech.grantlens.platform.snapshot.PrincipalRef;
import tech.grantlens.platform.snapshot.RawGrant;
import tech.grantlens.platform.snapshot.RawUser;
import tech.grantlens.platform.snapshot.Snapshot;
import tech.grantlens.platform.snapshot.SnapshotService;

import java.util.List;

/**
 * Read-only queries over completed snapshots.
 *
 * Every query takes a cluster and an optional snapshot id; without an id the most
 * recently completed snapshot of the cluster is used. Pending, failed and unknown
 * snapshots are reported as errors, never silently replaced by another one.
 */
@ApplicationScoped
public class RbacExplorerService {

    private static final Logger LOG = Logger.getLogger(RbacExplorerService.class);

    static final String DIFFS = "diffs";

    @Inject
    SnapshotService snapshotService;

    @Inject
    RoleGraphResolver resolver;

    @Inject
    RiskAnalyzer riskAnalyzer;

    @Inject
    SnapshotDiffEngine diffEngine;

    @Inject
    ResolutionCache cache;

    // ==================== Users ====================

    public List<UserSummary> listUsers(String clusterId, String snapshotId) {
        String id = select(clusterId, snapshotId);
        RoleGraph graph = resolver.graphFor(id);

        return graph.userNames().stream()
            .map(name -> {
                RawUser user = graph.user(name).orElseThrow();
                ResolvedPrincipal resolved = resolver.resolve(id, PrincipalRef.user(name));
                return new UserSummary(
                    user.name(),
                    user.authType(),
                    user.hostIp(),
                    resolved.roles().size(),
                    grantsOf(graph, PrincipalRef.user(name)).size());
            })
            .toList();
    }

    public UserDetail getUserDetail(String clusterId, String snapshotId, String userName) {
        String id = select(clusterId, snapshotId);
        RoleGraph graph = resolver.graphFor(id);
        RawUser user = requireUser(graph, userName);
        ResolvedPrincipal resolved = resolver.resolve(id, PrincipalRef.user(userName));

        return new UserDetail(
            user.name(),
            user.authType(),
            user.defaultRolesAll(),
            user.hostIp(),
            user.defaultRoles(),
            resolved.roles(),
            resolved.privileges(),
            graph.settingsProfiles(userName));
    }

    public List<RiskFinding> getUserRisks(String clusterId, String snapshotId, String userName) {
        return riskAnalyzer.userRisks(select(clusterId, snapshotId), userName);
    }

    // ==================== Roles ====================

    public List<RoleSummary> listRoles(String clusterId, String snapshotId) {
        RoleGraph graph = resolver.graphFor(select(clusterId, snapshotId));

        return graph.roleNames().stream()
            .map(name -> new RoleSummary(
                name,
                graph.members(name).size(),
                grantsOf(graph, PrincipalRef.role(name)).size()))
            .toList();
    }

    public RoleDetail getRoleDetail(String clusterId, String snapshotId, String roleName) {
        String id = select(clusterId, snapshotId);
        RoleGraph graph = resolver.graphFor(id);
        PrincipalRef role = PrincipalRef.role(roleName);
        if (!graph.contains(role)) {
            throw new ExplorerException(ExplorerError.notFound("role", roleName));
        }

        return new RoleDetail(
            roleName,
            graph.members(roleName).stream().map(RoleMember::from).toList(),
            resolver.resolve(id, role).roles().stream().map(InheritedRole::from).toList(),
            grantsOf(graph, role).stream().map(GrantDto::from).toList());
    }

    public List<EffectivePrivilege> getRoleEffectivePrivileges(String clusterId, String snapshotId, String roleName) {
        return resolver.resolve(select(clusterId, snapshotId), PrincipalRef.role(roleName)).privileges();
    }

    // ==================== Risks ====================

    public RiskSummary getRiskSummary(String clusterId, String snapshotId) {
        return riskAnalyzer.summary(select(clusterId, snapshotId));
    }

    // ==================== Objects ====================

    /**
     * Every user and role with a privilege on a database or table.
     *
     * @param table null or "*" for the database as a whole
     * @param scope "exact" (default) or "covering"
     */
    public ObjectAccessResponse getObjectAccess(String clusterId, String snapshotId,
                                                String database, String table, String scope) {
        if (database == null || database.isBlank()) {
            throw new ExplorerException(ExplorerError.validation("database", "database is required"));
        }
        ObjectScope.Mode mode;
        try {
            mode = ObjectScope.Mode.parse(scope);
        } catch (IllegalArgumentException e) {
            throw new ExplorerException(ExplorerError.validation("scope", "scope must be 'exact' or 'covering'"));
        }
        ObjectScope object = new ObjectScope(database, table, mode);
        String id = select(clusterId, snapshotId);

        return new ObjectAccessResponse(object.database(), object.table(), mode, resolver.objectAccess(id, object));
    }

    // ==================== Diff ====================

    /**
     * Compare two completed snapshots of the same cluster.
     *
     * @throws ExplorerException InvalidDiffPair for a snapshot compared with itself or with
     *         another cluster's snapshot, NotFound for unknown ids, SnapshotNotReady for
     *         snapshots that are not completed
     */
    public SnapshotDiff diffSnapshots(String fromSnapshotId, String toSnapshotId) {
        if (fromSnapshotId == null || fromSnapshotId.isBlank()) {
            throw new ExplorerException(ExplorerError.validation("from", "from is required"));
        }
        if (toSnapshotId == null || toSnapshotId.isBlank()) {
            throw new ExplorerException(ExplorerError.validation("to", "to is required"));
        }
        if (fromSnapshotId.equals(toSnapshotId)) {
            LOG.warnf("Rejected diff of snapshot %s against itself", fromSnapshotId);
            throw new ExplorerException(ExplorerError.invalidDiffPair(
                fromSnapshotId, toSnapshotId, "a snapshot cannot be compared with itself"));
        }

        Snapshot from = snapshotService.getSnapshot(fromSnapshotId);
        Snapshot to = snapshotService.getSnapshot(toSnapshotId);
        if (!from.clusterId.equals(to.clusterId)) {
            LOG.warnf("Rejected diff across clusters %s and %s", from.clusterId, to.clusterId);
            throw new ExplorerException(ExplorerError.invalidDiffPair(
                fromSnapshotId, toSnapshotId, "snapshots belong to different clusters"));
        }
        requireCompleted(from);
        requireCompleted(to);

        return cache.get(DIFFS, new DiffKey(fromSnapshotId, toSnapshotId), () -> diffEngine.diff(
            fromSnapshotId, snapshotService.getRawEntities(fromSnapshotId),
            toSnapshotId, snapshotService.getRawEntities(toSnapshotId)));
    }

    // ==================== Helpers ====================

    private String select(String clusterId, String snapshotId) {
        return snapshotService.select(clusterId, snapshotId).id;
    }

    private static void requireCompleted(Snapshot snapshot) {
        if (!snapshot.isCompleted()) {
            throw new ExplorerException(ExplorerError.snapshotNotReady(snapshot.id, snapshot.status.name()));
        }
    }

    private static RawUser requireUser(RoleGraph graph, String userName) {
        return graph.user(userName)
            .orElseThrow(() -> new ExplorerException(ExplorerError.notFound("user", userName)));
    }

    private static List<RawGrant> grantsOf(RoleGraph graph, PrincipalRef principal) {
        return graph.directGrants(principal).stream()
            .filter(grant -> !grant.partialRevoke())
            .toList();
    }

    record DiffKey(String fromSnapshotId, String toSnapshotId) {}
}
