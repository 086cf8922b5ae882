package tech.grantlens.platform.graph;

import org.jboss.logging.Logger;
import tech.grantlens.platform.snapshot.PrincipalKind;
import tech.grantlens.platform.snapshot.PrincipalRef;
import tech.grantlens.platform.snapshot.RawEntities;
import tech.grantlens.platform.snapshot.RawGrant;
import tech.grantlens.platform.snapshot.RawRole;
import tech.grantlens.platform.snapshot.RawRoleGrant;
import tech.grantlens.platform.snapshot.RawSettingsProfile;
import tech.grantlens.platform.snapshot.RawUser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable inheritance graph of one snapshot.
 *
 * <p>Users and roles are interned into two index pools; role grants and privilege grants
 * are adjacency lists of indices kept in declaration order. Traversal is breadth-first
 * with a visited set over role indices, so resolution terminates and stays linear in the
 * graph size even when the captured role grants contain cycles.
 *
 * <p>References to unknown principals are skipped at build time and recorded as
 * {@link GraphAnomaly anomalies}, as are role cycles and duplicate names.
 *
 * <p>Instances are safe to share between threads.
 */
public final class RoleGraph {

    private static final Logger LOG = Logger.getLogger(RoleGraph.class);

    private final String snapshotId;

    private final List<RawUser> users = new ArrayList<>();
    private final List<String> roles = new ArrayList<>();
    private final Map<String, Integer> userIndex = new HashMap<>();
    private final Map<String, Integer> roleIndex = new HashMap<>();

    // principal index -> granted roles, in grant order
    private final List<List<RoleEdge>> userRoleEdges = new ArrayList<>();
    private final List<List<RoleEdge>> roleRoleEdges = new ArrayList<>();

    // principal index -> privilege grants (revokes included), in grant order
    private final List<List<RawGrant>> userGrants = new ArrayList<>();
    private final List<List<RawGrant>> roleGrants = new ArrayList<>();

    // role index -> distinct members, in grant order
    private final List<Set<PrincipalRef>> roleMembers = new ArrayList<>();

    private final List<RawSettingsProfile> settingsProfiles = new ArrayList<>();

    private final List<GraphAnomaly> anomalies = new ArrayList<>();

    private RoleGraph(String snapshotId) {
        this.snapshotId = snapshotId;
    }

    /**
     * Build the graph for a snapshot's raw entities.
     *
     * @param snapshotId used for logging only
     * @param raw the captured entities
     */
    public static RoleGraph build(String snapshotId, RawEntities raw) {
        RoleGraph graph = new RoleGraph(snapshotId);
        graph.internPrincipals(raw);
        graph.linkRoleGrants(raw.roleGrants());
        graph.linkPrivilegeGrants(raw.grants());
        graph.detectCycles();
        graph.settingsProfiles.addAll(raw.settingsProfiles());

        if (!graph.anomalies.isEmpty()) {
            LOG.warnf("Snapshot %s has %d malformed graph entries; affected edges are skipped",
                snapshotId, graph.anomalies.size());
            for (GraphAnomaly anomaly : graph.anomalies) {
                LOG.debugf("Snapshot %s: %s %s", snapshotId, anomaly.kind(), anomaly.detail());
            }
        }
        LOG.debugf("Built role graph for snapshot %s: %d users, %d roles",
            snapshotId, graph.users.size(), graph.roles.size());
        return graph;
    }

    // ==================== Construction ====================

    private void internPrincipals(RawEntities raw) {
        for (RawUser user : raw.users()) {
            if (userIndex.containsKey(user.name())) {
                anomalies.add(new GraphAnomaly(GraphAnomaly.Kind.DUPLICATE_PRINCIPAL,
                    PrincipalRef.user(user.name()).toString(), "User '" + user.name() + "' captured twice"));
                continue;
            }
            userIndex.put(user.name(), users.size());
            users.add(user);
            userRoleEdges.add(new ArrayList<>());
            userGrants.add(new ArrayList<>());
        }
        for (RawRole role : raw.roles()) {
            if (roleIndex.containsKey(role.name())) {
                anomalies.add(new GraphAnomaly(GraphAnomaly.Kind.DUPLICATE_PRINCIPAL,
                    PrincipalRef.role(role.name()).toString(), "Role '" + role.name() + "' captured twice"));
                continue;
            }
            roleIndex.put(role.name(), roles.size());
            roles.add(role.name());
            roleRoleEdges.add(new ArrayList<>());
            roleGrants.add(new ArrayList<>());
            roleMembers.add(new LinkedHashSet<>());
        }
    }

    private void linkRoleGrants(List<RawRoleGrant> grants) {
        for (RawRoleGrant grant : grants) {
            Integer target = roleIndex.get(grant.roleName());
            if (target == null) {
                anomalies.add(new GraphAnomaly(GraphAnomaly.Kind.DANGLING_ROLE, grant.grantee().toString(),
                    grant.grantee() + " is granted unknown role '" + grant.roleName() + "'"));
                continue;
            }
            List<List<RoleEdge>> edges = grant.grantee().isUser() ? userRoleEdges : roleRoleEdges;
            Integer source = indexOf(grant.grantee());
            if (source == null) {
                anomalies.add(new GraphAnomaly(GraphAnomaly.Kind.DANGLING_GRANTEE, grant.grantee().toString(),
                    "Role '" + grant.roleName() + "' is granted to unknown " + grant.grantee()));
                continue;
            }
            edges.get(source).add(new RoleEdge(target, grant.isDefault()));
            roleMembers.get(target).add(grant.grantee());
        }
    }

    private void linkPrivilegeGrants(List<RawGrant> grants) {
        for (RawGrant grant : grants) {
            Integer holder = indexOf(grant.grantee());
            if (holder == null) {
                anomalies.add(new GraphAnomaly(GraphAnomaly.Kind.DANGLING_PRIVILEGE_GRANTEE,
                    grant.grantee().toString(),
                    grant.accessType() + " is granted to unknown " + grant.grantee()));
                continue;
            }
            (grant.grantee().isUser() ? userGrants : roleGrants).get(holder).add(grant);
        }
    }

    /**
     * Iterative three-colour DFS over role-to-role edges; every back edge closes a cycle.
     */
    private void detectCycles() {
        int[] colour = new int[roles.size()];
        for (int start = 0; start < roles.size(); start++) {
            if (colour[start] != 0) {
                continue;
            }
            ArrayDeque<int[]> stack = new ArrayDeque<>();
            stack.push(new int[] {start, 0});
            colour[start] = 1;
            while (!stack.isEmpty()) {
                int[] frame = stack.peek();
                List<RoleEdge> edges = roleRoleEdges.get(frame[0]);
                if (frame[1] >= edges.size()) {
                    colour[frame[0]] = 2;
                    stack.pop();
                    continue;
                }
                int next = edges.get(frame[1]++).role();
                if (colour[next] == 0) {
                    colour[next] = 1;
                    stack.push(new int[] {next, 0});
                } else if (colour[next] == 1) {
                    String from = roles.get(frame[0]);
                    anomalies.add(new GraphAnomaly(GraphAnomaly.Kind.ROLE_CYCLE, PrincipalRef.role(from).toString(),
                        "Grant of role '" + roles.get(next) + "' to role '" + from + "' closes a cycle"));
                }
            }
        }
    }

    // ==================== Lookups ====================

    public String snapshotId() {
        return snapshotId;
    }

    public List<String> userNames() {
        return users.stream().map(RawUser::name).toList();
    }

    public List<String> roleNames() {
        return Collections.unmodifiableList(roles);
    }

    public Optional<RawUser> user(String name) {
        Integer index = userIndex.get(name);
        return index == null ? Optional.empty() : Optional.of(users.get(index));
    }

    public boolean contains(PrincipalRef principal) {
        return indexOf(principal) != null;
    }

    /**
     * Privilege grants held by the principal itself, revokes included.
     */
    public List<RawGrant> directGrants(PrincipalRef principal) {
        Integer index = indexOf(principal);
        if (index == null) {
            return List.of();
        }
        return Collections.unmodifiableList((principal.isUser() ? userGrants : roleGrants).get(index));
    }

    /**
     * Users and roles that are granted the role, in grant order.
     */
    public List<PrincipalRef> members(String roleName) {
        Integer index = roleIndex.get(roleName);
        return index == null ? List.of() : List.copyOf(roleMembers.get(index));
    }

    /**
     * Settings profiles assigned to the user, in capture order.
     */
    public List<RawSettingsProfile> settingsProfiles(String userName) {
        return settingsProfiles.stream()
            .filter(profile -> profile.appliesTo(userName))
            .toList();
    }

    public List<GraphAnomaly> anomalies() {
        return Collections.unmodifiableList(anomalies);
    }

    // ==================== Resolution ====================

    /**
     * Compute the role closure and effective privileges of a principal.
     *
     * @throws IllegalArgumentException if the principal is not part of this snapshot
     */
    public ResolvedPrincipal resolve(PrincipalRef principal) {
        Integer start = indexOf(principal);
        if (start == null) {
            throw new IllegalArgumentException("Unknown principal " + principal + " in snapshot " + snapshotId);
        }
        RawUser user = principal.isUser() ? users.get(start) : null;

        boolean[] visited = new boolean[roles.size()];
        if (!principal.isUser()) {
            // A role is never part of its own closure.
            visited[start] = true;
        }

        List<RoleClosureEntry> closure = new ArrayList<>();
        List<Integer> closureIndex = new ArrayList<>();
        ArrayDeque<Integer> frontier = new ArrayDeque<>();

        List<RoleEdge> directEdges = principal.isUser() ? userRoleEdges.get(start) : roleRoleEdges.get(start);
        for (RoleEdge edge : directEdges) {
            if (visited[edge.role()]) {
                continue;
            }
            visited[edge.role()] = true;
            String roleName = roles.get(edge.role());
            boolean isDefault = user != null
                && (user.defaultRolesAll() || user.defaultRoles().contains(roleName) || edge.isDefault());
            frontier.add(closure.size());
            closure.add(new RoleClosureEntry(roleName, true, isDefault, List.of(roleName)));
            closureIndex.add(edge.role());
        }

        while (!frontier.isEmpty()) {
            int position = frontier.poll();
            RoleClosureEntry parent = closure.get(position);
            for (RoleEdge edge : roleRoleEdges.get(closureIndex.get(position))) {
                if (visited[edge.role()]) {
                    continue;
                }
                visited[edge.role()] = true;
                String roleName = roles.get(edge.role());
                // Default status only propagates one level below a directly granted role.
                boolean isDefault = user != null && parent.isDirect() && user.defaultRoles().contains(roleName);
                List<String> path = new ArrayList<>(parent.path());
                path.add(roleName);
                frontier.add(closure.size());
                closure.add(new RoleClosureEntry(roleName, false, isDefault, path));
                closureIndex.add(edge.role());
            }
        }

        Map<EffectivePrivilege.Key, EffectivePrivilege> privileges = new LinkedHashMap<>();
        collect(privileges, directGrants(principal), PrivilegeSource.DIRECT, principal.name(), List.of());
        for (int i = 0; i < closure.size(); i++) {
            RoleClosureEntry entry = closure.get(i);
            collect(privileges, roleGrants.get(closureIndex.get(i)), PrivilegeSource.ROLE,
                entry.roleName(), entry.path());
        }

        return new ResolvedPrincipal(principal, closure, new ArrayList<>(privileges.values()));
    }

    /**
     * Add one holder's grants, minus what that holder's own partial revokes take away.
     */
    private static void collect(Map<EffectivePrivilege.Key, EffectivePrivilege> into, List<RawGrant> grants,
                                PrivilegeSource source, String sourceName, List<String> path) {
        List<RawGrant> revokes = grants.stream().filter(RawGrant::partialRevoke).toList();
        for (RawGrant grant : grants) {
            if (grant.partialRevoke() || isRevoked(grant, revokes)) {
                continue;
            }
            EffectivePrivilege privilege = new EffectivePrivilege(grant.accessType(), grant.database(),
                grant.table(), grant.column(), grant.grantOption(), source, sourceName, path);
            EffectivePrivilege existing = into.putIfAbsent(privilege.key(), privilege);
            if (existing != null && privilege.grantOption() && !existing.grantOption()) {
                into.put(privilege.key(), existing.withGrantOption());
            }
        }
    }

    static boolean isRevoked(RawGrant grant, List<RawGrant> revokes) {
        for (RawGrant revoke : revokes) {
            if (!revoke.accessType().equals(grant.accessType())) {
                continue;
            }
            if (revoke.database() != null && !revoke.database().equals(grant.database())) {
                continue;
            }
            if (revoke.table() != null && !revoke.table().equals(grant.table())) {
                continue;
            }
            if (revoke.column() != null && !revoke.column().equals(grant.column())) {
                continue;
            }
            return true;
        }
        return false;
    }

    private Integer indexOf(PrincipalRef principal) {
        return principal.kind() == PrincipalKind.USER
            ? userIndex.get(principal.name())
            : roleIndex.get(principal.name());
    }

    private record RoleEdge(int role, boolean isDefault) {}
}
