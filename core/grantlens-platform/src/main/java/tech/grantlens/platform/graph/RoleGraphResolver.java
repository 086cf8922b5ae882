package tech.grantlens.platform.graph;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.grantlens.platform.cache.ResolutionCache;
import tech.grantlens.platform.common.errors.ExplorerError;
import tech.grantlens.platform.common.errors.ExplorerException;
import tech.grantlens.platform.snapshot.PrincipalRef;
import tech.grantlens.platform.snapshot.SnapshotService;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Resolves role closures and effective privileges for principals of completed snapshots.
 *
 * Graphs are memoized per snapshot id and resolutions per (snapshot id, principal).
 * Only completed snapshots ever reach the cache, since raw entities of any other
 * snapshot are refused by {@link SnapshotService#getRawEntities(String)}.
 */
@ApplicationScoped
public class RoleGraphResolver {

    private static final Logger LOG = Logger.getLogger(RoleGraphResolver.class);

    static final String RESOLUTIONS = "resolutions";

    @Inject
    SnapshotService snapshotService;

    @Inject
    ResolutionCache cache;

    public RoleGraphResolver() {
    }

    public RoleGraphResolver(SnapshotService snapshotService, ResolutionCache cache) {
        this.snapshotService = snapshotService;
        this.cache = cache;
    }

    /**
     * The role graph of a completed snapshot.
     */
    public RoleGraph graphFor(String snapshotId) {
        return cache.get(ResolutionCache.GRAPHS, snapshotId, () -> {
            LOG.debugf("Building role graph for snapshot %s", snapshotId);
            return RoleGraph.build(snapshotId, snapshotService.getRawEntities(snapshotId));
        });
    }

    /**
     * Resolve a user or role.
     *
     * @throws ExplorerException NotFound if the principal is not part of the snapshot
     */
    public ResolvedPrincipal resolve(String snapshotId, PrincipalRef principal) {
        RoleGraph graph = graphFor(snapshotId);
        if (!graph.contains(principal)) {
            throw new ExplorerException(ExplorerError.notFound(principal.kind().wireName(), principal.name()));
        }
        return cache.get(RESOLUTIONS, new ResolutionKey(snapshotId, principal), () -> graph.resolve(principal));
    }

    /**
     * Every user and role holding at least one effective privilege on the object.
     * Users are listed before roles, each group in capture order.
     */
    public List<ObjectAccessEntry> objectAccess(String snapshotId, ObjectScope scope) {
        RoleGraph graph = graphFor(snapshotId);
        List<ObjectAccessEntry> entries = new ArrayList<>();
        for (String user : graph.userNames()) {
            accessEntry(snapshotId, PrincipalRef.user(user), scope).ifPresent(entries::add);
        }
        for (String role : graph.roleNames()) {
            accessEntry(snapshotId, PrincipalRef.role(role), scope).ifPresent(entries::add);
        }
        return entries;
    }

    private Optional<ObjectAccessEntry> accessEntry(String snapshotId, PrincipalRef principal,
                                                    ObjectScope scope) {
        TreeSet<String> accessTypes = new TreeSet<>();
        TreeSet<String> sources = new TreeSet<>();
        for (EffectivePrivilege privilege : resolve(snapshotId, principal).privileges()) {
            if (scope.matches(privilege)) {
                accessTypes.add(privilege.accessType());
                sources.add(privilege.sourceName());
            }
        }
        if (accessTypes.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ObjectAccessEntry(principal.name(), principal.kind(),
            List.copyOf(accessTypes), String.join(", ", sources)));
    }

    record ResolutionKey(String snapshotId, PrincipalRef principal) {}
}
