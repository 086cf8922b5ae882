package tech.grantlens.platform.diff;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import tech.grantlens.platform.snapshot.PrincipalRef;
import tech.grantlens.platform.snapshot.RawEntities;
import tech.grantlens.platform.snapshot.RawGrant;
import tech.grantlens.platform.snapshot.RawRole;
import tech.grantlens.platform.snapshot.RawRoleGrant;
import tech.grantlens.platform.snapshot.RawUser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Compares the raw entities of two snapshots category by category.
 *
 * <p>Each category has a natural key. Entities whose key only occurs in the newer snapshot
 * are added, those only in the older one removed, and those in both with unequal records
 * modified. The comparison works on raw entities; nothing is resolved.
 *
 * <p>Swapping the arguments swaps added and removed.
 */
@ApplicationScoped
public class SnapshotDiffEngine {

    private static final Logger LOG = Logger.getLogger(SnapshotDiffEngine.class);

    public SnapshotDiff diff(String fromSnapshotId, RawEntities from, String toSnapshotId, RawEntities to) {
        SnapshotDiff diff = new SnapshotDiff(
            fromSnapshotId,
            toSnapshotId,
            diffByKey("users", from.users(), to.users(), RawUser::name),
            diffByKey("roles", from.roles(), to.roles(), RawRole::name),
            diffByKey("role_grants", from.roleGrants(), to.roleGrants(), RoleGrantKey::of),
            diffByKey("grants", from.grants(), to.grants(), GrantKey::of));

        LOG.debugf("Diff %s -> %s: users +%d/-%d/~%d, roles +%d/-%d, role grants +%d/-%d/~%d, grants +%d/-%d/~%d",
            fromSnapshotId, toSnapshotId,
            diff.users().addedCount(), diff.users().removedCount(), diff.users().modifiedCount(),
            diff.roles().addedCount(), diff.roles().removedCount(),
            diff.roleGrants().addedCount(), diff.roleGrants().removedCount(), diff.roleGrants().modifiedCount(),
            diff.grants().addedCount(), diff.grants().removedCount(), diff.grants().modifiedCount());
        return diff;
    }

    static <T, K> DiffSection<T> diffByKey(String category, List<T> from, List<T> to, Function<T, K> keyOf) {
        Map<K, T> fromByKey = index(category, from, keyOf);
        Map<K, T> toByKey = index(category, to, keyOf);

        List<T> added = new ArrayList<>();
        List<T> removed = new ArrayList<>();
        List<ModifiedEntry<T>> modified = new ArrayList<>();

        for (Map.Entry<K, T> entry : fromByKey.entrySet()) {
            T newer = toByKey.get(entry.getKey());
            if (newer == null) {
                removed.add(entry.getValue());
            } else if (!Objects.equals(entry.getValue(), newer)) {
                modified.add(new ModifiedEntry<>(entry.getValue(), newer));
            }
        }
        for (Map.Entry<K, T> entry : toByKey.entrySet()) {
            if (!fromByKey.containsKey(entry.getKey())) {
                added.add(entry.getValue());
            }
        }
        return new DiffSection<>(added, removed, modified);
    }

    private static <T, K> Map<K, T> index(String category, List<T> entities, Function<T, K> keyOf) {
        Map<K, T> byKey = new LinkedHashMap<>();
        for (T entity : entities) {
            K key = keyOf.apply(entity);
            if (byKey.putIfAbsent(key, entity) != null) {
                LOG.debugf("Duplicate %s key %s ignored", category, key);
            }
        }
        return byKey;
    }

    record RoleGrantKey(PrincipalRef grantee, String roleName) {
        static RoleGrantKey of(RawRoleGrant grant) {
            return new RoleGrantKey(grant.grantee(), grant.roleName());
        }
    }

    record GrantKey(PrincipalRef grantee, String accessType, String database, String table, String column) {
        static GrantKey of(RawGrant grant) {
            return new GrantKey(grant.grantee(), grant.accessType(), grant.database(), grant.table(), grant.column());
        }
    }
}
