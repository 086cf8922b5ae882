package tech.grantlens.platform.diff;

import com.fasterxml.jackson.annotation.JsonIgnore;
import tech.grantlens.platform.snapshot.RawGrant;
import tech.grantlens.platform.snapshot.RawRole;
import tech.grantlens.platform.snapshot.RawRoleGrant;
import tech.grantlens.platform.snapshot.RawUser;

/**
 * Structural differences between two snapshots' raw entities.
 */
public record SnapshotDiff(
    String fromSnapshotId,
    String toSnapshotId,
    DiffSection<RawUser> users,
    DiffSection<RawRole> roles,
    DiffSection<RawRoleGrant> roleGrants,
    DiffSection<RawGrant> grants
) {

    @JsonIgnore
    public boolean isEmpty() {
        return users.isEmpty() && roles.isEmpty() && roleGrants.isEmpty() && grants.isEmpty();
    }
}
