package tech.grantlens.platform.snapshot;

import java.util.List;

/**
 * Everything a collector captured for one snapshot, in collection order.
 */
public record RawEntities(
    List<RawUser> users,
    List<RawRole> roles,
    List<RawRoleGrant> roleGrants,
    List<RawGrant> grants,
    List<RawSettingsProfile> settingsProfiles
) {

    public RawEntities {
        users = users == null ? List.of() : List.copyOf(users);
        roles = roles == null ? List.of() : List.copyOf(roles);
        roleGrants = roleGrants == null ? List.of() : List.copyOf(roleGrants);
        grants = grants == null ? List.of() : List.copyOf(grants);
        settingsProfiles = settingsProfiles == null ? List.of() : List.copyOf(settingsProfiles);
    }

    public static RawEntities empty() {
        return new RawEntities(List.of(), List.of(), List.of(), List.of(), List.of());
    }
}
