package tech.grantlens.platform.snapshot;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * A user as captured by the collector.
 *
 * @param name unique user name within the snapshot
 * @param authType authentication method (e.g. "sha256_password"), may be null
 * @param hostIp allowed source addresses; empty means no restriction
 * @param defaultRolesAll whether every granted role is activated at login
 * @param defaultRoles roles activated at login when {@code defaultRolesAll} is false
 */
public record RawUser(
    String name,
    String authType,
    List<String> hostIp,
    boolean defaultRolesAll,
    List<String> defaultRoles
) {

    public RawUser {
        Objects.requireNonNull(name, "name must not be null");
        hostIp = sortedDistinct(hostIp);
        defaultRoles = sortedDistinct(defaultRoles);
    }

    public static RawUser of(String name) {
        return new RawUser(name, null, List.of(), false, List.of());
    }

    /**
     * Set-valued fields are kept sorted and de-duplicated so that two captures of the
     * same user compare equal regardless of collection order.
     */
    static List<String> sortedDistinct(Collection<String> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        TreeSet<String> sorted = new TreeSet<>();
        for (String value : values) {
            if (value != null) {
                sorted.add(value);
            }
        }
        return List.copyOf(sorted);
    }
}
