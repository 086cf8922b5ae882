package tech.grantlens.platform.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One role in a principal's transitive role closure.
 *
 * @param roleName the role
 * @param isDirect granted straight to the principal
 * @param isDefault activated at login (users only)
 * @param path role names from the principal to this role, inclusive; the principal itself is not part of it
 */
public record RoleClosureEntry(
    String roleName,
    @JsonProperty("is_direct") boolean isDirect,
    @JsonProperty("is_default") boolean isDefault,
    List<String> path
) {

    public RoleClosureEntry {
        path = List.copyOf(path);
    }
}
