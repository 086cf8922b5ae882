package tech.grantlens.platform.snapshot;

import java.util.List;
import java.util.Objects;

/**
 * A settings profile as captured by the collector, with its assignment.
 *
 * @param name profile name
 * @param applyToAll whether the profile applies to every user not listed in {@code applyToExcept}
 * @param applyToList users the profile is assigned to when {@code applyToAll} is false
 * @param applyToExcept users excluded from an {@code applyToAll} profile
 */
public record RawSettingsProfile(
    String name,
    boolean applyToAll,
    List<String> applyToList,
    List<String> applyToExcept
) {

    public RawSettingsProfile {
        Objects.requireNonNull(name, "name must not be null");
        applyToList = RawUser.sortedDistinct(applyToList);
        applyToExcept = RawUser.sortedDistinct(applyToExcept);
    }

    public static RawSettingsProfile forUsers(String name, String... users) {
        return new RawSettingsProfile(name, false, List.of(users), List.of());
    }

    public boolean appliesTo(String userName) {
        if (applyToAll) {
            return !applyToExcept.contains(userName);
        }
        return applyToList.contains(userName);
    }
}
