package tech.grantlens.platform.graph;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Where an effective privilege comes from.
 */
public enum PrivilegeSource {
    /** Granted straight to the principal. */
    DIRECT,
    /** Granted to a role in the principal's closure. */
    ROLE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
