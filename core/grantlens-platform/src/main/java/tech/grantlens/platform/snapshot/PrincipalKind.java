package tech.grantlens.platform.snapshot;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of a principal: a login user or a role.
 * Serialized in lower case ("user", "role") as the explorer UI expects.
 */
public enum PrincipalKind {
    USER,
    ROLE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PrincipalKind fromWireName(String value) {
        return PrincipalKind.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
