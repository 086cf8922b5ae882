package tech.grantlens.platform.risk;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of risk the analyzer reports. Serialized in lower case ("orphan_role").
 */
public enum RiskType {

    /** A role nobody is granted. */
    ORPHAN_ROLE,

    /** An administrative privilege that reaches a user through two or more role hops. */
    INHERITED_ADMIN_PRIVILEGE,

    /** A privilege on a database or table that the holder may grant onwards. */
    GRANT_OPTION_DELEGATION,

    /** A user that may connect from any address. */
    UNRESTRICTED_HOST;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
