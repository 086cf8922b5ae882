package tech.grantlens.platform.snapshot;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * Edge "grantee holds privilege".
 *
 * <p>{@code database == null} means global scope; {@code table == null} means every
 * table of the database; {@code column == null} means every column of the table. A grant with {@code partialRevoke} set subtracts the privilege
 * from the scope instead of adding it.
 */
public record RawGrant(
    PrincipalRef grantee,
    String accessType,
    String database,
    String table,
    String column,
    boolean grantOption,
    boolean partialRevoke
) {

    public RawGrant {
        Objects.requireNonNull(grantee, "grantee must not be null");
        Objects.requireNonNull(accessType, "accessType must not be null");
        database = blankToNull(database);
        table = database == null ? null : blankToNull(table);
        column = table == null ? null : blankToNull(column);
    }

    public static RawGrant of(PrincipalRef grantee, String accessType, String database, String table) {
        return new RawGrant(grantee, accessType, database, table, null, false, false);
    }

    @JsonIgnore
    public boolean isGlobal() {
        return database == null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
