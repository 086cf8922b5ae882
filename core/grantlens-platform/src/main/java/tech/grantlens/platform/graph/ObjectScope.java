package tech.grantlens.platform.graph;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;

/**
 * A database object being looked up in an object-access query.
 *
 * @param database the database (required)
 * @param table a table of the database, or null for the database as a whole
 * @param mode how privileges are matched against the object
 */
public record ObjectScope(String database, String table, Mode mode) {

    public enum Mode {
        /**
         * Only privileges granted on the object itself: same database and, when a table
         * is requested, same table.
         */
        EXACT,
        /**
         * Also privileges whose scope contains the object: global grants and
         * database-wide grants.
         */
        COVERING;

        public static Mode parse(String value) {
            if (value == null || value.isBlank()) {
                return EXACT;
            }
            return Mode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public ObjectScope {
        Objects.requireNonNull(database, "database must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        table = table == null || table.isBlank() || "*".equals(table) ? null : table;
    }

    public boolean matches(EffectivePrivilege privilege) {
        if (privilege.database() == null) {
            return mode == Mode.COVERING;
        }
        if (!privilege.database().equals(database)) {
            return false;
        }
        if (table == null) {
            return true;
        }
        if (privilege.table() == null) {
            return mode == Mode.COVERING;
        }
        return privilege.table().equals(table);
    }
}
