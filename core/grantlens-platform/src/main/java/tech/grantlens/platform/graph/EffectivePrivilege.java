package tech.grantlens.platform.graph;

import java.util.List;

/**
 * A privilege a principal holds, with provenance.
 *
 * @param accessType e.g. "SELECT", "SYSTEM"
 * @param database null for global scope
 * @param table null for every table of the database
 * @param column null for every column of the table
 * @param grantOption whether the holder may re-grant the privilege
 * @param source direct or via a role
 * @param sourceName the principal itself for direct privileges, otherwise the granting role
 * @param path role chain from the principal to the granting role; empty for direct privileges
 */
public record EffectivePrivilege(
    String accessType,
    String database,
    String table,
    String column,
    boolean grantOption,
    PrivilegeSource source,
    String sourceName,
    List<String> path
) {

    public EffectivePrivilege {
        path = List.copyOf(path);
    }

    /**
     * Privileges are duplicates only when this key is equal; no subsumption is applied.
     */
    Key key() {
        return new Key(accessType, database, table, column, source, sourceName);
    }

    EffectivePrivilege withGrantOption() {
        return new EffectivePrivilege(accessType, database, table, column, true, source, sourceName, path);
    }

    record Key(String accessType, String database, String table, String column,
               PrivilegeSource source, String sourceName) {}
}
