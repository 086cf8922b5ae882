package tech.grantlens.platform.shared;

/**
 * Entity types that receive generated ids, with their 3-character prefixes.
 *
 * IDs are stored WITH the prefix:
 * - Format: "{prefix}_{tsid}" (e.g., "snp_0HZXEQ5Y8JY5Z")
 * - Total length: 17 characters (3-char prefix + underscore + 13-char TSID)
 *
 * Cluster ids are assigned by the cluster registry, not here.
 */
public enum EntityType {

    SNAPSHOT("snp");

    private final String prefix;

    EntityType(String prefix) {
        this.prefix = prefix;
    }

    public String prefix() {
        return prefix;
    }
}
