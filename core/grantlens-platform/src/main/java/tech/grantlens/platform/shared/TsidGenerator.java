package tech.grantlens.platform.shared;

import com.github.f4b6a3.tsid.TsidCreator;

import java.util.Objects;

/**
 * Centralized TSID generation for snapshot ids.
 * TSIDs are time-sortable, so lexical order of ids within a type follows creation order.
 *
 * Format: "{prefix}_{tsid}" (e.g., "snp_0HZXEQ5Y8JY5Z")
 */
public class TsidGenerator {

    /**
     * Separator between prefix and TSID.
     */
    public static final String SEPARATOR = "_";

    /**
     * Generate a new typed ID for the given entity type.
     *
     * @param type the entity type
     * @return the typed ID (e.g., "snp_0HZXEQ5Y8JY5Z")
     */
    public static String generate(EntityType type) {
        Objects.requireNonNull(type, "EntityType must not be null");
        return type.prefix() + SEPARATOR + TsidCreator.getTsid().toString();
    }

    /**
     * Check whether an id carries the prefix of the given entity type.
     *
     * @param typedId the typed ID (e.g., "snp_0HZXEQ5Y8JY5Z")
     * @param type the expected entity type
     * @return true if the id has the expected prefix followed by a non-empty TSID
     */
    public static boolean hasType(String typedId, EntityType type) {
        if (typedId == null || typedId.isBlank()) {
            return false;
        }
        int separatorIndex = typedId.indexOf(SEPARATOR);
        if (separatorIndex == -1 || separatorIndex == typedId.length() - 1) {
            return false;
        }
        return typedId.substring(0, separatorIndex).equals(type.prefix());
    }

    private TsidGenerator() {
        // Utility class
    }
}
