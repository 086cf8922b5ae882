package tech.grantlens.platform.risk;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resolved risk settings: which access types count as administrative, which host entries
 * mean "anywhere", and the severity of each rule.
 */
public final class RiskPolicy {

    private final Set<String> adminAccessTypes;
    private final Set<String> anyHostPatterns;
    private final Map<RiskType, RiskLevel> severities;

    public RiskPolicy(Collection<String> adminAccessTypes, Collection<String> anyHostPatterns,
                      Map<RiskType, RiskLevel> severities) {
        this.adminAccessTypes = adminAccessTypes.stream()
            .map(String::trim)
            .filter(type -> !type.isEmpty())
            .map(type -> type.toUpperCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
        this.anyHostPatterns = anyHostPatterns.stream()
            .map(String::trim)
            .filter(pattern -> !pattern.isEmpty())
            .collect(Collectors.toUnmodifiableSet());
        this.severities = new EnumMap<>(RiskType.class);
        this.severities.put(RiskType.ORPHAN_ROLE, RiskLevel.MEDIUM);
        this.severities.put(RiskType.INHERITED_ADMIN_PRIVILEGE, RiskLevel.HIGH);
        this.severities.put(RiskType.GRANT_OPTION_DELEGATION, RiskLevel.MEDIUM);
        this.severities.put(RiskType.UNRESTRICTED_HOST, RiskLevel.LOW);
        this.severities.putAll(severities);
    }

    public static RiskPolicy defaults() {
        return new RiskPolicy(
            List.of("GRANT", "CREATE USER", "ALTER USER", "DROP USER", "CREATE ROLE", "DROP ROLE",
                "ROLE ADMIN", "SYSTEM", "ACCESS MANAGEMENT", "ALL"),
            List.of("::/0", "0.0.0.0/0"),
            Map.of());
    }

    public static RiskPolicy from(RiskConfig config) {
        RiskConfig.Severity severity = config.severity();
        return new RiskPolicy(config.adminAccessTypes(), config.anyHostPatterns(), Map.of(
            RiskType.ORPHAN_ROLE, severity.orphanRole(),
            RiskType.INHERITED_ADMIN_PRIVILEGE, severity.inheritedAdminPrivilege(),
            RiskType.GRANT_OPTION_DELEGATION, severity.grantOptionDelegation(),
            RiskType.UNRESTRICTED_HOST, severity.unrestrictedHost()));
    }

    public boolean isAdministrative(String accessType) {
        return accessType != null && adminAccessTypes.contains(accessType.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * A host list is unrestricted when it is empty or every entry is an "any address" pattern.
     */
    public boolean isUnrestricted(List<String> hostIp) {
        return hostIp.isEmpty() || anyHostPatterns.containsAll(hostIp);
    }

    public RiskLevel levelOf(RiskType type) {
        return severities.get(type);
    }
}
