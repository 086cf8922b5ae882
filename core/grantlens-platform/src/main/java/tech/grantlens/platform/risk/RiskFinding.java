package tech.grantlens.platform.risk;

import java.util.List;

/**
 * One risk found for a user or role.
 *
 * @param level severity
 * @param type rule that produced the finding
 * @param message human-readable description
 * @param source "direct", or the role the risky privilege or setting comes from
 * @param path role chain leading to the source; empty for direct findings
 */
public record RiskFinding(RiskLevel level, RiskType type, String message, String source, List<String> path) {

    public static final String DIRECT = "direct";

    public RiskFinding {
        path = List.copyOf(path);
    }
}
