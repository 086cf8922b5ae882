package tech.grantlens.platform.risk;

import tech.grantlens.platform.graph.GraphAnomaly;

import java.util.List;

/**
 * Snapshot-wide risk overview.
 *
 * @param highCount high findings over all users
 * @param mediumCount medium findings over all users, plus orphan roles
 * @param lowCount low findings over all users
 * @param orphanRoles roles without members, sorted
 * @param usersWithRisks users with at least one finding, sorted
 * @param totalUsers users in the snapshot
 * @param totalRoles roles in the snapshot
 * @param anomalies malformed entries the graph builder skipped
 */
public record RiskSummary(
    int highCount,
    int mediumCount,
    int lowCount,
    List<String> orphanRoles,
    List<String> usersWithRisks,
    int totalUsers,
    int totalRoles,
    List<GraphAnomaly> anomalies
) {

    public RiskSummary {
        orphanRoles = List.copyOf(orphanRoles);
        usersWithRisks = List.copyOf(usersWithRisks);
        anomalies = List.copyOf(anomalies);
    }
}
