package tech.grantlens.platform.graph;

/**
 * A defect in a snapshot's raw entities that the resolver tolerated.
 *
 * Anomalies never fail a query: the offending edge is skipped (dangling references,
 * duplicates) or bounded by the visited set (cycles).
 *
 * @param kind what is wrong
 * @param subject the principal or edge the anomaly was found on, e.g. "user:alice"
 * @param detail human-readable description
 */
public record GraphAnomaly(Kind kind, String subject, String detail) {

    public enum Kind {
        /** A role grant whose grantee is not a known user or role. */
        DANGLING_GRANTEE,
        /** A role grant naming a role that does not exist. */
        DANGLING_ROLE,
        /** A privilege grant whose grantee is not a known user or role. */
        DANGLING_PRIVILEGE_GRANTEE,
        /** Role-to-role grants that form a cycle. */
        ROLE_CYCLE,
        /** The same user or role name captured twice; the first one is used. */
        DUPLICATE_PRINCIPAL
    }
}
