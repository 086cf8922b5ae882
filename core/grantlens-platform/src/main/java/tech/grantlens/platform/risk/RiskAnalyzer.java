package tech.grantlens.platform.risk;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.grantlens.platform.cache.ResolutionCache;
import tech.grantlens.platform.common.errors.ExplorerError;
import tech.grantlens.platform.common.errors.ExplorerException;
import tech.grantlens.platform.graph.EffectivePrivilege;
import tech.grantlens.platform.graph.PrivilegeSource;
import tech.grantlens.platform.graph.ResolvedPrincipal;
import tech.grantlens.platform.graph.RoleGraph;
import tech.grantlens.platform.graph.RoleGraphResolver;
import tech.grantlens.platform.snapshot.PrincipalRef;
import tech.grantlens.platform.snapshot.RawUser;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags risky configurations in a completed snapshot.
 *
 * <p>Rules:
 * <ul>
 *   <li>{@link RiskType#ORPHAN_ROLE}: a role granted to no user and no role</li>
 *   <li>{@link RiskType#INHERITED_ADMIN_PRIVILEGE}: an administrative privilege arriving
 *       through more than one role hop; a single hop is never flagged</li>
 *   <li>{@link RiskType#GRANT_OPTION_DELEGATION}: a re-grantable privilege on a database
 *       or table, held directly or through a role</li>
 *   <li>{@link RiskType#UNRESTRICTED_HOST}: a user without a host restriction</li>
 * </ul>
 *
 * <p>Severities and the administrative access types come from {@link RiskConfig}.
 */
@ApplicationScoped
public class RiskAnalyzer {

    private static final Logger LOG = Logger.getLogger(RiskAnalyzer.class);

    static final String SUMMARIES = "risk-summaries";

    @Inject
    RoleGraphResolver resolver;

    @Inject
    ResolutionCache cache;

    @Inject
    RiskConfig config;

    private RiskPolicy policy;

    public RiskAnalyzer() {
    }

    public RiskAnalyzer(RoleGraphResolver resolver, ResolutionCache cache, RiskPolicy policy) {
        this.resolver = resolver;
        this.cache = cache;
        this.policy = policy;
    }

    @PostConstruct
    void init() {
        policy = RiskPolicy.from(config);
    }

    /**
     * Findings for one user.
     *
     * @throws ExplorerException NotFound if the user is not part of the snapshot
     */
    public List<RiskFinding> userRisks(String snapshotId, String userName) {
        RoleGraph graph = resolver.graphFor(snapshotId);
        RawUser user = graph.user(userName)
            .orElseThrow(() -> new ExplorerException(ExplorerError.notFound("user", userName)));
        return evaluate(user, resolver.resolve(snapshotId, PrincipalRef.user(userName)));
    }

    /**
     * Snapshot-wide summary; computed once per snapshot.
     */
    public RiskSummary summary(String snapshotId) {
        return cache.get(SUMMARIES, snapshotId, () -> summarize(snapshotId));
    }

    /**
     * Roles without members, sorted by name.
     */
    public List<String> orphanRoles(RoleGraph graph) {
        return graph.roleNames().stream()
            .filter(role -> graph.members(role).isEmpty())
            .sorted()
            .toList();
    }

    private RiskSummary summarize(String snapshotId) {
        RoleGraph graph = resolver.graphFor(snapshotId);
        int[] counts = new int[RiskLevel.values().length];
        List<String> usersWithRisks = new ArrayList<>();

        for (String userName : graph.userNames()) {
            RawUser user = graph.user(userName).orElseThrow();
            List<RiskFinding> findings = evaluate(user, resolver.resolve(snapshotId, PrincipalRef.user(userName)));
            for (RiskFinding finding : findings) {
                counts[finding.level().ordinal()]++;
            }
            if (!findings.isEmpty()) {
                usersWithRisks.add(userName);
            }
        }

        List<String> orphanRoles = orphanRoles(graph);
        counts[policy.levelOf(RiskType.ORPHAN_ROLE).ordinal()] += orphanRoles.size();
        usersWithRisks.sort(null);

        LOG.infof("Risk summary for snapshot %s: %d high, %d medium, %d low, %d orphan roles",
            snapshotId, counts[RiskLevel.HIGH.ordinal()], counts[RiskLevel.MEDIUM.ordinal()],
            counts[RiskLevel.LOW.ordinal()], orphanRoles.size());

        return new RiskSummary(
            counts[RiskLevel.HIGH.ordinal()],
            counts[RiskLevel.MEDIUM.ordinal()],
            counts[RiskLevel.LOW.ordinal()],
            orphanRoles,
            usersWithRisks,
            graph.userNames().size(),
            graph.roleNames().size(),
            graph.anomalies());
    }

    // ==================== Rules ====================

    List<RiskFinding> evaluate(RawUser user, ResolvedPrincipal resolved) {
        List<RiskFinding> findings = new ArrayList<>();

        for (EffectivePrivilege privilege : resolved.privileges()) {
            if (privilege.source() == PrivilegeSource.ROLE
                    && privilege.path().size() > 1
                    && policy.isAdministrative(privilege.accessType())) {
                findings.add(new RiskFinding(
                    policy.levelOf(RiskType.INHERITED_ADMIN_PRIVILEGE),
                    RiskType.INHERITED_ADMIN_PRIVILEGE,
                    String.format("Administrative privilege %s on %s inherited through %s",
                        privilege.accessType(), scopeOf(privilege), String.join(" -> ", privilege.path())),
                    privilege.sourceName(),
                    privilege.path()));
            }
        }

        for (EffectivePrivilege privilege : resolved.privileges()) {
            if (privilege.grantOption() && privilege.database() != null) {
                boolean direct = privilege.source() == PrivilegeSource.DIRECT;
                findings.add(new RiskFinding(
                    policy.levelOf(RiskType.GRANT_OPTION_DELEGATION),
                    RiskType.GRANT_OPTION_DELEGATION,
                    String.format("%s on %s can be granted onwards%s",
                        privilege.accessType(), scopeOf(privilege),
                        direct ? "" : " (via role " + privilege.sourceName() + ")"),
                    direct ? RiskFinding.DIRECT : privilege.sourceName(),
                    privilege.path()));
            }
        }

        if (policy.isUnrestricted(user.hostIp())) {
            findings.add(new RiskFinding(
                policy.levelOf(RiskType.UNRESTRICTED_HOST),
                RiskType.UNRESTRICTED_HOST,
                "User '" + user.name() + "' can connect from any host",
                RiskFinding.DIRECT,
                List.of()));
        }

        return findings;
    }

    private static String scopeOf(EffectivePrivilege privilege) {
        if (privilege.database() == null) {
            return "*.*";
        }
        String scope = privilege.database() + "." + (privilege.table() == null ? "*" : privilege.table());
        return privilege.column() == null ? scope : scope + "(" + privilege.column() + ")";
    }
}
