package tech.grantlens.platform.graph;

import tech.grantlens.platform.snapshot.PrincipalRef;

import java.util.List;

/**
 * Resolution result for one principal of one snapshot.
 *
 * @param principal the resolved user or role
 * @param roles transitive role closure in discovery order
 * @param privileges effective privileges, direct ones first
 */
public record ResolvedPrincipal(
    PrincipalRef principal,
    List<RoleClosureEntry> roles,
    List<EffectivePrivilege> privileges
) {

    public ResolvedPrincipal {
        roles = List.copyOf(roles);
        privileges = List.copyOf(privileges);
    }
}
