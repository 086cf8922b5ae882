package tech.grantlens.platform.risk;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.List;

/**
 * Risk rule configuration.
 *
 * Example configuration:
 * <pre>
 * grantlens.risk.admin-access-types=GRANT,CREATE USER,DROP ROLE,SYSTEM,ACCESS MANAGEMENT
 * grantlens.risk.any-host-patterns=::/0,0.0.0.0/0
 * grantlens.risk.severity.orphan-role=medium
 * grantlens.risk.severity.inherited-admin-privilege=high
 * </pre>
 */
@ConfigMapping(prefix = "grantlens.risk")
public interface RiskConfig {

    /**
     * Access types treated as administrative. Compared case-insensitively.
     */
    @WithDefault("GRANT,CREATE USER,ALTER USER,DROP USER,CREATE ROLE,DROP ROLE,ROLE ADMIN,SYSTEM,ACCESS MANAGEMENT,ALL")
    List<String> adminAccessTypes();

    /**
     * Host entries that admit connections from anywhere.
     */
    @WithDefault("::/0,0.0.0.0/0")
    List<String> anyHostPatterns();

    Severity severity();

    interface Severity {

        @WithDefault("medium")
        RiskLevel orphanRole();

        @WithDefault("high")
        RiskLevel inheritedAdminPrivilege();

        @WithDefault("medium")
        RiskLevel grantOptionDelegation();

        @WithDefault("low")
        RiskLevel unrestrictedHost();
    }
}
