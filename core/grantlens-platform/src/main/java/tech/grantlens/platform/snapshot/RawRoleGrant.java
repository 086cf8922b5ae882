package tech.grantlens.platform.snapshot;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Edge "grantee is granted role". The grantee is either a user or another role.
 *
 * @param grantee the principal receiving the role
 * @param roleName the granted role
 * @param isDefault the source system's own default flag for this grant
 * @param withAdminOption whether the grantee may grant the role further
 */
public record RawRoleGrant(
    PrincipalRef grantee,
    String roleName,
    @JsonProperty("is_default") boolean isDefault,
    boolean withAdminOption
) {

    public RawRoleGrant {
        Objects.requireNonNull(grantee, "grantee must not be null");
        Objects.requireNonNull(roleName, "roleName must not be null");
    }

    public static RawRoleGrant of(PrincipalRef grantee, String roleName) {
        return new RawRoleGrant(grantee, roleName, false, false);
    }
}
