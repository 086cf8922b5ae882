package tech.grantlens.platform.explorer;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.grantlens.platform.common.api.ApiResponses.ErrorResponse;
import tech.grantlens.platform.common.api.ExplorerResponses.ObjectAccessResponse;
import tech.grantlens.platform.common.api.ExplorerResponses.RoleDetail;
import tech.grantlens.platform.common.api.ExplorerResponses.UserDetail;
import tech.grantlens.platform.risk.RiskSummary;

/**
 * RBAC explorer API: users, roles, risks and object access of a cluster's snapshot.
 *
 * Every endpoint takes {@code cluster_id} and an optional {@code snapshot_id}; without it
 * the latest completed snapshot of the cluster is used.
 */
@Path("/api/explorer")
@Tag(name = "RBAC Explorer", description = "Browse resolved roles, privileges and risks of a snapshot")
@Produces(MediaType.APPLICATION_JSON)
public class ExplorerResource {

    @Inject
    RbacExplorerService explorerService;

    // ==================== Users ====================

    @GET
    @Path("/users")
    @Operation(summary = "List users with role and grant counts")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Users in capture order"),
        @APIResponse(responseCode = "404", description = "Cluster or snapshot not found",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
        @APIResponse(responseCode = "409", description = "Snapshot not completed",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public Response listUsers(
            @QueryParam("cluster_id") String clusterId,
            @QueryParam("snapshot_id") String snapshotId) {
        return Response.ok(explorerService.listUsers(clusterId, snapshotId)).build();
    }

    @GET
    @Path("/users/{name}")
    @Operation(summary = "Get a user's role closure and effective privileges")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "User details",
            content = @Content(schema = @Schema(implementation = UserDetail.class))),
        @APIResponse(responseCode = "404", description = "User, cluster or snapshot not found"),
        @APIResponse(responseCode = "409", description = "Snapshot not completed")
    })
    public Response getUser(
            @PathParam("name") String name,
            @QueryParam("cluster_id") String clusterId,
            @QueryParam("snapshot_id") String snapshotId) {
        return Response.ok(explorerService.getUserDetail(clusterId, snapshotId, name)).build();
    }

    @GET
    @Path("/users/{name}/risks")
    @Operation(summary = "List risk findings for a user")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Risk findings"),
        @APIResponse(responseCode = "404", description = "User, cluster or snapshot not found"),
        @APIResponse(responseCode = "409", description = "Snapshot not completed")
    })
    public Response getUserRisks(
            @PathParam("name") String name,
            @QueryParam("cluster_id") String clusterId,
            @QueryParam("snapshot_id") String snapshotId) {
        return Response.ok(explorerService.getUserRisks(clusterId, snapshotId, name)).build();
    }

    // ==================== Roles ====================

    @GET
    @Path("/roles")
    @Operation(summary = "List roles with member and grant counts")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Roles in capture order"),
        @APIResponse(responseCode = "404", description = "Cluster or snapshot not found"),
        @APIResponse(responseCode = "409", description = "Snapshot not completed")
    })
    public Response listRoles(
            @QueryParam("cluster_id") String clusterId,
            @QueryParam("snapshot_id") String snapshotId) {
        return Response.ok(explorerService.listRoles(clusterId, snapshotId)).build();
    }

    @GET
    @Path("/roles/{name}")
    @Operation(summary = "Get a role's members, inherited roles and direct grants")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Role details",
            content = @Content(schema = @Schema(implementation = RoleDetail.class))),
        @APIResponse(responseCode = "404", description = "Role, cluster or snapshot not found"),
        @APIResponse(responseCode = "409", description = "Snapshot not completed")
    })
    public Response getRole(
            @PathParam("name") String name,
            @QueryParam("cluster_id") String clusterId,
            @QueryParam("snapshot_id") String snapshotId) {
        return Response.ok(explorerService.getRoleDetail(clusterId, snapshotId, name)).build();
    }

    @GET
    @Path("/roles/{name}/effective-privileges")
    @Operation(summary = "List a role's effective privileges with provenance")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Effective privileges"),
        @APIResponse(responseCode = "404", description = "Role, cluster or snapshot not found"),
        @APIResponse(responseCode = "409", description = "Snapshot not completed")
    })
    public Response getRoleEffectivePrivileges(
            @PathParam("name") String name,
            @QueryParam("cluster_id") String clusterId,
            @QueryParam("snapshot_id") String snapshotId) {
        return Response.ok(explorerService.getRoleEffectivePrivileges(clusterId, snapshotId, name)).build();
    }

    // ==================== Risks ====================

    @GET
    @Path("/risk-summary")
    @Operation(summary = "Get the snapshot-wide risk summary")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Risk summary",
            content = @Content(schema = @Schema(implementation = RiskSummary.class))),
        @APIResponse(responseCode = "404", description = "Cluster or snapshot not found"),
        @APIResponse(responseCode = "409", description = "Snapshot not completed")
    })
    public Response getRiskSummary(
            @QueryParam("cluster_id") String clusterId,
            @QueryParam("snapshot_id") String snapshotId) {
        return Response.ok(explorerService.getRiskSummary(clusterId, snapshotId)).build();
    }

    // ==================== Objects ====================

    @GET
    @Path("/objects/{database}")
    @Operation(summary = "List principals with access to a database")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Object access",
            content = @Content(schema = @Schema(implementation = ObjectAccessResponse.class))),
        @APIResponse(responseCode = "400", description = "Invalid scope"),
        @APIResponse(responseCode = "404", description = "Cluster or snapshot not found")
    })
    public Response getDatabaseAccess(
            @PathParam("database") String database,
            @QueryParam("cluster_id") String clusterId,
            @QueryParam("snapshot_id") String snapshotId,
            @QueryParam("scope") String scope) {
        return Response.ok(explorerService.getObjectAccess(clusterId, snapshotId, database, null, scope)).build();
    }

    @GET
    @Path("/objects/{database}/{table}")
    @Operation(summary = "List principals with access to a table",
        description = "A table of '*' looks up the database as a whole.")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Object access",
            content = @Content(schema = @Schema(implementation = ObjectAccessResponse.class))),
        @APIResponse(responseCode = "400", description = "Invalid scope"),
        @APIResponse(responseCode = "404", description = "Cluster or snapshot not found")
    })
    public Response getTableAccess(
            @PathParam("database") String database,
            @PathParam("table") String table,
            @QueryParam("cluster_id") String clusterId,
            @QueryParam("snapshot_id") String snapshotId,
            @QueryParam("scope") String scope) {
        return Response.ok(explorerService.getObjectAccess(clusterId, snapshotId, database, table, scope)).build();
    }
}
