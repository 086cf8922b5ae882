package tech.grantlens.platform.explorer;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.grantlens.platform.common.api.ApiResponses.ErrorResponse;
import tech.grantlens.platform.common.api.SnapshotResponses.CreateSnapshotRequest;
import tech.grantlens.platform.common.api.SnapshotResponses.FailSnapshotRequest;
import tech.grantlens.platform.common.api.SnapshotResponses.SnapshotDto;
import tech.grantlens.platform.common.api.SnapshotResponses.SnapshotListResponse;
import tech.grantlens.platform.diff.SnapshotDiff;
import tech.grantlens.platform.snapshot.RawEntities;
import tech.grantlens.platform.snapshot.Snapshot;
import tech.grantlens.platform.snapshot.SnapshotService;

import java.util.List;

/**
 * Snapshot API.
 *
 * Read side: list, fetch and diff captures. Write side: the collector opens a capture,
 * stores its raw entities and then completes or fails it.
 */
@Path("/api/snapshots")
@Tag(name = "Snapshots", description = "Snapshot listing, diffing and collector ingestion")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class SnapshotResource {

    @Inject
    SnapshotService snapshotService;

    @Inject
    RbacExplorerService explorerService;

    // ==================== Reads ====================

    @GET
    @Operation(summary = "List snapshots of a cluster, newest first")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Snapshots",
            content = @Content(schema = @Schema(implementation = SnapshotListResponse.class))),
        @APIResponse(responseCode = "400", description = "Missing cluster or limit out of range",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public Response listSnapshots(
            @QueryParam("cluster_id") String clusterId,
            @QueryParam("limit") Integer limit) {
        List<SnapshotDto> snapshots = snapshotService.listSnapshots(clusterId, limit).stream()
            .map(SnapshotDto::from)
            .toList();
        return Response.ok(new SnapshotListResponse(snapshots, snapshots.size())).build();
    }

    @GET
    @Path("/diff")
    @Operation(summary = "Compare two completed snapshots of the same cluster")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Differences per category",
            content = @Content(schema = @Schema(implementation = SnapshotDiff.class))),
        @APIResponse(responseCode = "400", description = "Same snapshot twice or snapshots of different clusters"),
        @APIResponse(responseCode = "404", description = "Snapshot not found"),
        @APIResponse(responseCode = "409", description = "Snapshot not completed")
    })
    public Response diff(
            @QueryParam("from") String fromSnapshotId,
            @QueryParam("to") String toSnapshotId) {
        return Response.ok(explorerService.diffSnapshots(fromSnapshotId, toSnapshotId)).build();
    }

    @GET
    @Path("/{id}")
    @Operation(summary = "Get a snapshot by ID")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Snapshot",
            content = @Content(schema = @Schema(implementation = SnapshotDto.class))),
        @APIResponse(responseCode = "404", description = "Snapshot not found")
    })
    public Response getSnapshot(@PathParam("id") String id) {
        return Response.ok(SnapshotDto.from(snapshotService.getSnapshot(id))).build();
    }

    // ==================== Collector ====================

    @POST
    @Operation(summary = "Open a pending snapshot for a cluster")
    @APIResponses({
        @APIResponse(responseCode = "201", description = "Snapshot created",
            content = @Content(schema = @Schema(implementation = SnapshotDto.class))),
        @APIResponse(responseCode = "400", description = "Missing cluster")
    })
    public Response createSnapshot(CreateSnapshotRequest request, @Context UriInfo uriInfo) {
        Snapshot snapshot = snapshotService.create(request == null ? null : request.clusterId());
        return Response.status(Response.Status.CREATED)
            .entity(SnapshotDto.from(snapshot))
            .location(uriInfo.getAbsolutePathBuilder().path(snapshot.id).build())
            .build();
    }

    @PUT
    @Path("/{id}/entities")
    @Operation(summary = "Store the raw entities of a pending snapshot")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Entities stored",
            content = @Content(schema = @Schema(implementation = SnapshotDto.class))),
        @APIResponse(responseCode = "404", description = "Snapshot not found"),
        @APIResponse(responseCode = "409", description = "Snapshot is no longer pending")
    })
    public Response storeEntities(@PathParam("id") String id, RawEntities entities) {
        return Response.ok(SnapshotDto.from(snapshotService.populate(id, entities))).build();
    }

    @POST
    @Path("/{id}/complete")
    @Operation(summary = "Mark a populated snapshot as completed")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Snapshot completed"),
        @APIResponse(responseCode = "404", description = "Snapshot not found"),
        @APIResponse(responseCode = "409", description = "Snapshot not pending or not populated")
    })
    public Response completeSnapshot(@PathParam("id") String id) {
        return Response.ok(SnapshotDto.from(snapshotService.complete(id))).build();
    }

    @POST
    @Path("/{id}/fail")
    @Operation(summary = "Mark a pending snapshot as failed")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Snapshot failed"),
        @APIResponse(responseCode = "404", description = "Snapshot not found"),
        @APIResponse(responseCode = "409", description = "Snapshot is no longer pending")
    })
    public Response failSnapshot(@PathParam("id") String id, FailSnapshotRequest request) {
        Snapshot snapshot = snapshotService.fail(id, request == null ? null : request.error());
        return Response.ok(SnapshotDto.from(snapshot)).build();
    }
}
