package tech.grantlens.platform.common.errors;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;
import tech.grantlens.platform.common.api.ApiResponses.ErrorResponse;

/**
 * JAX-RS exception mapper for ExplorerException.
 *
 * Response format:
 * <pre>
 * {
 *   "code": "SNAPSHOT_NOT_READY",
 *   "message": "Snapshot snp_0HZXEQ5Y8JY5Z is pending, not completed",
 *   "details": {
 *     "snapshotId": "snp_0HZXEQ5Y8JY5Z",
 *     "status": "PENDING"
 *   }
 * }
 * </pre>
 */
@Provider
public class ExplorerExceptionMapper implements ExceptionMapper<ExplorerException> {

    private static final Logger LOG = Logger.getLogger(ExplorerExceptionMapper.class);

    @Override
    public Response toResponse(ExplorerException exception) {
        ExplorerError error = exception.getError();
        Response.Status status = statusFor(error);
        LOG.debugf("Rejecting request with %d %s: %s", status.getStatusCode(), error.code(), error.message());

        return Response.status(status)
            .type(MediaType.APPLICATION_JSON)
            .entity(new ErrorResponse(error.code(), error.message(), error.details()))
            .build();
    }

    static Response.Status statusFor(ExplorerError error) {
        if (error instanceof ExplorerError.NotFound) {
            return Response.Status.NOT_FOUND;
        }
        if (error instanceof ExplorerError.SnapshotNotReady
            || error instanceof ExplorerError.SnapshotStateConflict) {
            return Response.Status.CONFLICT;
        }
        return Response.Status.BAD_REQUEST;
    }
}
