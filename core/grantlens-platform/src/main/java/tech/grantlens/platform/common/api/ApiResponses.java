package tech.grantlens.platform.common.api;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.Map;

/**
 * Response DTOs shared by every endpoint.
 */
public final class ApiResponses {

    private ApiResponses() {} // Prevent instantiation

    // ========================================================================
    // Error Responses
    // ========================================================================

    /**
     * Error body for every 4xx response.
     */
    @Schema(description = "Error response for client errors")
    public record ErrorResponse(
        @Schema(description = "Error code for programmatic handling", example = "SNAPSHOT_NOT_READY")
        String code,
        @Schema(description = "Human-readable error message", example = "Snapshot snp_0HZXEQ5Y8JY5Z is PENDING")
        String message,
        @Schema(description = "Offending identifiers")
        Map<String, Object> details
    ) {
        public ErrorResponse(String code, String message) {
            this(code, message, Map.of());
        }
    }
}
