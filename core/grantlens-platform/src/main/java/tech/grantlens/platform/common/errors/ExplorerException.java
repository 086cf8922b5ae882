package tech.grantlens.platform.common.errors;

/**
 * Unchecked carrier for an {@link ExplorerError}.
 *
 * Services throw this; {@link ExplorerExceptionMapper} turns it into an HTTP response,
 * so resources don't need try-catch blocks.
 */
public class ExplorerException extends RuntimeException {

    private final ExplorerError error;

    public ExplorerException(ExplorerError error) {
        super(error.message());
        this.error = error;
    }

    public ExplorerError getError() {
        return error;
    }
}
