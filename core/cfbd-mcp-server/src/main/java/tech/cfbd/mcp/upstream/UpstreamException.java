package tech.cfbd.mcp.upstream;

/**
 * Carries an {@link UpstreamError} through a failed {@code Uni}.
 */
public class UpstreamException extends RuntimeException {

    private final UpstreamError error;

    public UpstreamException(UpstreamError error) {
        super(error.message(), error instanceof UpstreamError.NetworkError network ? network.cause() : null);
        this.error = error;
    }

    public UpstreamError error() {
        return error;
    }
}
