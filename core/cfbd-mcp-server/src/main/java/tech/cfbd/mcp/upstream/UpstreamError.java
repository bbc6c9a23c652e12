package tech.cfbd.mcp.upstream;

/**
 * Sealed interface representing typed failures of an upstream API call.
 *
 * <p>Every variant renders to the text the tool caller sees. Upstream failures
 * are reported inside a successful tool result, never as a transport error.
 *
 * <h2>Error Types</h2>
 * <ul>
 *   <li>{@link AuthenticationFailed} - HTTP 401, the API key was rejected</li>
 *   <li>{@link Forbidden} - HTTP 403</li>
 *   <li>{@link RateLimited} - HTTP 429</li>
 *   <li>{@link ApiError} - any other non-2xx status, or an unparseable body</li>
 *   <li>{@link NetworkError} - connect, DNS or timeout failure</li>
 * </ul>
 */
public sealed interface UpstreamError permits
    UpstreamError.AuthenticationFailed,
    UpstreamError.Forbidden,
    UpstreamError.RateLimited,
    UpstreamError.ApiError,
    UpstreamError.NetworkError {

    int MAX_BODY_LENGTH = 500;

    /**
     * Human-readable message shown to the tool caller.
     * @return error message
     */
    String message();

    /**
     * Map a non-2xx upstream status to its error.
     *
     * @param statusCode HTTP status code
     * @param body response body (may be null)
     */
    static UpstreamError fromStatus(int statusCode, String body) {
        return switch (statusCode) {
            case 401 -> new AuthenticationFailed();
            case 403 -> new Forbidden();
            case 429 -> new RateLimited();
            default -> new ApiError("HTTP " + statusCode + ": " + truncate(body == null ? "" : body));
        };
    }

    private static String truncate(String s) {
        return s.length() <= MAX_BODY_LENGTH ? s : s.substring(0, MAX_BODY_LENGTH);
    }

    record AuthenticationFailed() implements UpstreamError {
        @Override
        public String message() {
            return "401: API authentication failed. Please check your API key.";
        }
    }

    record Forbidden() implements UpstreamError {
        @Override
        public String message() {
            return "403: API access forbidden. Please check your permission.";
        }
    }

    record RateLimited() implements UpstreamError {
        @Override
        public String message() {
            return "429: Rate limit exceeded. Please try again later.";
        }
    }

    /**
     * @param detail status and body excerpt, or a description of the bad payload
     */
    record ApiError(String detail) implements UpstreamError {
        public static ApiError invalidJson() {
            return new ApiError("invalid JSON response from upstream");
        }

        @Override
        public String message() {
            return "API Error: " + detail;
        }
    }

    /**
     * @param cause the underlying exception
     */
    record NetworkError(Throwable cause) implements UpstreamError {
        @Override
        public String message() {
            return "Network error: " + (cause != null ? describe(cause) : "unknown");
        }

        private static String describe(Throwable cause) {
            String message = cause.getMessage();
            return message != null ? message : cause.getClass().getSimpleName();
        }
    }
}
