package tech.cfbd.mcp.authentication.oauth;

/**
 * Failures of the authorization and token endpoints.
 *
 * <p>Every variant is reported to the client as HTTP 400 with an RFC 6749
 * error code. The client recovers by restarting the flow at /authorize.
 *
 * <ul>
 *   <li>{@link InvalidRequest} - a required parameter is missing</li>
 *   <li>{@link UnsupportedGrantType} - grant_type is not authorization_code</li>
 *   <li>{@link InvalidGrant} - the code was never issued, already used or expired</li>
 *   <li>{@link ClientMismatch} - client_id or redirect_uri differs from /authorize</li>
 *   <li>{@link PkceFailure} - code_verifier does not reproduce the stored challenge</li>
 * </ul>
 */
public abstract sealed class OAuthException extends RuntimeException permits
    OAuthException.InvalidRequest,
    OAuthException.UnsupportedGrantType,
    OAuthException.InvalidGrant,
    OAuthException.ClientMismatch,
    OAuthException.PkceFailure {

    private final String error;

    protected OAuthException(String error, String description) {
        super(description);
        this.error = error;
    }

    /**
     * RFC 6749 error code.
     */
    public String error() {
        return error;
    }

    public static final class InvalidRequest extends OAuthException {
        public InvalidRequest(String description) {
            super("invalid_request", description);
        }
    }

    public static final class UnsupportedGrantType extends OAuthException {
        public UnsupportedGrantType(String grantType) {
            super("unsupported_grant_type", "Grant type not supported: " + grantType);
        }
    }

    public static final class InvalidGrant extends OAuthException {
        public InvalidGrant() {
            super("invalid_grant", "Invalid code");
        }
    }

    public static final class ClientMismatch extends OAuthException {
        public ClientMismatch() {
            super("invalid_grant", "Client ID or redirect URI mismatch");
        }
    }

    public static final class PkceFailure extends OAuthException {
        public PkceFailure() {
            super("invalid_grant", "PKCE verification failed");
        }
    }
}
