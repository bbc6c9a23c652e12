package tech.cfbd.mcp.authentication.oauth;

import jakarta.enterprise.context.ApplicationScoped;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * PKCE (Proof Key for Code Exchange) support for the authorization code flow.
 *
 * Flow:
 * 1. Client generates random code_verifier
 * 2. Client computes code_challenge = BASE64URL(SHA256(code_verifier))
 * 3. Client sends code_challenge with /authorize
 * 4. Server stores code_challenge with the authorization code
 * 5. Client sends code_verifier with /token
 * 6. Server verifies SHA256(code_verifier) == stored code_challenge
 *
 * Only the S256 method is supported; "plain" is rejected at /authorize.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7636">RFC 7636 - PKCE</a>
 */
@ApplicationScoped
public class PkceService {

    public static final String METHOD_S256 = "S256";

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    /**
     * Generate a cryptographically random code verifier.
     *
     * 48 random bytes encode to 64 base64url characters, inside the
     * 43-128 character range RFC 7636 allows.
     */
    public String generateCodeVerifier() {
        byte[] bytes = new byte[48];
        SECURE_RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * Compute the S256 code challenge for a verifier.
     *
     * code_challenge = BASE64URL(SHA256(code_verifier)), unpadded
     *
     * @param codeVerifier The code verifier to hash
     * @return The code challenge
     */
    public String generateCodeChallenge(String codeVerifier) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(codeVerifier.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Verify that a code verifier reproduces the stored S256 challenge.
     *
     * @param codeVerifier The verifier provided in the token request
     * @param codeChallenge The challenge stored with the authorization code
     * @return true if the verifier matches the challenge
     */
    public boolean verifyCodeChallenge(String codeVerifier, String codeChallenge) {
        if (codeVerifier == null || codeChallenge == null) {
            return false;
        }
        return constantTimeEquals(generateCodeChallenge(codeVerifier), codeChallenge);
    }

    /**
     * Whether a code_challenge_method may be accepted at /authorize.
     */
    public boolean isSupportedMethod(String codeChallengeMethod) {
        return METHOD_S256.equals(codeChallengeMethod);
    }

    /**
     * Constant-time string comparison to prevent timing attacks.
     */
    private boolean constantTimeEquals(String a, String b) {
        if (a.length() != b.length()) {
            return false;
        }
        int result = 0;
        for (int i = 0; i < a.length(); i++) {
            result |= a.charAt(i) ^ b.charAt(i);
        }
        return result == 0;
    }
}
