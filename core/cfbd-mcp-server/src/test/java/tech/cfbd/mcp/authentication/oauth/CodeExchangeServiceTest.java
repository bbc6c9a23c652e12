package tech.cfbd.mcp.authentication.oauth;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tech.cfbd.mcp.authentication.token.SessionRegistry;
import tech.cfbd.mcp.authentication.token.TokenStore;
import tech.cfbd.mcp.authentication.token.TokenStoreFixtures;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the authorization code exchange.
 */
class CodeExchangeServiceTest {

    private static final String CLIENT_ID = "claude";
    private static final String REDIRECT_URI = "https://client.example/callback";

    @TempDir
    Path tempDir;

    private final PkceService pkce = new PkceService();
    private final SessionRegistry sessions = new SessionRegistry();
    private TokenStore tokenStore;
    private CodeExchangeService service;

    @BeforeEach
    void setUp() {
        tokenStore = TokenStoreFixtures.fileStore(tempDir.resolve("tokens.json"), new ObjectMapper());
        AuthorizationCodeStore codes = new AuthorizationCodeStore(Duration.ofMinutes(10), System::nanoTime);
        service = new CodeExchangeService(codes, tokenStore, sessions, pkce);
    }

    private AuthorizationGrant authorize(String verifier) {
        return service.createGrant(CLIENT_ID, REDIRECT_URI, "tools", pkce.generateCodeChallenge(verifier), "S256");
    }

    @Test
    @DisplayName("exchange should issue a recognized token when code, client and verifier match")
    void exchange_shouldIssueToken_whenEverythingMatches() {
        // Arrange
        String verifier = pkce.generateCodeVerifier();
        AuthorizationGrant grant = authorize(verifier);

        // Act
        CodeExchangeService.IssuedToken issued = service
            .exchange(grant.code(), CLIENT_ID, REDIRECT_URI, verifier)
            .await().indefinitely();

        // Assert
        assertThat(issued.accessToken()).matches("[0-9a-f]{64}");
        assertThat(tokenStore.contains(issued.accessToken())).isTrue();
        assertThat(sessions.sessionFor(issued.accessToken())).contains(issued.sessionId());
    }

    @Test
    @DisplayName("exchange should fail with InvalidGrant for an unknown code")
    void exchange_shouldFailInvalidGrant_whenCodeUnknown() {
        Uni<CodeExchangeService.IssuedToken> result =
            service.exchange("never-issued", CLIENT_ID, REDIRECT_URI, pkce.generateCodeVerifier());

        assertThatThrownBy(() -> result.await().indefinitely())
            .isInstanceOf(OAuthException.InvalidGrant.class)
            .hasMessage("Invalid code");
    }

    @Test
    @DisplayName("exchange should fail with ClientMismatch before checking PKCE")
    void exchange_shouldFailClientMismatch_whenClientDiffers() {
        String verifier = pkce.generateCodeVerifier();
        AuthorizationGrant grant = authorize(verifier);

        // Correct verifier, wrong client
        assertThatThrownBy(() -> service.exchange(grant.code(), "other-client", REDIRECT_URI, verifier)
                .await().indefinitely())
            .isInstanceOf(OAuthException.ClientMismatch.class)
            .hasMessage("Client ID or redirect URI mismatch");

        // Wrong verifier and wrong redirect: mismatch still wins
        assertThatThrownBy(() -> service.exchange(grant.code(), CLIENT_ID, "https://evil.example/cb", "wrong")
                .await().indefinitely())
            .isInstanceOf(OAuthException.ClientMismatch.class);
    }

    @Test
    @DisplayName("exchange should fail with PkceFailure when the verifier is wrong")
    void exchange_shouldFailPkce_whenVerifierWrong() {
        AuthorizationGrant grant = authorize(pkce.generateCodeVerifier());

        assertThatThrownBy(() -> service.exchange(grant.code(), CLIENT_ID, REDIRECT_URI, pkce.generateCodeVerifier())
                .await().indefinitely())
            .isInstanceOf(OAuthException.PkceFailure.class)
            .hasMessage("PKCE verification failed");
        assertThat(tokenStore.size()).isZero();
    }

    @Test
    @DisplayName("a failed PKCE attempt should leave the code exchangeable")
    void exchange_shouldKeepGrant_whenPkceFails() {
        String verifier = pkce.generateCodeVerifier();
        AuthorizationGrant grant = authorize(verifier);

        assertThatThrownBy(() -> service.exchange(grant.code(), CLIENT_ID, REDIRECT_URI, "wrong-verifier")
            .await().indefinitely())
            .isInstanceOf(OAuthException.PkceFailure.class);

        CodeExchangeService.IssuedToken issued = service.exchange(grant.code(), CLIENT_ID, REDIRECT_URI, verifier)
            .await().indefinitely();
        assertThat(tokenStore.contains(issued.accessToken())).isTrue();
    }

    @Test
    @DisplayName("a code should not be exchangeable twice")
    void exchange_shouldFailInvalidGrant_whenCodeReplayed() {
        String verifier = pkce.generateCodeVerifier();
        AuthorizationGrant grant = authorize(verifier);
        service.exchange(grant.code(), CLIENT_ID, REDIRECT_URI, verifier).await().indefinitely();

        assertThatThrownBy(() -> service.exchange(grant.code(), CLIENT_ID, REDIRECT_URI, verifier)
                .await().indefinitely())
            .isInstanceOf(OAuthException.InvalidGrant.class);
        assertThat(tokenStore.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("concurrent exchanges of one code should issue exactly one token")
    void exchange_shouldIssueOnce_whenRacing() throws Exception {
        String verifier = pkce.generateCodeVerifier();
        AuthorizationGrant grant = authorize(verifier);
        Callable<Boolean> attempt = () -> {
            try {
                service.exchange(grant.code(), CLIENT_ID, REDIRECT_URI, verifier).await().indefinitely();
                return true;
            } catch (OAuthException.InvalidGrant e) {
                return false;
            }
        };

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Boolean>> results = pool.invokeAll(List.of(
                attempt, attempt, attempt, attempt, attempt, attempt, attempt, attempt));
            long successes = 0;
            for (Future<Boolean> result : results) {
                if (result.get()) {
                    successes++;
                }
            }
            assertThat(successes).isEqualTo(1);
            assertThat(tokenStore.size()).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
