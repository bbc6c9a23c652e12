package tech.cfbd.mcp.upstream;

import io.smallrye.mutiny.Uni;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletionException;

/**
 * Read-only HTTP client for the College Football Data API.
 *
 * Emits the raw response body on 2xx. Any other status, and any transport
 * failure, fails the Uni with an {@link UpstreamException}.
 */
@Singleton
public class UpstreamClient {

    private static final Logger LOG = Logger.getLogger(UpstreamClient.class);

    private final HttpClient httpClient;
    private final String apiKey;
    private final Duration timeout;

    @Inject
    public UpstreamClient(UpstreamConfig config) {
        this(HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(config.timeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(),
            config.apiKey(),
            config.timeout());
        LOG.infof("Initializing UpstreamClient for %s, timeout: %dms", config.baseUrl(), config.timeout().toMillis());
    }

    UpstreamClient(HttpClient httpClient, String apiKey, Duration timeout) {
        this.httpClient = httpClient;
        this.apiKey = apiKey;
        this.timeout = timeout;
    }

    public Uni<String> get(UpstreamRequest request) {
        HttpRequest httpRequest = HttpRequest.newBuilder(request.uri())
            .timeout(timeout)
            .header("Authorization", "Bearer " + apiKey)
            .header("Accept", "application/json")
            .GET()
            .build();

        return Uni.createFrom().completionStage(() -> {
                LOG.debugf("GET %s", request.uri());
                return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString());
            })
            .onFailure().transform(e -> {
                Throwable cause = unwrap(e);
                LOG.warnf("Upstream request to %s failed: %s", request.path(), cause.toString());
                return new UpstreamException(new UpstreamError.NetworkError(cause));
            })
            .map(response -> {
                int status = response.statusCode();
                if (status >= 200 && status < 300) {
                    return response.body();
                }
                LOG.warnf("Upstream returned %d for %s", status, request.path());
                throw new UpstreamException(UpstreamError.fromStatus(status, response.body()));
            });
    }

    private static Throwable unwrap(Throwable e) {
        Throwable current = e;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
