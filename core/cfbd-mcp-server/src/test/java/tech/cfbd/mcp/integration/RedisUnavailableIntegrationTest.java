package tech.cfbd.mcp.integration;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.WireMock;
import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import io.quarkus.test.junit.QuarkusTestProfile;
import io.quarkus.test.junit.TestProfile;
import io.restassured.http.ContentType;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;

/**
 * Tool calls keep working when the Redis cache cannot be reached. Every call
 * goes upstream.
 */
@QuarkusTest
@TestProfile(RedisUnavailableIntegrationTest.UnreachableRedisProfile.class)
@QuarkusTestResource(WireMockTestResource.class)
class RedisUnavailableIntegrationTest {

    public static class UnreachableRedisProfile implements QuarkusTestProfile {
        @Override
        public Map<String, String> getConfigOverrides() {
            return Map.of(
                "cfbd.cache.type", "REDIS",
                "cfbd.cache.operation-timeout", "PT0.2S",
                "quarkus.redis.hosts", "redis://localhost:1"
            );
        }
    }

    @InjectWireMock
    WireMockServer wireMock;

    @Test
    void toolsCall_shouldFallThroughToUpstream_whenRedisDown() {
        String token = McpTestSupport.obtainToken();
        String sessionId = McpTestSupport.initialize(token);
        String call = "{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"tools/call\","
            + "\"params\":{\"name\":\"get-games\",\"arguments\":{\"year\":2017}}}";

        for (int i = 0; i < 2; i++) {
            given()
                .header("Authorization", "Bearer " + token)
                .header("Mcp-Session-Id", sessionId)
                .contentType(ContentType.JSON)
                .accept(ContentType.JSON)
                .body(call)
            .when()
                .post("/mcp")
            .then()
                .statusCode(200)
                .body("result.isError", equalTo(false))
                .body("result.content[0].text", containsString("401520281"));
        }

        wireMock.verify(2, getRequestedFor(urlPathEqualTo("/games"))
            .withQueryParam("year", WireMock.equalTo("2017")));
    }
}
