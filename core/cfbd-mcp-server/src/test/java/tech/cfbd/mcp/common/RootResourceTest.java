package tech.cfbd.mcp.common;

import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.junit.jupiter.api.Test;
import tech.cfbd.mcp.integration.WireMockTestResource;

import static io.restassured.RestAssured.given;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.equalTo;

@QuarkusTest
@QuarkusTestResource(WireMockTestResource.class)
class RootResourceTest {

    @Inject
    ServerConfig serverConfig;

    @Test
    void root_shouldAnswerOk_withoutAuthentication() {
        given()
        .when()
            .get("/")
        .then()
            .statusCode(200)
            .body(equalTo("OK"));
    }

    @Test
    void robots_shouldDisallowEverything() {
        given()
        .when()
            .get("/robots.txt")
        .then()
            .statusCode(200)
            .body(equalTo("User-agent: *\nDisallow: /"));
    }

    @Test
    void boot_shouldServeRequestsThroughDebugFilter_whenServerConfigInjected() {
        assertThat(serverConfig.debug()).isFalse();

        given()
            .header("Authorization", "Bearer 0123456789abcdef")
        .when()
            .get("/")
        .then()
            .statusCode(200);
    }

    @Test
    void logLevel_shouldComeFromCategoryConfiguration() {
        assertThat(Logger.getLogger("tech.cfbd.mcp.common").isDebugEnabled()).isTrue();
        assertThat(Logger.getLogger("org.acme.elsewhere").isDebugEnabled()).isFalse();
    }
}
