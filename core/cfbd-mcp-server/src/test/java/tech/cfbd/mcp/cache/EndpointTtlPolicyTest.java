package tech.cfbd.mcp.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class EndpointTtlPolicyTest {

    private final EndpointTtlPolicy policy = new EndpointTtlPolicy(Duration.ofMinutes(5));

    @Test
    @DisplayName("game data should use the live TTL")
    void ttlFor_shouldUseLiveTtl_forGameData() {
        assertThat(policy.ttlFor("/games")).isEqualTo(Duration.ofMinutes(10));
        assertThat(policy.ttlFor("/plays")).isEqualTo(Duration.ofMinutes(10));
    }

    @Test
    @DisplayName("rankings and records should use the season TTL")
    void ttlFor_shouldUseSeasonTtl_forRankings() {
        assertThat(policy.ttlFor("/rankings")).isEqualTo(Duration.ofHours(1));
        assertThat(policy.ttlFor("/records")).isEqualTo(Duration.ofHours(1));
    }

    @Test
    @DisplayName("unlisted paths should use the configured default")
    void ttlFor_shouldUseDefault_forUnknownPath() {
        assertThat(policy.ttlFor("/venues")).isEqualTo(Duration.ofMinutes(5));
    }
}
