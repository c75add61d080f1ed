package tech.noetzold.devpulse_api.client;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import tech.noetzold.devpulse_api.model.TeamAnalyticsPayload;
import tech.noetzold.devpulse_api.service.UpstreamUnavailableException;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TeamAnalyticsClientTest {

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    private TeamAnalyticsClient clientAnswering(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
                .baseUrl("http://analytics.test")
                .exchangeFunction(request -> {
                    lastRequest.set(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        return new TeamAnalyticsClient(webClient, 1000);
    }

    @Test
    void fetchTeamAnalytics_successfulEnvelope_unwrapsData() {
        TeamAnalyticsClient client = clientAnswering(HttpStatus.OK, """
                {"success": true,
                 "data": {"teamId": "platform",
                          "metrics": {"velocity": {"average": 9.5, "trend": "stable", "percentageChange": 1.2},
                                      "collaboration": {"score": 0.8,
                                                        "network": {"nodes": [{"id": "n1", "capacity": 70}]}}},
                          "extra": "ignored"},
                 "timestamp": "2024-05-01T10:00:00Z"}
                """);

        Optional<TeamAnalyticsPayload> result = client.fetchTeamAnalytics("platform");

        assertThat(result).isPresent();
        assertThat(result.get().teamId()).isEqualTo("platform");
        assertThat(result.get().metrics().velocity().average()).isEqualTo(9.5);
        assertThat(result.get().nodes()).hasSize(1);
        assertThat(result.get().nodes().get(0).capacity()).isEqualTo(70);
        assertThat(lastRequest.get().url().getPath()).isEqualTo("/api/analytics/team");
        assertThat(lastRequest.get().url().getQuery()).isEqualTo("teamId=platform");
    }

    @Test
    void fetchTeamAnalytics_unsuccessfulEnvelope_isEmpty() {
        TeamAnalyticsClient client = clientAnswering(HttpStatus.OK, """
                {"success": false, "error": {"code": "RATE_LIMITED", "message": "slow down"}}
                """);

        assertThat(client.fetchTeamAnalytics("platform")).isEmpty();
    }

    @Test
    void fetchTeamAnalytics_serverError_isEmpty() {
        TeamAnalyticsClient client = clientAnswering(HttpStatus.INTERNAL_SERVER_ERROR, "{}");

        assertThat(client.fetchTeamAnalytics("platform")).isEmpty();
    }

    @Test
    void fetchTeamAnalytics_transportFailure_throwsUpstreamUnavailable() {
        WebClient webClient = WebClient.builder()
                .baseUrl("http://analytics.test")
                .exchangeFunction(request -> Mono.error(new IOException("connection refused")))
                .build();
        TeamAnalyticsClient client = new TeamAnalyticsClient(webClient, 1000);

        assertThatThrownBy(() -> client.fetchTeamAnalytics("platform"))
                .isInstanceOf(UpstreamUnavailableException.class)
                .hasRootCauseInstanceOf(IOException.class);
    }

    @Test
    void isHealthy_followsStatusCode() {
        assertThat(clientAnswering(HttpStatus.OK, "{}").isHealthy()).isTrue();
        assertThat(lastRequest.get().url().getQuery()).isEqualTo("teamId=health-check");
        assertThat(clientAnswering(HttpStatus.SERVICE_UNAVAILABLE, "{}").isHealthy()).isFalse();
    }
}
