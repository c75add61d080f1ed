package tech.noetzold.devpulse_api.client;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import tech.noetzold.devpulse_api.model.ApiEnvelope;
import tech.noetzold.devpulse_api.model.TeamAnalyticsPayload;

import java.time.Duration;
import java.util.Optional;

@Component
public class TeamAnalyticsClient extends EnvelopeClient {

    private static final ParameterizedTypeReference<ApiEnvelope<TeamAnalyticsPayload>> ENVELOPE =
            new ParameterizedTypeReference<>() {};

    public TeamAnalyticsClient(@Qualifier("analyticsWebClient") WebClient analyticsWebClient,
                               @Value("${devpulse.upstream.timeout-ms:1500}") long timeoutMs) {
        super(analyticsWebClient, Duration.ofMillis(timeoutMs), "team-analytics");
    }

    public Optional<TeamAnalyticsPayload> fetchTeamAnalytics(String teamId) {
        return fetch(b -> b.path("/api/analytics/team")
                .queryParam("teamId", teamId)
                .build(), ENVELOPE);
    }

    public boolean isHealthy() {
        return ping(b -> b.path("/api/analytics/team")
                .queryParam("teamId", "health-check")
                .build());
    }
}
