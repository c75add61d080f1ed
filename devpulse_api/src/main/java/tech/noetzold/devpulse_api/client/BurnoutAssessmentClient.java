package tech.noetzold.devpulse_api.client;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import tech.noetzold.devpulse_api.model.ApiEnvelope;
import tech.noetzold.devpulse_api.model.BurnoutAssessment;

import java.time.Duration;
import java.util.Optional;

@Component
public class BurnoutAssessmentClient extends EnvelopeClient {

    private static final ParameterizedTypeReference<ApiEnvelope<BurnoutAssessment>> ENVELOPE =
            new ParameterizedTypeReference<>() {};

    private final String repositoryId;
    private final int days;

    public BurnoutAssessmentClient(@Qualifier("analyticsWebClient") WebClient analyticsWebClient,
                                   @Value("${devpulse.upstream.timeout-ms:1500}") long timeoutMs,
                                   @Value("${devpulse.burnout.repository-id:default}") String repositoryId,
                                   @Value("${devpulse.analytics.days:30}") int days) {
        super(analyticsWebClient, Duration.ofMillis(timeoutMs), "burnout-assessment");
        this.repositoryId = repositoryId;
        this.days = days;
    }

    public Optional<BurnoutAssessment> fetchAssessment() {
        return fetchAssessment(repositoryId);
    }

    public Optional<BurnoutAssessment> fetchAssessment(String repository) {
        return fetch(b -> b.path("/api/analytics/burnout")
                .queryParam("repositoryId", repository)
                .queryParam("days", days)
                .build(), ENVELOPE);
    }

    public boolean isHealthy() {
        return ping(b -> b.path("/api/analytics/burnout")
                .queryParam("repositoryId", "health-check")
                .queryParam("days", 1)
                .build());
    }
}
