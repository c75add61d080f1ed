package tech.noetzold.devpulse_api.client;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import tech.noetzold.devpulse_api.model.ApiEnvelope;
import tech.noetzold.devpulse_api.model.ProductivityReport;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

@Component
public class ProductivityClient extends EnvelopeClient {

    private static final ParameterizedTypeReference<ApiEnvelope<ProductivityReport>> ENVELOPE =
            new ParameterizedTypeReference<>() {};

    private final Clock clock;
    private final int days;

    public ProductivityClient(@Qualifier("analyticsWebClient") WebClient analyticsWebClient,
                              @Value("${devpulse.upstream.timeout-ms:1500}") long timeoutMs,
                              @Value("${devpulse.analytics.days:30}") int days,
                              Clock clock) {
        super(analyticsWebClient, Duration.ofMillis(timeoutMs), "productivity");
        this.clock = clock;
        this.days = days;
    }

    /**
     * Productivity over the trailing window ending now.
     */
    public Optional<ProductivityReport> fetchProductivity() {
        Instant end = clock.instant();
        Instant start = end.minus(Duration.ofDays(days));
        return fetch(b -> b.path("/api/analytics/productivity")
                .queryParam("startDate", start.toString())
                .queryParam("endDate", end.toString())
                .build(), ENVELOPE);
    }
}
