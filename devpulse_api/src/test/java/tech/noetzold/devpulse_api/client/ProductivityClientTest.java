package tech.noetzold.devpulse_api.client;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import tech.noetzold.devpulse_api.MutableClock;
import tech.noetzold.devpulse_api.model.ProductivityReport;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ProductivityClientTest {

    @Test
    void fetchProductivity_requestsTrailingWindow() {
        AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();
        WebClient webClient = WebClient.builder()
                .baseUrl("http://analytics.test")
                .exchangeFunction(request -> {
                    lastRequest.set(request);
                    return Mono.just(ClientResponse.create(HttpStatus.OK)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body("""
                                    {"success": true,
                                     "data": {"metrics": {"commitCount": 42, "prCount": 7,
                                                          "commitFrequency": [{"date": "2024-04-30", "count": 3}]},
                                              "workPatterns": {"weekendWorkPercentage": 12.5}}}
                                    """)
                            .build());
                })
                .build();
        MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        ProductivityClient client = new ProductivityClient(webClient, 1000, 30, clock);

        Optional<ProductivityReport> result = client.fetchProductivity();

        assertThat(result).isPresent();
        assertThat(result.get().metrics().commitCount()).isEqualTo(42);
        assertThat(result.get().metrics().commitFrequency()).hasSize(1);
        assertThat(result.get().workPatterns().weekendWorkPercentage()).isEqualTo(12.5);
        assertThat(lastRequest.get().url().getPath()).isEqualTo("/api/analytics/productivity");
        assertThat(lastRequest.get().url().getQuery())
                .isEqualTo("startDate=2024-04-01T10:00:00Z&endDate=2024-05-01T10:00:00Z");
    }
}
