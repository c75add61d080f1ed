package tech.noetzold.devpulse_api.client;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import tech.noetzold.devpulse_api.model.BurnoutAssessment;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class BurnoutAssessmentClientTest {

    @Test
    void fetchAssessment_queriesConfiguredWindow() {
        AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();
        WebClient webClient = WebClient.builder()
                .baseUrl("http://analytics.test")
                .exchangeFunction(request -> {
                    lastRequest.set(request);
                    return Mono.just(ClientResponse.create(HttpStatus.OK)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body("""
                                    {"success": true,
                                     "data": {"userId": "u1", "riskScore": 72.5, "confidence": 0.8,
                                              "recommendations": ["Block focus time"]}}
                                    """)
                            .build());
                })
                .build();
        BurnoutAssessmentClient client = new BurnoutAssessmentClient(webClient, 1000, "repo-7", 14);

        Optional<BurnoutAssessment> result = client.fetchAssessment();

        assertThat(result).isPresent();
        assertThat(result.get().riskScore()).isEqualTo(72.5);
        assertThat(result.get().recommendations()).containsExactly("Block focus time");
        assertThat(lastRequest.get().url().getPath()).isEqualTo("/api/analytics/burnout");
        assertThat(lastRequest.get().url().getQuery()).isEqualTo("repositoryId=repo-7&days=14");
    }

    @Test
    void fetchAssessment_successWithoutData_isEmpty() {
        WebClient webClient = WebClient.builder()
                .baseUrl("http://analytics.test")
                .exchangeFunction(request -> Mono.just(ClientResponse.create(HttpStatus.OK)
                        .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                        .body("{\"success\": true}")
                        .build()))
                .build();

        assertThat(new BurnoutAssessmentClient(webClient, 1000, "default", 30).fetchAssessment()).isEmpty();
    }
}
