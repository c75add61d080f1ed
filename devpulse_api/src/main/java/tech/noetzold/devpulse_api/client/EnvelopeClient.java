package tech.noetzold.devpulse_api.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;
import tech.noetzold.devpulse_api.model.ApiEnvelope;
import tech.noetzold.devpulse_api.service.UpstreamUnavailableException;

import java.net.URI;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;

/**
 * Reads {@code {success, data, error}} envelopes from an analytics endpoint.
 * <p>
 * A non-2xx status and a {@code success:false} body both come back as {@link Optional#empty()}.
 * Transport failures, timeouts and unreadable bodies are thrown as {@link UpstreamUnavailableException}.
 */
@Slf4j
abstract class EnvelopeClient {

    private final WebClient webClient;
    private final Duration timeout;
    private final String sourceName;

    protected EnvelopeClient(WebClient webClient, Duration timeout, String sourceName) {
        this.webClient = webClient;
        this.timeout = timeout;
        this.sourceName = sourceName;
    }

    protected <T> Optional<T> fetch(Function<UriBuilder, URI> uri,
                                    ParameterizedTypeReference<ApiEnvelope<T>> type) {
        return webClient.get()
                .uri(uri)
                .exchangeToMono(resp -> {
                    if (resp.statusCode().is2xxSuccessful()) {
                        return resp.bodyToMono(type)
                                .map(this::unwrap);
                    }
                    int status = resp.statusCode().value();
                    return resp.releaseBody()
                            .then(Mono.fromSupplier(() -> {
                                log.debug("{} answered HTTP {}, using defaults", sourceName, status);
                                return Optional.<T>empty();
                            }));
                })
                .timeout(timeout)
                .onErrorMap(e -> !(e instanceof UpstreamUnavailableException),
                        e -> new UpstreamUnavailableException(sourceName, e))
                .blockOptional()
                .flatMap(Function.identity());
    }

    protected boolean ping(Function<UriBuilder, URI> uri) {
        Boolean ok = webClient.get()
                .uri(uri)
                .exchangeToMono(resp -> resp.releaseBody()
                        .then(Mono.just(resp.statusCode().is2xxSuccessful())))
                .timeout(timeout)
                .onErrorMap(e -> new UpstreamUnavailableException(sourceName, e))
                .block();
        return Boolean.TRUE.equals(ok);
    }

    private <T> Optional<T> unwrap(ApiEnvelope<T> envelope) {
        if (envelope.isUsable()) {
            return Optional.of(envelope.data());
        }
        log.debug("{} returned an unsuccessful envelope: {}", sourceName,
                envelope.error() != null ? envelope.error().message() : "no data");
        return Optional.empty();
    }
}
