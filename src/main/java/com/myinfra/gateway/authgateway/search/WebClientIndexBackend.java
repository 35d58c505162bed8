package com.myinfra.gateway.authgateway.search;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myinfra.gateway.authgateway.config.AppConfig.AwsConfig;
import com.myinfra.gateway.authgateway.config.AppConfig.SearchConfig;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * {@link IndexBackend} speaking the Elasticsearch REST API through {@link WebClient}.
 * Connects with optional basic auth, or signs every request with SigV4 when AWS credentials are configured.
 */
@Slf4j
public class WebClientIndexBackend implements IndexBackend {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public WebClientIndexBackend(WebClient.Builder webClientBuilder,
                                 SearchConfig config,
                                 ObjectMapper objectMapper,
                                 Clock clock) {
        Objects.requireNonNull(webClientBuilder, "WebClient.Builder must not be null");
        Objects.requireNonNull(config, "SearchConfig must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper must not be null");

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) config.getConnectTimeout().toMillis())
                .responseTimeout(config.getResponseTimeout());

        AwsConfig aws = config.getAws();
        boolean signed = aws != null && aws.isConfigured();

        WebClient.Builder builder = webClientBuilder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .baseUrl(config.getNode())
                .defaultHeaders(headers -> {
                    headers.setContentType(MediaType.APPLICATION_JSON);
                    headers.setAccept(List.of(MediaType.APPLICATION_JSON));
                    if (!signed && config.getUsername() != null && !config.getUsername().isBlank()) {
                        headers.setBasicAuth(config.getUsername(),
                                config.getPassword() == null ? "" : config.getPassword());
                    }
                });

        if (signed) {
            builder.filter(new AwsSigV4ExchangeFilter(
                    StaticCredentialsProvider.create(AwsBasicCredentials.create(aws.getAccessKeyId(), aws.getSecretAccessKey())),
                    Region.of(aws.getRegion()),
                    clock));
        }

        this.webClient = builder.build();
        log.info("Search backend configured at {} ({})", config.getNode(), signed ? "AWS SigV4" : "direct");
    }

    @Override
    public Mono<Void> index(String index, Map<String, Object> record) {
        return post("_doc", index, record, WebClient.ResponseSpec::toBodilessEntity).then();
    }

    @Override
    public Mono<JsonNode> search(String index, Map<String, Object> query) {
        return post("_search", index, query, spec -> spec.bodyToMono(JsonNode.class));
    }

    @Override
    public Mono<Long> deleteByQuery(String index, Map<String, Object> query) {
        return post("_delete_by_query", index, query, spec -> spec.bodyToMono(JsonNode.class)
                .map(body -> body.path("deleted").asLong(0))
                .defaultIfEmpty(0L));
    }

    private <T> Mono<T> post(String endpoint,
                             String index,
                             Map<String, Object> body,
                             Function<WebClient.ResponseSpec, Mono<T>> reader) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsBytes(body))
                .onErrorMap(JsonProcessingException.class, e -> new SearchBackendException(
                        "Could not serialize " + endpoint + " request for '" + index + "'", e))
                .flatMap(payload -> reader.apply(webClient.post()
                        .uri("/{index}/" + endpoint, index)
                        .attribute(AwsSigV4ExchangeFilter.PAYLOAD_ATTRIBUTE, payload)
                        .bodyValue(payload)
                        .retrieve()
                        .onStatus(HttpStatusCode::isError, response -> toException(endpoint, index, response))))
                .onErrorMap(WebClientRequestException.class, WebClientIndexBackend::unreachable);
    }

    private Mono<SearchBackendException> toException(String endpoint, String index, ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> new SearchBackendException(
                        String.format("Search backend %s on '%s' failed with status %d: %s",
                                endpoint, index, status, body),
                        status));
    }

    private static SearchBackendException unreachable(WebClientRequestException e) {
        return new SearchBackendException("Search backend unreachable: " + e.getMessage(), e);
    }
}
