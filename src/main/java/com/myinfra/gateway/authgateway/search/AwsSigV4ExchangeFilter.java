package com.myinfra.gateway.authgateway.search;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.http.ContentStreamProvider;
import software.amazon.awssdk.http.SdkHttpMethod;
import software.amazon.awssdk.http.SdkHttpRequest;
import software.amazon.awssdk.http.auth.aws.signer.AwsV4HttpSigner;
import software.amazon.awssdk.http.auth.spi.signer.HttpSigner;
import software.amazon.awssdk.http.auth.spi.signer.SignedRequest;
import software.amazon.awssdk.regions.Region;

import java.time.Clock;
import java.util.Objects;

/**
 * Signs search backend requests with AWS Signature Version 4 for the {@code es} service.
 * <p>
 * The payload is hashed into the signature, so callers must put the exact body bytes into the
 * {@link #PAYLOAD_ATTRIBUTE} request attribute. Requests without it are signed as empty.
 */
@Slf4j
public class AwsSigV4ExchangeFilter implements ExchangeFilterFunction {

    public static final String PAYLOAD_ATTRIBUTE = AwsSigV4ExchangeFilter.class.getName() + ".payload";

    static final String SERVICE_SIGNING_NAME = "es";

    private static final byte[] EMPTY_PAYLOAD = new byte[0];

    private final AwsCredentialsProvider credentialsProvider;
    private final Region region;
    private final Clock clock;
    private final AwsV4HttpSigner signer = AwsV4HttpSigner.create();

    public AwsSigV4ExchangeFilter(AwsCredentialsProvider credentialsProvider, Region region, Clock clock) {
        this.credentialsProvider = Objects.requireNonNull(credentialsProvider, "AwsCredentialsProvider must not be null");
        this.region = Objects.requireNonNull(region, "Region must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        log.info("Signing search backend requests for region {}", region.id());
    }

    @Override
    public Mono<ClientResponse> filter(ClientRequest request, ExchangeFunction next) {
        return Mono.fromCallable(() -> sign(request)).flatMap(next::exchange);
    }

    ClientRequest sign(ClientRequest request) {
        byte[] payload = request.attribute(PAYLOAD_ATTRIBUTE)
                .filter(byte[].class::isInstance)
                .map(byte[].class::cast)
                .orElse(EMPTY_PAYLOAD);

        SdkHttpRequest.Builder unsigned = SdkHttpRequest.builder()
                .method(SdkHttpMethod.fromValue(request.method().name()))
                .uri(request.url());
        request.headers().forEach((name, values) -> {
            if (!HttpHeaders.AUTHORIZATION.equalsIgnoreCase(name)) unsigned.putHeader(name, values);
        });

        SignedRequest signed = signer.sign(signing -> signing
                .identity(credentialsProvider.resolveCredentials())
                .request(unsigned.build())
                .payload(ContentStreamProvider.fromByteArray(payload))
                .putProperty(AwsV4HttpSigner.SERVICE_SIGNING_NAME, SERVICE_SIGNING_NAME)
                .putProperty(AwsV4HttpSigner.REGION_NAME, region.id())
                .putProperty(HttpSigner.SIGNING_CLOCK, clock));

        return ClientRequest.from(request)
                .headers(headers -> signed.request().headers().forEach((name, values) -> {
                    // the connector sets Host from the URL
                    if (!HttpHeaders.HOST.equalsIgnoreCase(name)) headers.put(name, values);
                }))
                .build();
    }
}
