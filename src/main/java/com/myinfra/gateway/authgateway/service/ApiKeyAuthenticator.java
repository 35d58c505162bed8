package com.myinfra.gateway.authgateway.service;

import com.myinfra.gateway.authgateway.model.ApiKeyRecord;
import com.myinfra.gateway.authgateway.model.AuthOutcome;
import com.myinfra.gateway.authgateway.model.Credential;
import com.myinfra.gateway.authgateway.model.Identity.ApiKeyIdentity;
import com.myinfra.gateway.authgateway.model.RequestContext;
import com.myinfra.gateway.authgateway.store.KeyStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Optional;
import java.util.regex.Pattern;

@Slf4j
@Service
@RequiredArgsConstructor
public class ApiKeyAuthenticator {

    private static final Pattern UUID_PATTERN = Pattern.compile(
            "[0-9a-f]{8}-[0-9a-f]{4}-[1-8][0-9a-f]{3}-[89ab][0-9a-f]{3}-[0-9a-f]{12}"
                    + "|00000000-0000-0000-0000-000000000000",
            Pattern.CASE_INSENSITIVE);

    private final KeyStore keyStore;
    private final RestrictionMatcher restrictionMatcher;

    /**
     * Authenticates a request by API key.
     * <p>
     * A missing or malformed key, an unknown key and a key store failure all yield
     * {@link AuthOutcome.NoCredential} so callers cannot tell which keys exist.
     * A known key that fails its referrer or IP restriction is rejected.
     *
     * @param context The inbound request
     * @return Mono emitting exactly one outcome, never an error
     */
    public Mono<AuthOutcome> authenticate(RequestContext context) {
        Optional<String> apiKey = CredentialExtractor.apiKey(context)
                .map(Credential::raw)
                .filter(ApiKeyAuthenticator::isKeyFormat);

        if (apiKey.isEmpty()) return Mono.just(AuthOutcome.noCredential());

        return Mono.defer(() -> keyStore.lookup(apiKey.get()))
                .map(record -> checkRestrictions(record, context))
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.debug("API key not found");
                    return AuthOutcome.noCredential();
                }))
                .onErrorResume(e -> {
                    log.warn("API key lookup failed, treating as absent: {}", e.getMessage());
                    return Mono.just(AuthOutcome.noCredential());
                });
    }

    private AuthOutcome checkRestrictions(ApiKeyRecord record, RequestContext context) {
        String referrer = context.header("referer").orElse(null);
        if (!restrictionMatcher.matchesReferrer(referrer, record.referrerRestrictions())) {
            log.debug("API key {} failed referrer restriction", record.id());
            return AuthOutcome.rejected(AuthOutcome.REFERRER_RESTRICTION);
        }

        if (!restrictionMatcher.matchesIp(context.clientIp(), record.ipRestrictions())) {
            log.debug("API key {} failed IP restriction", record.id());
            return AuthOutcome.rejected(AuthOutcome.IP_RESTRICTION);
        }

        return AuthOutcome.authenticated(new ApiKeyIdentity(record.id(), record.scopes()));
    }

    static boolean isKeyFormat(String candidate) {
        return UUID_PATTERN.matcher(candidate).matches();
    }
}
