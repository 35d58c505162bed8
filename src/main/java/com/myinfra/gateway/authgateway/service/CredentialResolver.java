package com.myinfra.gateway.authgateway.service;

import com.myinfra.gateway.authgateway.model.AuthOutcome;
import com.myinfra.gateway.authgateway.model.AuthResult;
import com.myinfra.gateway.authgateway.model.RequestContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Resolves a request's credentials to a single {@link AuthResult}.
 * <p>
 * API keys are tried first. A recognized key that fails a restriction is terminal;
 * only when no usable API key is present does resolution fall through to the bearer token.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialResolver {

    private final ApiKeyAuthenticator apiKeyAuthenticator;
    private final TokenAuthenticator tokenAuthenticator;

    /**
     * Resolves the identity behind a request.
     *
     * @param context The inbound request
     * @return Mono emitting a success or a 401 failure, never an error
     */
    public Mono<AuthResult> resolve(RequestContext context) {
        return apiKeyAuthenticator.authenticate(context)
                .flatMap(outcome -> outcome instanceof AuthOutcome.NoCredential
                        ? tokenAuthenticator.authenticate(context)
                        : Mono.just(outcome))
                .map(CredentialResolver::toResult)
                .defaultIfEmpty(AuthResult.failure(AuthOutcome.INVALID_TOKEN))
                .onErrorResume(e -> {
                    log.error("Credential resolution failed unexpectedly", e);
                    return Mono.just(AuthResult.failure(AuthOutcome.INVALID_TOKEN));
                });
    }

    private static AuthResult toResult(AuthOutcome outcome) {
        if (outcome instanceof AuthOutcome.Authenticated authenticated) {
            return AuthResult.success(authenticated.identity());
        }
        if (outcome instanceof AuthOutcome.Rejected rejected) {
            return AuthResult.failure(rejected.reason());
        }
        return AuthResult.failure(AuthOutcome.INVALID_TOKEN);
    }
}
