package com.myinfra.gateway.authgateway.service;

import com.myinfra.gateway.authgateway.config.AppConfig;
import com.myinfra.gateway.authgateway.model.AuthOutcome;
import com.myinfra.gateway.authgateway.model.Credential.BearerCredential;
import com.myinfra.gateway.authgateway.model.Identity.UserIdentity;
import com.myinfra.gateway.authgateway.model.RequestContext;
import com.myinfra.gateway.authgateway.model.TokenClaims;
import com.myinfra.gateway.authgateway.token.TokenPurpose;
import com.myinfra.gateway.authgateway.token.TokenVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Optional;
import java.util.OptionalLong;

@Slf4j
@Service
@RequiredArgsConstructor
public class TokenAuthenticator {

    private final TokenVerifier tokenVerifier;
    private final AppConfig appConfig;

    /**
     * Authenticates a request by signed bearer token.
     * <p>
     * This is the last scheme tried, so a missing token is a rejection rather than a fallthrough.
     * Every verification or claim failure collapses to {@link AuthOutcome#INVALID_TOKEN}.
     *
     * @param context The inbound request
     * @return Mono emitting exactly one outcome, never an error
     */
    public Mono<AuthOutcome> authenticate(RequestContext context) {
        Optional<BearerCredential> token = CredentialExtractor.bearer(context);
        if (token.isEmpty()) return Mono.just(AuthOutcome.rejected(AuthOutcome.NO_TOKEN_FOUND));

        return Mono.defer(() -> tokenVerifier.verify(TokenPurpose.LOGIN_ACCESS_TOKEN, token.get().raw()))
                .map(this::toOutcome)
                .defaultIfEmpty(AuthOutcome.rejected(AuthOutcome.INVALID_TOKEN))
                .onErrorResume(e -> {
                    log.debug("Bearer token verification failed: {}", e.getMessage());
                    return Mono.just(AuthOutcome.rejected(AuthOutcome.INVALID_TOKEN));
                });
    }

    private AuthOutcome toOutcome(TokenClaims claims) {
        OptionalLong accountId = claims.accountId(appConfig.getSecurity().getIssuerDomain());
        if (accountId.isEmpty()) {
            log.debug("Bearer token subject rejected");
            return AuthOutcome.rejected(AuthOutcome.INVALID_TOKEN);
        }
        return AuthOutcome.authenticated(new UserIdentity(accountId.getAsLong(), claims.scopes()));
    }
}
