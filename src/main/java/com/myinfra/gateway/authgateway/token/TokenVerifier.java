package com.myinfra.gateway.authgateway.token;

import com.myinfra.gateway.authgateway.model.TokenClaims;
import reactor.core.publisher.Mono;

/**
 * Verifies signed bearer tokens.
 */
public interface TokenVerifier {

    /**
     * Verifies a token and extracts its claims.
     *
     * @param purpose  The purpose the token must have been issued for
     * @param rawToken The token as presented by the caller
     * @return The token claims, or an error (typically {@link TokenVerificationException})
     *         if the signature, expiry, purpose or format is invalid
     */
    Mono<TokenClaims> verify(TokenPurpose purpose, String rawToken);
}
