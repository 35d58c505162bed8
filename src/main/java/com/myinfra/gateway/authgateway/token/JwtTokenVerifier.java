package com.myinfra.gateway.authgateway.token;

import com.myinfra.gateway.authgateway.config.AppConfig;
import com.myinfra.gateway.authgateway.config.AppConfig.SecurityConfig;
import com.myinfra.gateway.authgateway.model.TokenClaims;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.JwtParserBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import javax.crypto.SecretKey;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.List;
import java.util.Objects;

/**
 * {@link TokenVerifier} for JWTs signed with either an HMAC secret or an RSA key pair.
 */
@Slf4j
@Component
public class JwtTokenVerifier implements TokenVerifier {

    static final String SCOPES_CLAIM = "scopes";

    private final JwtParser parser;

    public JwtTokenVerifier(AppConfig appConfig) {
        this.parser = buildParser(appConfig.getSecurity());
    }

    @Override
    public Mono<TokenClaims> verify(TokenPurpose purpose, String rawToken) {
        return Mono.fromCallable(() -> parse(purpose, rawToken));
    }

    private TokenClaims parse(TokenPurpose purpose, String rawToken) {
        if (parser == null) {
            throw new TokenVerificationException("No JWT key configured");
        }

        Claims claims;
        try {
            claims = parser.parseSignedClaims(rawToken).getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            throw new TokenVerificationException("JWT validation failed: " + e.getMessage(), e);
        }

        if (!purpose.claimValue().equals(claims.get(TokenPurpose.CLAIM))) {
            throw new TokenVerificationException("Token was not issued as " + purpose);
        }

        return new TokenClaims(claims.getSubject(), scopesOf(claims));
    }

    private static List<String> scopesOf(Claims claims) {
        Object scopes = claims.get(SCOPES_CLAIM);
        if (!(scopes instanceof List<?> list)) return List.of();

        return list.stream()
                .filter(Objects::nonNull)
                .map(Object::toString)
                .toList();
    }

    /**
     * Builds the JWT parser from the configured key material.
     * A public key takes precedence over a shared secret.
     *
     * @param security Security configuration
     * @return The parser, or null if no key is configured
     */
    private static JwtParser buildParser(SecurityConfig security) {
        JwtParserBuilder parserBuilder = Jwts.parser();

        if (security != null && security.getJwtPublicKey() != null && !security.getJwtPublicKey().isBlank()) {
            // Asymmetric (RS256)
            parserBuilder.verifyWith(parsePublicKey(security.getJwtPublicKey()));
        } else if (security != null && security.getJwtSecret() != null && !security.getJwtSecret().isBlank()) {
            // Symmetric (HS256)
            byte[] keyBytes = Base64.getDecoder().decode(security.getJwtSecret());
            SecretKey key = Keys.hmacShaKeyFor(keyBytes);
            parserBuilder.verifyWith(key);
        } else {
            log.error("No JWT key configured, bearer tokens will be rejected");
            return null;
        }

        return parserBuilder.build();
    }

    /**
     * Parses a Base64-encoded X.509 RSA public key.
     *
     * @param base64PublicKey Base64-encoded public key
     * @return PublicKey instance
     * @throws IllegalStateException if the key cannot be decoded
     */
    private static PublicKey parsePublicKey(String base64PublicKey) {
        try {
            byte[] keyBytes = Base64.getDecoder().decode(base64PublicKey);
            X509EncodedKeySpec spec = new X509EncodedKeySpec(keyBytes);
            KeyFactory kf = KeyFactory.getInstance("RSA");
            return kf.generatePublic(spec);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new IllegalStateException("Invalid app.security.jwt-public-key", e);
        }
    }
}
