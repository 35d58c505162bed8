package com.myinfra.gateway.authgateway.token;

import com.myinfra.gateway.authgateway.TestFixtures;
import com.myinfra.gateway.authgateway.config.AppConfig;
import com.myinfra.gateway.authgateway.model.TokenClaims;
import io.jsonwebtoken.Jwts;
import org.junit.jupiter.api.Test;

import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtTokenVerifierTest {

    private final JwtTokenVerifier verifier = new JwtTokenVerifier(TestFixtures.appConfig());

    @Test
    void extractsSubjectAndScopes() {
        String token = TestFixtures.accessToken("acct:42@example.com", List.of("read", "write"));

        TokenClaims claims = verifier.verify(TokenPurpose.LOGIN_ACCESS_TOKEN, token).block();

        assertThat(claims).isEqualTo(new TokenClaims("acct:42@example.com", List.of("read", "write")));
    }

    @Test
    void missingScopesClaimYieldsNoScopes() {
        String token = Jwts.builder()
                .subject("acct:1@example.com")
                .claim(TokenPurpose.CLAIM, TokenPurpose.LOGIN_ACCESS_TOKEN.claimValue())
                .signWith(TestFixtures.SIGNING_KEY)
                .compact();

        TokenClaims claims = verifier.verify(TokenPurpose.LOGIN_ACCESS_TOKEN, token).block();

        assertThat(claims.scopes()).isEmpty();
    }

    @Test
    void rejectsTokenSignedWithAnotherKey() {
        String token = Jwts.builder()
                .subject("acct:1@example.com")
                .claim(TokenPurpose.CLAIM, TokenPurpose.LOGIN_ACCESS_TOKEN.claimValue())
                .signWith(Jwts.SIG.HS256.key().build())
                .compact();

        assertThatThrownBy(() -> verifier.verify(TokenPurpose.LOGIN_ACCESS_TOKEN, token).block())
                .isInstanceOf(TokenVerificationException.class);
    }

    @Test
    void rejectsExpiredToken() {
        String token = TestFixtures.token("acct:1@example.com", List.of(),
                TokenPurpose.LOGIN_ACCESS_TOKEN.claimValue(), Duration.ofMinutes(-1));

        assertThatThrownBy(() -> verifier.verify(TokenPurpose.LOGIN_ACCESS_TOKEN, token).block())
                .isInstanceOf(TokenVerificationException.class);
    }

    @Test
    void rejectsTokenIssuedForAnotherPurpose() {
        String token = TestFixtures.token("acct:1@example.com", List.of(), "email-verification", Duration.ofMinutes(5));

        assertThatThrownBy(() -> verifier.verify(TokenPurpose.LOGIN_ACCESS_TOKEN, token).block())
                .isInstanceOf(TokenVerificationException.class)
                .hasMessageContaining("LOGIN_ACCESS_TOKEN");
    }

    @Test
    void rejectsGarbage() {
        assertThatThrownBy(() -> verifier.verify(TokenPurpose.LOGIN_ACCESS_TOKEN, "not.a.jwt").block())
                .isInstanceOf(TokenVerificationException.class);
        assertThatThrownBy(() -> verifier.verify(TokenPurpose.LOGIN_ACCESS_TOKEN, "").block())
                .isInstanceOf(TokenVerificationException.class);
    }

    @Test
    void rejectsEverythingWithoutConfiguredKey() {
        AppConfig config = new AppConfig();
        config.getSecurity().setIssuerDomain("example.com");
        JwtTokenVerifier unconfigured = new JwtTokenVerifier(config);
        String token = TestFixtures.accessToken("acct:1@example.com", List.of());

        assertThatThrownBy(() -> unconfigured.verify(TokenPurpose.LOGIN_ACCESS_TOKEN, token).block())
                .isInstanceOf(TokenVerificationException.class)
                .hasMessageContaining("No JWT key");
    }

    @Test
    void verifiesRsaSignedTokensWithPublicKey() throws NoSuchAlgorithmException {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(2048);
        KeyPair keyPair = generator.generateKeyPair();

        AppConfig config = new AppConfig();
        config.getSecurity().setIssuerDomain("example.com");
        config.getSecurity().setJwtPublicKey(Base64.getEncoder().encodeToString(keyPair.getPublic().getEncoded()));
        JwtTokenVerifier rsaVerifier = new JwtTokenVerifier(config);

        String token = Jwts.builder()
                .subject("acct:3@example.com")
                .claim(TokenPurpose.CLAIM, TokenPurpose.LOGIN_ACCESS_TOKEN.claimValue())
                .claim("scopes", List.of("read"))
                .expiration(Date.from(Instant.now().plus(Duration.ofMinutes(5))))
                .signWith(keyPair.getPrivate())
                .compact();

        assertThat(rsaVerifier.verify(TokenPurpose.LOGIN_ACCESS_TOKEN, token).block())
                .isEqualTo(new TokenClaims("acct:3@example.com", List.of("read")));
    }

    @Test
    void rejectsInvalidPublicKeyAtStartup() {
        AppConfig config = new AppConfig();
        config.getSecurity().setIssuerDomain("example.com");
        config.getSecurity().setJwtPublicKey("bm90IGEga2V5");

        assertThatThrownBy(() -> new JwtTokenVerifier(config))
                .isInstanceOf(IllegalStateException.class);
    }
}
