package com.myinfra.gateway.authgateway.service;

import com.myinfra.gateway.authgateway.TestFixtures;
import com.myinfra.gateway.authgateway.TestFixtures.CountingTokenVerifier;
import com.myinfra.gateway.authgateway.TestFixtures.FakeKeyStore;
import com.myinfra.gateway.authgateway.config.AppConfig;
import com.myinfra.gateway.authgateway.model.ApiKeyRecord;
import com.myinfra.gateway.authgateway.model.AuthOutcome;
import com.myinfra.gateway.authgateway.model.AuthResult;
import com.myinfra.gateway.authgateway.model.Identity.ApiKeyIdentity;
import com.myinfra.gateway.authgateway.model.Identity.UserIdentity;
import com.myinfra.gateway.authgateway.model.RequestContext;
import com.myinfra.gateway.authgateway.token.JwtTokenVerifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.myinfra.gateway.authgateway.TestFixtures.accessToken;
import static com.myinfra.gateway.authgateway.TestFixtures.request;
import static com.myinfra.gateway.authgateway.TestFixtures.unrestrictedKey;
import static org.assertj.core.api.Assertions.assertThat;

class CredentialResolverTest {

    private final String key = UUID.randomUUID().toString();
    private FakeKeyStore keyStore;
    private CountingTokenVerifier tokenVerifier;
    private CredentialResolver resolver;

    @BeforeEach
    void setUp() {
        AppConfig appConfig = TestFixtures.appConfig();
        keyStore = new FakeKeyStore();
        tokenVerifier = new CountingTokenVerifier(new JwtTokenVerifier(appConfig));
        resolver = new CredentialResolver(
                new ApiKeyAuthenticator(keyStore, new RestrictionMatcher()),
                new TokenAuthenticator(tokenVerifier, appConfig));
    }

    @Test
    void resolvesApiKeyFromBearerHeader() {
        keyStore.records.put(key, unrestrictedKey(11, "read", "write"));

        AuthResult result = resolve(request(Map.of(), Map.of("authorization", "Bearer " + key), null));

        assertThat(result).isEqualTo(AuthResult.success(new ApiKeyIdentity(11, List.of("read", "write"))));
    }

    @Test
    void resolvesUserFromTokenQueryParameter() {
        String token = accessToken("acct:42@example.com", List.of("read"));

        AuthResult result = resolve(request(Map.of("token", token), Map.of(), null));

        assertThat(result).isEqualTo(AuthResult.success(new UserIdentity(42, List.of("read"))));
    }

    @Test
    void validApiKeyNeverConsultsTokenVerifier() {
        keyStore.records.put(key, unrestrictedKey(11, "read"));
        String token = accessToken("acct:42@example.com", List.of("read"));

        AuthResult result = resolve(request(Map.of("api_key", key, "token", token), Map.of(), null));

        assertThat(result).isEqualTo(AuthResult.success(new ApiKeyIdentity(11, List.of("read"))));
        assertThat(keyStore.lookups).hasValue(1);
        assertThat(tokenVerifier.verifications).hasValue(0);
    }

    @Test
    void malformedApiKeyFallsThroughToToken() {
        String token = accessToken("acct:5@example.com", List.of("read"));

        AuthResult result = resolve(request(Map.of("api_key", "not-a-uuid", "token", token), Map.of(), null));

        assertThat(result).isEqualTo(AuthResult.success(new UserIdentity(5, List.of("read"))));
        assertThat(keyStore.lookups).hasValue(0);
        assertThat(tokenVerifier.verifications).hasValue(1);
    }

    @Test
    void unknownApiKeyFallsThroughToToken() {
        String token = accessToken("acct:5@example.com", List.of());

        AuthResult result = resolve(request(Map.of("api_key", key, "token", token), Map.of(), null));

        assertThat(result).isEqualTo(AuthResult.success(new UserIdentity(5, List.of())));
        assertThat(keyStore.lookups).hasValue(1);
    }

    @Test
    void keyStoreOutageFallsThroughToToken() {
        keyStore.failure = new IllegalStateException("redis down");
        String token = accessToken("acct:5@example.com", List.of("read"));

        AuthResult result = resolve(request(Map.of("api_key", key, "token", token), Map.of(), null));

        assertThat(result).isEqualTo(AuthResult.success(new UserIdentity(5, List.of("read"))));
    }

    @Test
    void restrictionFailureIsTerminalEvenWithValidToken() {
        keyStore.records.put(key, new ApiKeyRecord(11, List.of("read"), List.of("https://*.example.com/*"), List.of()));
        String token = accessToken("acct:42@example.com", List.of("read"));

        AuthResult result = resolve(request(
                Map.of("api_key", key, "token", token),
                Map.of("referer", "https://attacker.test/"),
                null));

        assertThat(result).isEqualTo(AuthResult.failure(AuthOutcome.REFERRER_RESTRICTION));
        assertThat(tokenVerifier.verifications).hasValue(0);
    }

    @Test
    void ipRestrictionFailureIsTerminal() {
        keyStore.records.put(key, new ApiKeyRecord(11, List.of("read"), List.of(), List.of("10.0.0.0/8")));
        String token = accessToken("acct:42@example.com", List.of("read"));

        AuthResult result = resolve(request(Map.of("api_key", key, "token", token), Map.of(), "172.16.0.1"));

        assertThat(result).isEqualTo(AuthResult.failure(AuthOutcome.IP_RESTRICTION));
        assertThat(tokenVerifier.verifications).hasValue(0);
    }

    @Test
    void tokenFromAnotherIssuerIsInvalid() {
        String token = accessToken("acct:42@staging.example.com", List.of("read"));

        AuthResult result = resolve(request(Map.of("token", token), Map.of(), null));

        assertThat(result).isEqualTo(AuthResult.failure(AuthOutcome.INVALID_TOKEN));
    }

    @Test
    void unknownApiKeyInHeaderEndsAsInvalidToken() {
        AuthResult result = resolve(request(Map.of(), Map.of("authorization", "Bearer " + key), null));

        assertThat(result).isEqualTo(AuthResult.failure(AuthOutcome.INVALID_TOKEN));
    }

    @Test
    void noCredentialsAtAllIsNoTokenFound() {
        AuthResult result = resolve(request(Map.of(), Map.of(), "10.0.0.1"));

        assertThat(result).isEqualTo(AuthResult.failure(AuthOutcome.NO_TOKEN_FOUND));
    }

    @Test
    void everyFailureIsUnauthorized() {
        AuthResult result = resolve(request(Map.of("token", "garbage"), Map.of(), null));

        assertThat(result).isInstanceOf(AuthResult.Failure.class);
        assertThat(((AuthResult.Failure) result).failure().httpStatus()).isEqualTo(401);
    }

    @Test
    void resolvingTheSameRequestTwiceGivesTheSameResult() {
        keyStore.records.put(key, new ApiKeyRecord(11, List.of("read"), List.of(), List.of("10.0.0.0/8")));
        RequestContext allowed = request(Map.of("api_key", key), Map.of(), "10.0.0.9");
        RequestContext denied = request(Map.of("api_key", key), Map.of(), "11.0.0.9");
        RequestContext token = request(Map.of("token", accessToken("acct:1@example.com", List.of("a"))), Map.of(), null);

        assertThat(resolve(allowed)).isEqualTo(resolve(allowed));
        assertThat(resolve(denied)).isEqualTo(resolve(denied));
        assertThat(resolve(token)).isEqualTo(resolve(token));
    }

    private AuthResult resolve(RequestContext context) {
        return resolver.resolve(context).block();
    }
}
