package com.myinfra.gateway.authgateway.service;

import com.myinfra.gateway.authgateway.model.Credential.ApiKeyCredential;
import com.myinfra.gateway.authgateway.model.Credential.BearerCredential;
import com.myinfra.gateway.authgateway.model.RequestContext;

import java.util.Optional;

/**
 * Locates credentials on a request. The query parameter wins over the
 * {@code Authorization} header, and a leading {@code "Bearer "} is stripped.
 */
public final class CredentialExtractor {

    static final String API_KEY_PARAM = "api_key";
    static final String TOKEN_PARAM = "token";
    static final String AUTHORIZATION_HEADER = "authorization";
    static final String BEARER_PREFIX = "Bearer ";

    private CredentialExtractor() {
    }

    public static Optional<ApiKeyCredential> apiKey(RequestContext context) {
        return find(context, API_KEY_PARAM).map(ApiKeyCredential::new);
    }

    public static Optional<BearerCredential> bearer(RequestContext context) {
        return find(context, TOKEN_PARAM).map(BearerCredential::new);
    }

    private static Optional<String> find(RequestContext context, String queryParam) {
        Optional<String> value = context.queryParam(queryParam)
                .or(() -> context.header(AUTHORIZATION_HEADER));

        // an empty value or a bare "Bearer " is no credential at all, so it never reaches verification
        return value
                .map(CredentialExtractor::stripBearer)
                .filter(raw -> !raw.isBlank());
    }

    private static String stripBearer(String value) {
        return value.startsWith(BEARER_PREFIX) ? value.substring(BEARER_PREFIX.length()) : value;
    }
}
