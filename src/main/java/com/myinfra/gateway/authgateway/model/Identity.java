package com.myinfra.gateway.authgateway.model;

import java.util.List;

/**
 * Normalized identity produced by a successful credential resolution.
 * Carries enough for downstream authorization and no secret material.
 */
public sealed interface Identity permits Identity.ApiKeyIdentity, Identity.UserIdentity {

    long id();

    List<String> scopes();

    /**
     * Value forwarded downstream in the {@code X-Auth-Type} header.
     */
    String type();

    /**
     * Identity of a caller authenticated with an API key.
     *
     * @param id     The API key record ID
     * @param scopes Scopes granted to the key
     */
    record ApiKeyIdentity(long id, List<String> scopes) implements Identity {

        public ApiKeyIdentity {
            scopes = scopes == null ? List.of() : List.copyOf(scopes);
        }

        @Override
        public String type() {
            return "api-key";
        }
    }

    /**
     * Identity of a user authenticated with a bearer token.
     *
     * @param id     The numeric account ID taken from the token subject
     * @param scopes Scopes carried by the token
     */
    record UserIdentity(long id, List<String> scopes) implements Identity {

        public UserIdentity {
            scopes = scopes == null ? List.of() : List.copyOf(scopes);
        }

        @Override
        public String type() {
            return "user";
        }
    }
}
