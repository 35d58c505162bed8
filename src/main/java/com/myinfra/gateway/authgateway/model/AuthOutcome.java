package com.myinfra.gateway.authgateway.model;

/**
 * Result of a single authentication scheme.
 */
public sealed interface AuthOutcome
        permits AuthOutcome.Authenticated, AuthOutcome.NoCredential, AuthOutcome.Rejected {

    String REFERRER_RESTRICTION = "referrer restriction";
    String IP_RESTRICTION = "ip restriction";
    String NO_TOKEN_FOUND = "no token found";
    String INVALID_TOKEN = "invalid token";

    static AuthOutcome authenticated(Identity identity) {
        return new Authenticated(identity);
    }

    static AuthOutcome noCredential() {
        return NoCredential.INSTANCE;
    }

    static AuthOutcome rejected(String reason) {
        return new Rejected(reason);
    }

    record Authenticated(Identity identity) implements AuthOutcome {
    }

    /**
     * The scheme found no usable credential; the next scheme should be tried.
     */
    final class NoCredential implements AuthOutcome {

        private static final NoCredential INSTANCE = new NoCredential();

        private NoCredential() {
        }

        @Override
        public String toString() {
            return "NoCredential";
        }
    }

    record Rejected(String reason) implements AuthOutcome {
    }
}
