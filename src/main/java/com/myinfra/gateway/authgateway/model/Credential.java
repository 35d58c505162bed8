package com.myinfra.gateway.authgateway.model;

/**
 * Caller-supplied secret found on a request. Never persisted or logged.
 */
public sealed interface Credential permits Credential.ApiKeyCredential, Credential.BearerCredential {

    String raw();

    record ApiKeyCredential(String raw) implements Credential {

        @Override
        public String toString() {
            return "ApiKeyCredential[****]";
        }
    }

    record BearerCredential(String raw) implements Credential {

        @Override
        public String toString() {
            return "BearerCredential[****]";
        }
    }
}
