package com.myinfra.gateway.authgateway.model;

/**
 * Outcome of resolving a request's credentials: either an {@link Identity} or an {@link AuthFailure}.
 */
public sealed interface AuthResult permits AuthResult.Success, AuthResult.Failure {

    static AuthResult success(Identity identity) {
        return new Success(identity);
    }

    static AuthResult failure(String reason) {
        return new Failure(AuthFailure.unauthorized(reason));
    }

    record Success(Identity identity) implements AuthResult {
    }

    record Failure(AuthFailure failure) implements AuthResult {
    }
}
