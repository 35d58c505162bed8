package com.myinfra.gateway.authgateway.token;

/**
 * Kinds of signed tokens. A token minted for one purpose is never accepted for another.
 */
public enum TokenPurpose {

    LOGIN_ACCESS_TOKEN("login-access-token");

    /**
     * Name of the claim carrying the purpose inside the token.
     */
    public static final String CLAIM = "purpose";

    private final String claimValue;

    TokenPurpose(String claimValue) {
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return claimValue;
    }
}
