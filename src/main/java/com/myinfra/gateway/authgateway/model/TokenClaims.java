package com.myinfra.gateway.authgateway.model;

import java.util.List;
import java.util.OptionalLong;

/**
 * Claims extracted from a verified bearer token.
 *
 * @param subject Token subject, expected as {@code acct:<id>@<issuer-domain>}
 * @param scopes  Scopes carried by the token
 */
public record TokenClaims(String subject, List<String> scopes) {

    private static final String ACCOUNT_PREFIX = "acct:";

    public TokenClaims {
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
    }

    /**
     * Parses the account ID out of the subject.
     * The subject must split into exactly two parts on {@code @}, the domain part must equal
     * {@code issuerDomain} and the remaining ID must be a non-negative integer.
     *
     * @param issuerDomain The configured issuer domain
     * @return The account ID, or empty if the subject does not satisfy these rules
     */
    public OptionalLong accountId(String issuerDomain) {
        if (subject == null || issuerDomain == null) return OptionalLong.empty();

        String[] parts = subject.split("@", -1);
        if (parts.length != 2 || !parts[1].equals(issuerDomain)) return OptionalLong.empty();

        String userPart = parts[0].startsWith(ACCOUNT_PREFIX)
                ? parts[0].substring(ACCOUNT_PREFIX.length())
                : parts[0];
        if (userPart.isEmpty() || !userPart.chars().allMatch(c -> c >= '0' && c <= '9')) {
            return OptionalLong.empty();
        }

        try {
            return OptionalLong.of(Long.parseLong(userPart));
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }
}
