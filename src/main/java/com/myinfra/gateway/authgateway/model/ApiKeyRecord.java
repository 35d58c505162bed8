package com.myinfra.gateway.authgateway.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * API key as stored by the key store. Read-only from the gateway's perspective.
 *
 * @param id                   The API key record ID
 * @param scopes               Scopes granted to the key, in stored order
 * @param referrerRestrictions Glob patterns the request referrer must match (empty = unrestricted)
 * @param ipRestrictions       IP addresses or CIDR ranges the client must fall in (empty = unrestricted)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ApiKeyRecord(
        long id,
        List<String> scopes,
        List<String> referrerRestrictions,
        List<String> ipRestrictions) {

    public ApiKeyRecord {
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
        referrerRestrictions = referrerRestrictions == null ? List.of() : List.copyOf(referrerRestrictions);
        ipRestrictions = ipRestrictions == null ? List.of() : List.copyOf(ipRestrictions);
    }
}
