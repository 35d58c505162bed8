package com.myinfra.gateway.authgateway.model;

import org.springframework.http.HttpStatus;

/**
 * Terminal authentication failure. The reason is for internal logging only.
 *
 * @param reason     Why resolution failed
 * @param httpStatus Status reported to the caller, always 401
 */
public record AuthFailure(String reason, int httpStatus) {

    public static AuthFailure unauthorized(String reason) {
        return new AuthFailure(reason, HttpStatus.UNAUTHORIZED.value());
    }
}
