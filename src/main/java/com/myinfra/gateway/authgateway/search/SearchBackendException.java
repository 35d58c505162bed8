package com.myinfra.gateway.authgateway.search;

/**
 * The search backend could not be reached or answered with an error status.
 */
public class SearchBackendException extends RuntimeException {

    private final int status;

    public SearchBackendException(String message, int status) {
        super(message);
        this.status = status;
    }

    public SearchBackendException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
    }

    /**
     * HTTP status returned by the backend, or 0 if no response was received.
     */
    public int getStatus() {
        return status;
    }
}
