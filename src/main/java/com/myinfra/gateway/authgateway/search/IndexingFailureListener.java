package com.myinfra.gateway.authgateway.search;

/**
 * Observability sink for failed indexing attempts.
 */
@FunctionalInterface
public interface IndexingFailureListener {

    /**
     * Called after every failed attempt to index a record, including the last one.
     *
     * @param index        Target index
     * @param error        Why the attempt failed
     * @param attemptsLeft Attempts remaining for this record; 0 means it will be dropped
     */
    void onFailedAttempt(String index, Throwable error, int attemptsLeft);
}
