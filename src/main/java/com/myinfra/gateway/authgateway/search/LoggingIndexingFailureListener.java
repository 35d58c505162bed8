package com.myinfra.gateway.authgateway.search;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LoggingIndexingFailureListener implements IndexingFailureListener {

    @Override
    public void onFailedAttempt(String index, Throwable error, int attemptsLeft) {
        log.error("Indexing record into '{}' failed, retrying ({} attempts left): {}",
                index, attemptsLeft, error.getClass().getSimpleName());
    }
}
