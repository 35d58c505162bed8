package com.myinfra.gateway.authgateway.service;

import com.myinfra.gateway.authgateway.config.AppConfig;
import com.myinfra.gateway.authgateway.model.AuthResult;
import com.myinfra.gateway.authgateway.model.Identity;
import com.myinfra.gateway.authgateway.model.RequestContext;
import com.myinfra.gateway.authgateway.search.RetryingIndexQueue;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Records authentication attempts into the access log index.
 */
@Service
@RequiredArgsConstructor
public class AccessLogRecorder {

    private final RetryingIndexQueue indexQueue;
    private final AppConfig appConfig;
    private final Clock clock;

    /**
     * Queues an access log record. Does nothing if indexing or the access log index is not configured.
     *
     * @param method  HTTP method
     * @param path    Request path
     * @param context The request as seen by the resolver
     * @param result  The resolution result
     */
    public void record(String method, String path, RequestContext context, AuthResult result) {
        String index = appConfig.getSearch() == null ? null : appConfig.getSearch().getAccessLogIndex();
        if (!indexQueue.isEnabled() || index == null || index.isBlank()) return;

        Map<String, Object> record = new LinkedHashMap<>();
        record.put("date", clock.instant().toString());
        record.put("method", method);
        record.put("path", path);
        record.put("clientIp", context.clientIp());

        if (result instanceof AuthResult.Success success) {
            Identity identity = success.identity();
            record.put("authType", identity.type());
            record.put("authId", identity.id());
            record.put("status", "authenticated");
        } else if (result instanceof AuthResult.Failure failure) {
            record.put("status", "rejected");
            record.put("reason", failure.failure().reason());
        }

        indexQueue.submit(index, record);
    }
}
