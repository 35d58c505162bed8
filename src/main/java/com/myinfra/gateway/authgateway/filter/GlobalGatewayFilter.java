package com.myinfra.gateway.authgateway.filter;

import com.myinfra.gateway.authgateway.config.AppConfig;
import com.myinfra.gateway.authgateway.exception.ErrorResponse;
import com.myinfra.gateway.authgateway.exception.ErrorResponseWriter;
import com.myinfra.gateway.authgateway.model.AuthFailure;
import com.myinfra.gateway.authgateway.model.AuthResult;
import com.myinfra.gateway.authgateway.model.Identity;
import com.myinfra.gateway.authgateway.model.RequestContext;
import com.myinfra.gateway.authgateway.service.AccessLogRecorder;
import com.myinfra.gateway.authgateway.service.CredentialResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cloud.gateway.filter.GatewayFilterChain;
import org.springframework.cloud.gateway.filter.GlobalFilter;
import org.springframework.core.Ordered;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.net.InetSocketAddress;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Global API Gateway filter that authenticates every request and propagates
 * the resolved identity to the downstream service.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GlobalGatewayFilter implements GlobalFilter, Ordered {

    public static final String AUTH_TYPE_HEADER = "X-Auth-Type";
    public static final String AUTH_ID_HEADER = "X-Auth-Id";
    public static final String AUTH_SCOPES_HEADER = "X-Auth-Scopes";

    private static final String AUTH_HEADER_PREFIX = "x-auth-";

    private static final List<String> CLIENT_IP_HEADERS = List.of(
            "X-Client-IP",
            "X-Forwarded-For",
            "CF-Connecting-IP",
            "True-Client-IP",
            "X-Real-IP");

    private final CredentialResolver credentialResolver;
    private final AccessLogRecorder accessLogRecorder;
    private final AppConfig appConfig;
    private final ErrorResponseWriter errorResponseWriter;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();

    /**
     * Main gateway filter method executed for every HTTP request.
     *
     * @param exchange The current server exchange (request + response context)
     * @param chain    The gateway filter chain
     * @return Mono<Void> indicating request completion
     */
    @Override
    public Mono<Void> filter(ServerWebExchange exchange, GatewayFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        String path = request.getURI().getPath();
        String method = request.getMethod().name();
        RequestContext context = toRequestContext(request);

        return credentialResolver.resolve(context)
                .flatMap(result -> {
                    accessLogRecorder.record(method, path, context, result);

                    if (result instanceof AuthResult.Success success) {
                        log.debug("Authenticated {} {} as {}:{}", method, path,
                                success.identity().type(), success.identity().id());
                        return chain.filter(withIdentity(exchange, success.identity()));
                    }

                    AuthFailure failure = ((AuthResult.Failure) result).failure();
                    if (isPublicPath(path)) {
                        log.debug("Anonymous access to public path {} ({})", path, failure.reason());
                        return chain.filter(withIdentity(exchange, null));
                    }

                    log.warn("401 - authentication failed for path: {} reason: {}", path, failure.reason());
                    return writeUnauthorized(exchange.getResponse(), path);
                });
    }

    /**
     * Builds the resolver's read-only view of the request.
     *
     * @param request The incoming HTTP request
     * @return RequestContext with query parameters, lower-cased headers and the client IP
     */
    RequestContext toRequestContext(ServerHttpRequest request) {
        Map<String, String> headers = new HashMap<>();
        request.getHeaders().forEach((key, values) -> {
            if (key != null && values != null && !values.isEmpty()) {
                headers.putIfAbsent(key.toLowerCase(Locale.ROOT), values.get(0));
            }
        });

        Map<String, List<String>> queryParams = new HashMap<>();
        request.getQueryParams().forEach((key, values) -> {
            if (key != null && values != null) queryParams.put(key, List.copyOf(values));
        });

        return new RequestContext(queryParams, headers, getClientIp(request));
    }

    /**
     * Replaces any caller-supplied identity headers with the resolved identity.
     *
     * @param exchange The current exchange
     * @param identity Resolved identity, or null for anonymous access
     * @return Exchange carrying the mutated request
     */
    private ServerWebExchange withIdentity(ServerWebExchange exchange, Identity identity) {
        ServerHttpRequest mutated = exchange.getRequest().mutate()
                .headers(headers -> {
                    List<String> spoofed = headers.keySet().stream()
                            .filter(key -> key.toLowerCase(Locale.ROOT).startsWith(AUTH_HEADER_PREFIX))
                            .toList();
                    spoofed.forEach(headers::remove);

                    if (identity != null) {
                        headers.set(AUTH_TYPE_HEADER, identity.type());
                        headers.set(AUTH_ID_HEADER, String.valueOf(identity.id()));
                        headers.set(AUTH_SCOPES_HEADER, String.join(",", identity.scopes()));
                    }
                })
                .build();

        return exchange.mutate().request(mutated).build();
    }

    /**
     * Writes a uniform 401 body. The failure reason is never sent to the caller.
     */
    private Mono<Void> writeUnauthorized(ServerHttpResponse response, String path) {
        response.getHeaders().set(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        return errorResponseWriter.write(response, ErrorResponse.unauthorized(path));
    }

    /**
     * Checks whether the requested path is publicly accessible.
     *
     * @param path The request URI path
     * @return true if the path matches any configured public pattern
     */
    private boolean isPublicPath(String path) {
        List<String> publicPaths = appConfig.getSecurity() == null ? null : appConfig.getSecurity().getPublicPaths();
        if (publicPaths == null) return false;

        if (path == null) path = "";

        for (String pattern : publicPaths) {
            if (pattern == null || pattern.isBlank()) continue;

            try {
                if (pathMatcher.match(pattern, path)) return true;
            } catch (IllegalArgumentException e) {
                log.warn("Invalid public-path pattern '{}', skipping. path='{}' err={}", pattern, path, e.getMessage());
            }
        }
        return false;
    }

    /**
     * Resolves the client's IP address for IP restrictions and access logging.
     * Prefers proxy headers, first hop of X-Forwarded-For.
     *
     * @param request The incoming HTTP request
     * @return Client IP address or null if not resolvable
     */
    private String getClientIp(ServerHttpRequest request) {
        for (String header : CLIENT_IP_HEADERS) {
            String value = request.getHeaders().getFirst(header);
            if (value != null && !value.isBlank()) {
                return value.split(",")[0].trim();
            }
        }

        InetSocketAddress remoteAddress = request.getRemoteAddress();
        if (remoteAddress == null) return null;
        return remoteAddress.getAddress() != null
                ? remoteAddress.getAddress().getHostAddress()
                : remoteAddress.getHostString();
    }

    /**
     * Ensures this filter runs before most other gateway filters.
     *
     * @return filter order priority
     */
    @Override
    public int getOrder() {
        return -1;
    }
}
