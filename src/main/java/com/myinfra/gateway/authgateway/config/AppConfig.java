package com.myinfra.gateway.authgateway.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "app")
@Validated
public class AppConfig {

    @Valid
    @NotNull
    private SecurityConfig security = new SecurityConfig();

    @Valid
    private SearchConfig search = new SearchConfig();

    @Data
    public static class SecurityConfig {
        /**
         * Domain every bearer token subject must carry after the {@code @}.
         */
        @NotBlank
        private String issuerDomain;

        private String jwtSecret;
        private String jwtPublicKey;

        /**
         * Ant-style paths forwarded without identity when authentication fails.
         */
        private List<String> publicPaths = new ArrayList<>();
    }

    @Data
    public static class SearchConfig {
        /**
         * Base URL of the search backend. Blank disables indexing.
         */
        private String node;

        private String username;
        private String password;

        @Valid
        private AwsConfig aws = new AwsConfig();

        private Duration connectTimeout = Duration.ofSeconds(3);
        private Duration responseTimeout = Duration.ofSeconds(5);

        @Min(0)
        private int retries = 3;

        private Duration retryWait = Duration.ofSeconds(1);

        /**
         * Records allowed to wait for the index writer before new ones are dropped.
         */
        @Min(1)
        private int queueCapacity = 10_000;

        private String accessLogIndex = "gateway-access-logs";

        private int retentionDays = 90;
        private String retentionCron = "0 0 3 * * *";
    }

    /**
     * Credentials for an AWS-hosted search domain. When set, requests are SigV4-signed
     * instead of using basic auth.
     */
    @Data
    public static class AwsConfig {
        private String accessKeyId;
        private String secretAccessKey;
        private String region;

        public boolean isConfigured() {
            return accessKeyId != null && !accessKeyId.isBlank()
                    && secretAccessKey != null && !secretAccessKey.isBlank()
                    && region != null && !region.isBlank();
        }
    }
}
