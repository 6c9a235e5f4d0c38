package com.bank.payout.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Separate RestTemplates per collaborator so treasury calls, which may block for a long
 * time, have their own timeouts.
 */
@Configuration
public class HttpClientConfig {

    private static final Logger log = LoggerFactory.getLogger(HttpClientConfig.class);

    @Bean
    public RestTemplate treasuryRestTemplate(RestTemplateBuilder builder, TreasuryGatewayConfig config) {
        log.info("Treasury client configured: baseUrl={}, connectTimeout={}ms, readTimeout={}ms",
                config.getBaseUrl(), config.getConnectTimeoutMs(), config.getReadTimeoutMs());
        return builder
                .rootUri(config.getBaseUrl())
                .setConnectTimeout(Duration.ofMillis(config.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(config.getReadTimeoutMs()))
                .additionalInterceptors(loggingInterceptor())
                .build();
    }

    @Bean
    public RestTemplate signalsRestTemplate(RestTemplateBuilder builder, MerchantSignalsConfig config) {
        return builder
                .rootUri(config.getBaseUrl())
                .setConnectTimeout(Duration.ofMillis(config.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(config.getReadTimeoutMs()))
                .additionalInterceptors(loggingInterceptor())
                .build();
    }

    private ClientHttpRequestInterceptor loggingInterceptor() {
        return (request, body, execution) -> {
            long start = System.currentTimeMillis();
            ClientHttpResponse response = execution.execute(request, body);
            log.debug("HTTP {} {} -> {} in {}ms", request.getMethod(), request.getURI(),
                    response.getStatusCode().value(), System.currentTimeMillis() - start);
            return response;
        };
    }
}
