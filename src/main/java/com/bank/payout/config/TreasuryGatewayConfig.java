package com.bank.payout.config;

import com.bank.payout.exception.ConfigurationException;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "payout.treasury")
public class TreasuryGatewayConfig {

    private String baseUrl;
    private String clientId;

    @ToString.Exclude
    private String clientSecret;

    private int connectTimeoutMs = 5000;
    private int readTimeoutMs = 30000;

    // After a 429 on session acquisition, callers fail fast for this long.
    private long credentialRateLimitCooldownMs = 300_000;

    // Session tokens are refreshed this long before they expire.
    private long sessionRefreshSkewMs = 30_000;

    @PostConstruct
    public void validate() {
        if (isBlank(baseUrl)) {
            throw new ConfigurationException("payout.treasury.base-url must be set");
        }
        if (isBlank(clientId) || isBlank(clientSecret)) {
            throw new ConfigurationException("payout.treasury.client-id and payout.treasury.client-secret must be set");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
