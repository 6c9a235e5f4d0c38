package com.bank.payout.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "payout.signals")
public class MerchantSignalsConfig {

    // Base URL of the merchant/order platform that reports scoring signals.
    private String baseUrl = "http://localhost:8081";

    private int connectTimeoutMs = 2000;
    private int readTimeoutMs = 5000;
}
