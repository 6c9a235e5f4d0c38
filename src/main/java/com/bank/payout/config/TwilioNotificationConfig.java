package com.bank.payout.config;

import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "twilio")
public class TwilioNotificationConfig {

    private String accountSid;

    @ToString.Exclude
    private String authToken;

    private String fromNumber;

    // Treasury operations on-call number.
    private String toNumber;

    private boolean enabled = false;
    private String channel = "sms";  // "sms" or "whatsapp"
}
