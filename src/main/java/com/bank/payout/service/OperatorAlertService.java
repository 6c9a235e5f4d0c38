package com.bank.payout.service;

import com.bank.payout.config.MetricsConfig;
import com.bank.payout.config.TwilioNotificationConfig;
import com.bank.payout.model.EmergencyHaltState;
import com.bank.payout.model.PayoutRequest;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Pages the treasury on-call over Twilio. Alerts never affect payout processing:
 * delivery failures are logged and counted only.
 */
@Service
public class OperatorAlertService {

    private static final Logger log = LoggerFactory.getLogger(OperatorAlertService.class);

    private final TwilioNotificationConfig config;
    private final MetricsConfig metricsConfig;
    private final Tracer tracer;

    public OperatorAlertService(TwilioNotificationConfig config, MetricsConfig metricsConfig, Tracer tracer) {
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.tracer = tracer;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Operator alerts initialized. Channel: {}", config.getChannel());
        } else {
            log.info("Operator alerts are DISABLED.");
        }
    }

    @Async("alertExecutor")
    @Observed(name = "notification.send", contextualName = "send-halt-alert")
    public void notifyEmergencyHalt(EmergencyHaltState state) {
        if (!config.isEnabled()) {
            return;
        }
        String body = haltBody(state);
        send(body, "halt");
    }

    @Async("alertExecutor")
    @Observed(name = "notification.send", contextualName = "send-failure-alert")
    public void notifyPayoutFailed(PayoutRequest request) {
        if (!config.isEnabled()) {
            return;
        }
        String body = failureBody(request);
        send(body, "payout=" + request.getId());
    }

    String haltBody(EmergencyHaltState state) {
        return String.format(
                "[PAYOUT HALT] All payout processing stopped\n" +
                "By: %s\n" +
                "Reason: %s",
                state.getChangedBy(), state.getReason()) + traceLine();
    }

    String failureBody(PayoutRequest request) {
        return String.format(
                "[PAYOUT FAILED] Payout needs attention\n" +
                "Merchant: %s\n" +
                "Payout ID: %s\n" +
                "Amount: %s %s\n" +
                "Attempts: %d/%d\n" +
                "Reason: %s",
                request.getMerchantId(),
                request.getId(),
                request.getAmount().toPlainString(), request.getCurrency(),
                request.getProcessingAttempts(), request.getMaxAttempts(),
                request.getFailureReason()) + traceLine();
    }

    private String traceLine() {
        Span span = tracer.currentSpan();
        if (span == null || span.context().traceId().isEmpty()) {
            return "";
        }
        return "\nTrace: " + span.context().traceId();
    }

    private void send(String body, String subject) {
        try {
            Message message = Message.creator(
                    new PhoneNumber(resolveNumber(config.getToNumber())),
                    new PhoneNumber(resolveNumber(config.getFromNumber())),
                    body
            ).create();

            metricsConfig.recordNotification(config.getChannel(), "success");
            log.info("Operator alert sent for {}, sid={}", subject, message.getSid());
        } catch (Exception e) {
            metricsConfig.recordNotification(config.getChannel(), "error");
            log.error("Failed to send operator alert for {}: {}", subject, e.getMessage(), e);
        }
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
