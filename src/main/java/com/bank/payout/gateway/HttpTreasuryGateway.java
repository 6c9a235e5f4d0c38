package com.bank.payout.gateway;

import com.bank.payout.config.TreasuryGatewayConfig;
import com.bank.payout.exception.PayoutException;
import com.bank.payout.exception.PermanentGatewayException;
import com.bank.payout.exception.TransientGatewayException;
import com.bank.payout.exception.TreasuryHaltedException;
import com.bank.payout.model.TreasuryTransferRequest;
import com.bank.payout.model.TreasuryTransferResult;
import com.bank.payout.support.SingleFlight;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * REST client for the treasury. Maps treasury responses onto the transient/permanent/halted
 * failure taxonomy and keeps one shared session token per process.
 */
@Component
public class HttpTreasuryGateway implements TreasuryGateway {

    private static final Logger log = LoggerFactory.getLogger(HttpTreasuryGateway.class);

    static final String HALT_CODE = "EMERGENCY_HALT";
    static final Set<String> PERMANENT_CODES = Set.of("INVALID_ADDRESS", "UNSUPPORTED_NETWORK", "COMPLIANCE_BLOCK");

    record TransferResponse(boolean success, String treasuryTransactionId, String transactionHash,
                            String errorCode, String message) {}

    record SessionResponse(String token, long expiresInSeconds) {}

    static class SessionRateLimitedException extends TransientGatewayException {
        SessionRateLimitedException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    private final RestTemplate restTemplate;
    private final TreasuryGatewayConfig config;
    private final Tracer tracer;
    private final Clock clock;
    private final SingleFlight<String> sessionToken;
    private final ObjectMapper errorMapper;

    public HttpTreasuryGateway(@Qualifier("treasuryRestTemplate") RestTemplate restTemplate,
                               TreasuryGatewayConfig config,
                               Tracer tracer,
                               Clock clock) {
        this.restTemplate = restTemplate;
        this.config = config;
        this.tracer = tracer;
        this.clock = clock;
        this.sessionToken = new SingleFlight<>("treasury-session", clock::millis,
                e -> e instanceof SessionRateLimitedException, config.getCredentialRateLimitCooldownMs());
        this.errorMapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public TreasuryTransferResult execute(TreasuryTransferRequest request) {
        Span span = tracer.nextSpan()
                .name("treasury.transfer")
                .tag("merchant.id", request.merchantId())
                .tag("network", request.destinationNetwork().name())
                .start();

        try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
            String token = sessionToken.get(this::openSession);

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            headers.setBearerAuth(token);
            headers.set("Idempotency-Key", request.idempotencyKey());

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("merchantId", request.merchantId());
            body.put("amount", request.amount().toPlainString());
            body.put("currency", request.currency());
            body.put("destinationWallet", request.destinationWallet());
            body.put("destinationNetwork", request.destinationNetwork().name());
            body.put("idempotencyKey", request.idempotencyKey());

            ResponseEntity<TransferResponse> response = restTemplate.exchange(
                    "/v1/transfers", HttpMethod.POST, new HttpEntity<>(body, headers), TransferResponse.class);

            TreasuryTransferResult result = interpret(response.getBody());
            span.tag("treasury.tx_id", result.treasuryTransactionId());
            return result;
        } catch (HttpStatusCodeException e) {
            PayoutException mapped = classify(e);
            span.error(mapped);
            throw mapped;
        } catch (PayoutException e) {
            span.error(e);
            throw e;
        } catch (RestClientException e) {
            span.error(e);
            throw new TransientGatewayException("Treasury unreachable: " + e.getMessage(), e);
        } finally {
            span.end();
        }
    }

    TreasuryTransferResult interpret(TransferResponse body) {
        if (body == null) {
            throw new TransientGatewayException("Treasury returned an empty response");
        }
        if (body.success() && body.treasuryTransactionId() != null && body.transactionHash() != null) {
            return new TreasuryTransferResult(body.treasuryTransactionId(), body.transactionHash());
        }
        return throwForCode(body.errorCode(), body.message());
    }

    private PayoutException classify(HttpStatusCodeException e) {
        int status = e.getStatusCode().value();
        TransferResponse error = parseError(e.getResponseBodyAsString());
        String code = error != null ? error.errorCode() : null;
        String message = error != null && error.message() != null ? error.message() : e.getStatusText();

        if (status == 423 || HALT_CODE.equals(code)) {
            return new TreasuryHaltedException("Treasury halted: " + message);
        }
        if (code != null && PERMANENT_CODES.contains(code)) {
            return new PermanentGatewayException(code + ": " + message);
        }
        if (status == 401) {
            sessionToken.invalidate();
            return new TransientGatewayException("Treasury session rejected, re-authenticating");
        }
        if (status == 400 || status == 404 || status == 409 || status == 422) {
            return new PermanentGatewayException("Treasury rejected transfer (" + status + "): " + message);
        }
        return new TransientGatewayException("Treasury error (" + status + "): " + message, e);
    }

    private TreasuryTransferResult throwForCode(String code, String message) {
        if (HALT_CODE.equals(code)) {
            throw new TreasuryHaltedException("Treasury halted: " + message);
        }
        if (code != null && PERMANENT_CODES.contains(code)) {
            throw new PermanentGatewayException(code + ": " + message);
        }
        throw new TransientGatewayException("Treasury did not confirm transfer: "
                + (code != null ? code : "UNKNOWN") + (message != null ? " " + message : ""));
    }

    private TransferResponse parseError(String body) {
        if (body == null || body.isBlank()) return null;
        try {
            return errorMapper.readValue(body, TransferResponse.class);
        } catch (Exception e) {
            log.debug("Unparseable treasury error body: {}", e.getMessage());
            return null;
        }
    }

    private SingleFlight.Fetched<String> openSession() {
        Map<String, String> credentials = Map.of(
                "clientId", config.getClientId(),
                "clientSecret", config.getClientSecret());
        try {
            SessionResponse session = restTemplate.postForObject("/v1/sessions", credentials, SessionResponse.class);
            if (session == null || session.token() == null) {
                throw new TransientGatewayException("Treasury returned no session token");
            }
            long ttlMs = Math.max(0, session.expiresInSeconds() * 1000 - config.getSessionRefreshSkewMs());
            log.info("Treasury session acquired, valid for {}s", ttlMs / 1000);
            return new SingleFlight.Fetched<>(session.token(), clock.millis() + ttlMs);
        } catch (HttpClientErrorException.TooManyRequests e) {
            throw new SessionRateLimitedException("Treasury session acquisition rate limited", e);
        } catch (HttpClientErrorException.Unauthorized e) {
            log.error("Treasury rejected client credentials for clientId={}", config.getClientId());
            throw new TransientGatewayException("Treasury rejected client credentials", e);
        } catch (RestClientException e) {
            throw new TransientGatewayException("Treasury session endpoint unreachable: " + e.getMessage(), e);
        }
    }
}
