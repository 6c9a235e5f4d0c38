package com.bank.payout.contract;

import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Validates the published OpenAPI document so API consumers notice endpoint or schema drift.
 * Runs against the in-memory storage profile.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class OpenApiContractTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void openApiDocument_isAccessible() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotEmpty();
    }

    @Test
    void openApiDocument_containsAllEndpointPaths() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());
        Map<String, Object> paths = json.read("$.paths");

        // Payout endpoints
        assertThat(paths).containsKey("/api/v1/payouts");
        assertThat(paths).containsKey("/api/v1/payouts/metrics");
        assertThat(paths).containsKey("/api/v1/payouts/{id}");
        assertThat(paths).containsKey("/api/v1/payouts/{id}/approve");
        assertThat(paths).containsKey("/api/v1/payouts/{id}/reject");
        assertThat(paths).containsKey("/api/v1/payouts/{id}/cancel");
        assertThat(paths).containsKey("/api/v1/payouts/{id}/process");
        assertThat(paths).containsKey("/api/v1/payouts/batch");

        // Risk score endpoints
        assertThat(paths).containsKey("/api/v1/risk-scores");
        assertThat(paths).containsKey("/api/v1/risk-scores/{merchantId}");
        assertThat(paths).containsKey("/api/v1/risk-scores/bulk-update");
        assertThat(paths).containsKey("/api/v1/risk-scores/{merchantId}/recalculate");
        assertThat(paths).containsKey("/api/v1/risk-scores/recalculate");

        // Control endpoints
        assertThat(paths).containsKey("/api/v1/control/status");
        assertThat(paths).containsKey("/api/v1/control/health");
        assertThat(paths).containsKey("/api/v1/control/halt");
        assertThat(paths).containsKey("/api/v1/control/resume");

        // Audit and config
        assertThat(paths).containsKey("/api/v1/audit");
        assertThat(paths).containsKey("/api/v1/audit/export");
        assertThat(paths).containsKey("/api/v1/config/automation");
    }

    @Test
    void openApiDocument_containsCriticalSchemas() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());
        Map<String, Object> schemas = json.read("$.components.schemas");

        assertThat(schemas).containsKey("PayoutCandidate");
        assertThat(schemas).containsKey("PayoutRequest");
        assertThat(schemas).containsKey("MerchantRiskScore");
        assertThat(schemas).containsKey("RiskScoreOverride");
        assertThat(schemas).containsKey("BulkRiskUpdate");
        assertThat(schemas).containsKey("EmergencyHaltState");
    }

    @Test
    void openApiDocument_payoutSchemas_haveRequiredFields() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());

        Map<String, Object> candidateProps = json.read("$.components.schemas.PayoutCandidate.properties");
        assertThat(candidateProps).containsKey("merchantId");
        assertThat(candidateProps).containsKey("amount");
        assertThat(candidateProps).containsKey("destinationWallet");
        assertThat(candidateProps).containsKey("originalRequestId");

        Map<String, Object> requestProps = json.read("$.components.schemas.PayoutRequest.properties");
        assertThat(requestProps).containsKey("status");
        assertThat(requestProps).containsKey("automationDecision");
        assertThat(requestProps).containsKey("processingAttempts");
        assertThat(requestProps).containsKey("idempotencyKey");
        assertThat(requestProps).containsKey("transactionHash");
    }
}
