package com.bank.payout.gateway;

import com.bank.payout.engine.RiskFactorCalculator;
import com.bank.payout.exception.RiskDataUnavailableException;
import com.bank.payout.model.MerchantSignals;
import com.bank.payout.model.VerificationTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.Optional;

import static com.bank.payout.testutil.TestDataFactory.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpMerchantSignalProviderTest {

    private static final String BASE = "http://merchants.test";

    private MockRestServiceServer server;
    private HttpMerchantSignalProvider provider;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplateBuilder().rootUri(BASE).build();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        provider = new HttpMerchantSignalProvider(restTemplate);
    }

    @Test
    void fetchSignals_withoutCreationTime_leavesItUnknown() {
        server.expect(requestTo(BASE + "/v1/merchants/M-1/risk-signals"))
                .andRespond(withSuccess("{\"merchantId\":\"M-1\",\"totalOrders\":500,\"totalRevenue\":120000,"
                        + "\"verificationTier\":\"ENHANCED\",\"recentOrders\":80}", MediaType.APPLICATION_JSON));

        MerchantSignals signals = provider.fetchSignals("M-1").orElseThrow();

        assertThat(signals.getAccountCreatedAt()).isNull();
        assertThat(signals.getVerificationTier()).isEqualTo(VerificationTier.ENHANCED);
        assertThat(new RiskFactorCalculator().score(signals, NOW).getAccountAgeScore()).isEqualTo(0.0);
        server.verify();
    }

    @Test
    void fetchSignals_unknownMerchant_isEmpty() {
        server.expect(requestTo(BASE + "/v1/merchants/M-404/risk-signals"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        Optional<MerchantSignals> signals = provider.fetchSignals("M-404");

        assertThat(signals).isEmpty();
    }

    @Test
    void fetchSignals_platformError_failsClosed() {
        server.expect(requestTo(BASE + "/v1/merchants/M-1/risk-signals"))
                .andRespond(withStatus(HttpStatus.BAD_GATEWAY));

        assertThatThrownBy(() -> provider.fetchSignals("M-1"))
                .isInstanceOf(RiskDataUnavailableException.class)
                .hasMessage("Merchant signals unavailable for M-1");
    }
}
