package com.bank.payout.gateway;

import com.bank.payout.exception.RiskDataUnavailableException;
import com.bank.payout.model.MerchantSignals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

@Component
public class HttpMerchantSignalProvider implements MerchantSignalProvider {

    private static final Logger log = LoggerFactory.getLogger(HttpMerchantSignalProvider.class);

    private final RestTemplate restTemplate;

    public HttpMerchantSignalProvider(@Qualifier("signalsRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public Optional<MerchantSignals> fetchSignals(String merchantId) {
        try {
            MerchantSignals signals = restTemplate.getForObject(
                    "/v1/merchants/{merchantId}/risk-signals", MerchantSignals.class, merchantId);
            return Optional.ofNullable(signals);
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("No merchant history for {}", merchantId);
            return Optional.empty();
        } catch (RestClientException e) {
            throw new RiskDataUnavailableException("Merchant signals unavailable for " + merchantId, e);
        }
    }

    @Override
    public List<String> listActiveMerchantIds() {
        try {
            String[] ids = restTemplate.getForObject("/v1/merchants?active=true", String[].class);
            return ids != null ? Arrays.asList(ids) : List.of();
        } catch (RestClientException e) {
            throw new RiskDataUnavailableException("Merchant directory unavailable", e);
        }
    }
}
