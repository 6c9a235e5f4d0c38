package com.bank.payout.gateway;

import com.bank.payout.model.MerchantSignals;

import java.util.List;
import java.util.Optional;

/**
 * Source of raw merchant history used for risk scoring.
 */
public interface MerchantSignalProvider {

    /**
     * @return empty when the merchant has no history yet
     * @throws com.bank.payout.exception.RiskDataUnavailableException when the source cannot be read
     */
    Optional<MerchantSignals> fetchSignals(String merchantId);

    /**
     * @throws com.bank.payout.exception.RiskDataUnavailableException when the source cannot be read
     */
    List<String> listActiveMerchantIds();
}
