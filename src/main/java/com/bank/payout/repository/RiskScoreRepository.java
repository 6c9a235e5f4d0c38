package com.bank.payout.repository;

import com.bank.payout.model.MerchantRiskScore;

import java.util.List;
import java.util.Optional;

/**
 * Merchant risk score store. Writes are whole-record and last-writer-wins per merchant,
 * so a reader never observes a partially updated score.
 */
public interface RiskScoreRepository {

    Optional<MerchantRiskScore> findByMerchantId(String merchantId);

    List<MerchantRiskScore> findAll();

    void save(MerchantRiskScore score);
}
