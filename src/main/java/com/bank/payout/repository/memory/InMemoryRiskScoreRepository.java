package com.bank.payout.repository.memory;

import com.bank.payout.model.MerchantRiskScore;
import com.bank.payout.repository.RiskScoreRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
@ConditionalOnProperty(name = "payout.storage", havingValue = "memory")
public class InMemoryRiskScoreRepository implements RiskScoreRepository {

    private final Map<String, MerchantRiskScore> scores = new ConcurrentHashMap<>();

    @Override
    public Optional<MerchantRiskScore> findByMerchantId(String merchantId) {
        MerchantRiskScore score = scores.get(merchantId);
        return Optional.ofNullable(score).map(s -> s.toBuilder().build());
    }

    @Override
    public List<MerchantRiskScore> findAll() {
        List<MerchantRiskScore> all = new ArrayList<>();
        scores.values().forEach(s -> all.add(s.toBuilder().build()));
        return all;
    }

    @Override
    public void save(MerchantRiskScore score) {
        scores.put(score.getMerchantId(), score.toBuilder().build());
    }
}
