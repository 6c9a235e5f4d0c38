package com.bank.payout.repository.aerospike;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.payout.config.AerospikeConfig;
import com.bank.payout.model.AutomationLevel;
import com.bank.payout.model.MerchantRiskScore;
import com.bank.payout.repository.RiskScoreRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Repository
@ConditionalOnProperty(name = "payout.storage", havingValue = "aerospike", matchIfMissing = true)
public class AerospikeRiskScoreRepository implements RiskScoreRepository {

    private static final Logger log = LoggerFactory.getLogger(AerospikeRiskScoreRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public AerospikeRiskScoreRepository(AerospikeClient client,
                                        @Qualifier("aerospikeNamespace") String namespace,
                                        @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                        @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    @Override
    public Optional<MerchantRiskScore> findByMerchantId(String merchantId) {
        Key key = new Key(namespace, AerospikeConfig.SET_RISK_SCORES, merchantId);
        Record record = client.get(readPolicy, key);
        if (record == null) {
            return Optional.empty();
        }
        return Optional.of(mapRecord(record));
    }

    @Override
    public List<MerchantRiskScore> findAll() {
        List<MerchantRiskScore> scores = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_RISK_SCORES,
                (key, record) -> {
                    try {
                        MerchantRiskScore score = mapRecord(record);
                        synchronized (scores) {
                            scores.add(score);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read risk score record: {}", e.getMessage());
                    }
                });
        return scores;
    }

    @Override
    public void save(MerchantRiskScore score) {
        Key key = new Key(namespace, AerospikeConfig.SET_RISK_SCORES, score.getMerchantId());

        client.put(writePolicy, key,
                new Bin("merchantId", score.getMerchantId()),
                new Bin("txHistory", score.getTransactionHistoryScore()),
                new Bin("chargeback", score.getChargebackRateScore()),
                new Bin("accountAge", score.getAccountAgeScore()),
                new Bin("verification", score.getVerificationLevelScore()),
                new Bin("recentAct", score.getRecentActivityScore()),
                new Bin("overall", score.getOverallScore()),
                new Bin("level", score.getAutomationLevel().name()),
                new Bin("dailyLimit", score.getDailyLimit().toPlainString()),
                new Bin("weeklyLimit", score.getWeeklyLimit().toPlainString()),
                new Bin("monthlyLimit", score.getMonthlyLimit().toPlainString()),
                new Bin("singleLimit", score.getSingleTransactionLimit().toPlainString()),
                new Bin("approvalAbove", score.getRequiresApprovalAbove().toPlainString()),
                new Bin("payoutsHalted", score.isPayoutsHalted()),
                new Bin("levelOverride", score.isLevelOverridden()),
                new Bin("failClosed", score.isFailClosed()),
                new Bin("active", score.isActive()),
                new Bin("createdAt", score.getCreatedAt()),
                new Bin("lastUpdated", score.getLastUpdated()),
                new Bin("updatedBy", score.getUpdatedBy()));
    }

    private MerchantRiskScore mapRecord(Record record) {
        return MerchantRiskScore.builder()
                .merchantId(record.getString("merchantId"))
                .transactionHistoryScore(record.getDouble("txHistory"))
                .chargebackRateScore(record.getDouble("chargeback"))
                .accountAgeScore(record.getDouble("accountAge"))
                .verificationLevelScore(record.getDouble("verification"))
                .recentActivityScore(record.getDouble("recentAct"))
                .overallScore(record.getDouble("overall"))
                .automationLevel(AutomationLevel.valueOf(record.getString("level")))
                .dailyLimit(new BigDecimal(record.getString("dailyLimit")))
                .weeklyLimit(new BigDecimal(record.getString("weeklyLimit")))
                .monthlyLimit(new BigDecimal(record.getString("monthlyLimit")))
                .singleTransactionLimit(new BigDecimal(record.getString("singleLimit")))
                .requiresApprovalAbove(new BigDecimal(record.getString("approvalAbove")))
                .payoutsHalted(record.getBoolean("payoutsHalted"))
                .levelOverridden(record.getBoolean("levelOverride"))
                .failClosed(record.getBoolean("failClosed"))
                .active(record.getBoolean("active"))
                .createdAt(record.getLong("createdAt"))
                .lastUpdated(record.getLong("lastUpdated"))
                .updatedBy(record.getString("updatedBy"))
                .build();
    }
}
