package com.bank.payout.repository.aerospike;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.exp.Exp;
import com.aerospike.client.exp.Expression;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.QueryPolicy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.aerospike.client.query.Filter;
import com.aerospike.client.query.IndexType;
import com.aerospike.client.query.RecordSet;
import com.aerospike.client.query.Statement;
import com.aerospike.client.task.IndexTask;
import com.bank.payout.config.AerospikeConfig;
import com.bank.payout.model.AutomationLevel;
import com.bank.payout.model.DecisionOutcome;
import com.bank.payout.model.DestinationNetwork;
import com.bank.payout.model.PayoutPriority;
import com.bank.payout.model.PayoutRequest;
import com.bank.payout.model.PayoutStatus;
import com.bank.payout.model.ScheduleType;
import com.bank.payout.repository.PayoutRequestRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

@Repository
@ConditionalOnProperty(name = "payout.storage", havingValue = "aerospike", matchIfMissing = true)
public class AerospikePayoutRequestRepository implements PayoutRequestRepository {

    private static final Logger log = LoggerFactory.getLogger(AerospikePayoutRequestRepository.class);

    static final String STATUS_INDEX = "payout_requests_status_idx";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public AerospikePayoutRequestRepository(AerospikeClient client,
                                            @Qualifier("aerospikeNamespace") String namespace,
                                            @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                            @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public void create(PayoutRequest request) {
        WritePolicy createOnly = new WritePolicy(writePolicy);
        createOnly.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        try {
            client.put(createOnly, key(request.getId()), toBins(request));
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                throw new IllegalStateException("Payout request already exists: " + request.getId(), e);
            }
            throw e;
        }
        request.setVersion(1);
    }

    @Override
    public Optional<PayoutRequest> findById(String id) {
        Record record = client.get(readPolicy, key(id));
        if (record == null) {
            return Optional.empty();
        }
        return Optional.of(mapRecord(record));
    }

    @Override
    public List<PayoutRequest> scan(Predicate<PayoutRequest> filter) {
        List<PayoutRequest> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_PAYOUT_REQUESTS,
                (key, record) -> {
                    try {
                        PayoutRequest request = mapRecord(record);
                        if (filter.test(request)) {
                            synchronized (results) {
                                results.add(request);
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read payout request record: {}", e.getMessage());
                    }
                });
        return results;
    }

    /**
     * Dispatch and recovery read requests by status, so status carries a secondary index.
     */
    @PostConstruct
    public void ensureStatusIndex() {
        try {
            IndexTask task = client.createIndex(null, namespace, AerospikeConfig.SET_PAYOUT_REQUESTS,
                    STATUS_INDEX, "status", IndexType.STRING);
            task.waitTillComplete();
            log.info("Created secondary index {} on {}.{}", STATUS_INDEX, namespace, AerospikeConfig.SET_PAYOUT_REQUESTS);
        } catch (AerospikeException e) {
            if (e.getResultCode() != ResultCode.INDEX_ALREADY_EXISTS) {
                throw e;
            }
            log.debug("Secondary index {} already exists", STATUS_INDEX);
        }
    }

    @Override
    public List<PayoutRequest> findByStatus(PayoutStatus status) {
        return queryByStatus(status, null);
    }

    @Override
    public List<PayoutRequest> findEligible(long now) {
        return queryByStatus(PayoutStatus.PENDING, Exp.build(due(now))).stream()
                .filter(r -> r.isEligibleAt(now))
                .toList();
    }

    @Override
    public List<PayoutRequest> findEligible(String merchantId, long now) {
        Expression filter = Exp.build(Exp.and(
                Exp.eq(Exp.stringBin("merchantId"), Exp.val(merchantId)),
                due(now)));
        return queryByStatus(PayoutStatus.PENDING, filter).stream()
                .filter(r -> r.isEligibleAt(now))
                .toList();
    }

    private static Exp due(long now) {
        return Exp.and(
                Exp.le(Exp.intBin("scheduledFor"), Exp.val(now)),
                Exp.le(Exp.intBin("nextAttemptAt"), Exp.val(now)));
    }

    private List<PayoutRequest> queryByStatus(PayoutStatus status, Expression filter) {
        Statement statement = new Statement();
        statement.setNamespace(namespace);
        statement.setSetName(AerospikeConfig.SET_PAYOUT_REQUESTS);
        statement.setFilter(Filter.equal("status", status.name()));

        QueryPolicy queryPolicy = new QueryPolicy();
        queryPolicy.filterExp = filter;

        List<PayoutRequest> results = new ArrayList<>();
        try (RecordSet records = client.query(queryPolicy, statement)) {
            while (records.next()) {
                try {
                    results.add(mapRecord(records.getRecord()));
                } catch (Exception e) {
                    log.warn("Failed to read payout request record: {}", e.getMessage());
                }
            }
        }
        return results;
    }

    @Override
    public boolean compareAndSet(PayoutRequest request) {
        WritePolicy cas = new WritePolicy(writePolicy);
        cas.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
        cas.generation = request.getVersion();
        cas.recordExistsAction = RecordExistsAction.UPDATE_ONLY;
        try {
            client.put(cas, key(request.getId()), toBins(request));
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.GENERATION_ERROR
                    || e.getResultCode() == ResultCode.KEY_NOT_FOUND_ERROR) {
                log.debug("CAS lost for payout {} at version {}", request.getId(), request.getVersion());
                return false;
            }
            throw e;
        }
        request.setVersion(request.getVersion() + 1);
        return true;
    }

    @Override
    public Optional<String> bindIdempotencyKey(String idempotencyKey, String requestId) {
        Key key = new Key(namespace, AerospikeConfig.SET_IDEMPOTENCY_KEYS, idempotencyKey);
        WritePolicy createOnly = new WritePolicy(writePolicy);
        createOnly.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        try {
            client.put(createOnly, key, new Bin("requestId", requestId));
            return Optional.empty();
        } catch (AerospikeException e) {
            if (e.getResultCode() != ResultCode.KEY_EXISTS_ERROR) {
                throw e;
            }
        }
        Record existing = client.get(readPolicy, key);
        return Optional.ofNullable(existing).map(r -> r.getString("requestId"));
    }

    private Key key(String id) {
        return new Key(namespace, AerospikeConfig.SET_PAYOUT_REQUESTS, id);
    }

    private Bin[] toBins(PayoutRequest r) {
        return new Bin[]{
                new Bin("id", r.getId()),
                new Bin("merchantId", r.getMerchantId()),
                new Bin("amount", r.getAmount().toPlainString()),
                new Bin("currency", r.getCurrency()),
                new Bin("destWallet", r.getDestinationWallet()),
                new Bin("destNetwork", r.getDestinationNetwork().name()),
                new Bin("scheduleType", r.getScheduleType().name()),
                new Bin("scheduledFor", r.getScheduledFor()),
                new Bin("priority", r.getPriority().name()),
                new Bin("status", r.getStatus().name()),
                new Bin("riskAtDecision", r.getRiskScoreAtDecision()),
                new Bin("levelAtDecision", r.getAutomationLevelAtDecision().name()),
                new Bin("decision", r.getAutomationDecision().name()),
                new Bin("reasons", serialize(r.getDecisionReasons() != null ? r.getDecisionReasons() : List.of())),
                new Bin("approved", r.isApproved()),
                new Bin("reviewedBy", r.getReviewedBy()),
                new Bin("reviewedAt", orZero(r.getReviewedAt())),
                new Bin("attempts", r.getProcessingAttempts()),
                new Bin("maxAttempts", r.getMaxAttempts()),
                new Bin("lastAttemptAt", orZero(r.getLastAttemptAt())),
                new Bin("nextAttemptAt", r.getNextAttemptAt()),
                new Bin("procStartedAt", orZero(r.getProcessingStartedAt())),
                new Bin("claimedBy", r.getClaimedBy()),
                new Bin("executedAt", orZero(r.getExecutedAt())),
                new Bin("txHash", r.getTransactionHash()),
                new Bin("treasuryTxId", r.getTreasuryTransactionId()),
                new Bin("failureReason", r.getFailureReason()),
                new Bin("idemKey", r.getIdempotencyKey()),
                new Bin("origRequestId", r.getOriginalRequestId()),
                new Bin("reservedAt", orZero(r.getReservedAt())),
                new Bin("metadata", serialize(r.getMetadata() != null ? r.getMetadata() : Map.of())),
                new Bin("createdAt", r.getCreatedAt()),
                new Bin("updatedAt", r.getUpdatedAt())
        };
    }

    private PayoutRequest mapRecord(Record record) {
        return PayoutRequest.builder()
                .id(record.getString("id"))
                .merchantId(record.getString("merchantId"))
                .amount(new BigDecimal(record.getString("amount")))
                .currency(record.getString("currency"))
                .destinationWallet(record.getString("destWallet"))
                .destinationNetwork(DestinationNetwork.valueOf(record.getString("destNetwork")))
                .scheduleType(ScheduleType.valueOf(record.getString("scheduleType")))
                .scheduledFor(record.getLong("scheduledFor"))
                .priority(PayoutPriority.valueOf(record.getString("priority")))
                .status(PayoutStatus.valueOf(record.getString("status")))
                .riskScoreAtDecision(record.getDouble("riskAtDecision"))
                .automationLevelAtDecision(AutomationLevel.valueOf(record.getString("levelAtDecision")))
                .automationDecision(DecisionOutcome.valueOf(record.getString("decision")))
                .decisionReasons(deserializeList(record.getString("reasons")))
                .approved(record.getBoolean("approved"))
                .reviewedBy(record.getString("reviewedBy"))
                .reviewedAt(orNull(record.getLong("reviewedAt")))
                .processingAttempts(record.getInt("attempts"))
                .maxAttempts(record.getInt("maxAttempts"))
                .lastAttemptAt(orNull(record.getLong("lastAttemptAt")))
                .nextAttemptAt(record.getLong("nextAttemptAt"))
                .processingStartedAt(orNull(record.getLong("procStartedAt")))
                .claimedBy(record.getString("claimedBy"))
                .executedAt(orNull(record.getLong("executedAt")))
                .transactionHash(record.getString("txHash"))
                .treasuryTransactionId(record.getString("treasuryTxId"))
                .failureReason(record.getString("failureReason"))
                .idempotencyKey(record.getString("idemKey"))
                .originalRequestId(record.getString("origRequestId"))
                .reservedAt(orNull(record.getLong("reservedAt")))
                .metadata(deserializeMap(record.getString("metadata")))
                .createdAt(record.getLong("createdAt"))
                .updatedAt(record.getLong("updatedAt"))
                .version(record.generation)
                .build();
    }

    private static long orZero(Long value) {
        return value != null ? value : 0L;
    }

    private static Long orNull(long value) {
        return value != 0L ? value : null;
    }

    private String serialize(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to serialize payout request field", e);
        }
    }

    private List<String> deserializeList(String json) {
        if (json == null || json.isEmpty()) return Collections.emptyList();
        try {
            return objectMapper.readValue(json, new TypeReference<List<String>>() {});
        } catch (Exception e) {
            log.error("Failed to deserialize decision reasons", e);
            return Collections.emptyList();
        }
    }

    private Map<String, String> deserializeMap(String json) {
        if (json == null || json.isEmpty()) return Collections.emptyMap();
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, String>>() {});
        } catch (Exception e) {
            log.error("Failed to deserialize payout metadata", e);
            return Collections.emptyMap();
        }
    }
}
