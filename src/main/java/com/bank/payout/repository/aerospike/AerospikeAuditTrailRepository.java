package com.bank.payout.repository.aerospike;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.CommitLevel;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.payout.config.AerospikeConfig;
import com.bank.payout.model.AuditEntry;
import com.bank.payout.model.AuditEventType;
import com.bank.payout.repository.AuditTrailRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

@Repository
@ConditionalOnProperty(name = "payout.storage", havingValue = "aerospike", matchIfMissing = true)
public class AerospikeAuditTrailRepository implements AuditTrailRepository {

    private static final Logger log = LoggerFactory.getLogger(AerospikeAuditTrailRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy appendPolicy;
    private final ObjectMapper objectMapper;

    public AerospikeAuditTrailRepository(AerospikeClient client,
                                         @Qualifier("aerospikeNamespace") String namespace,
                                         @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.appendPolicy = new WritePolicy(writePolicy);
        this.appendPolicy.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        this.appendPolicy.commitLevel = CommitLevel.COMMIT_ALL;
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public void append(AuditEntry entry) {
        Key key = new Key(namespace, AerospikeConfig.SET_AUDIT_LOG, entry.getId());
        client.put(appendPolicy, key,
                new Bin("id", entry.getId()),
                new Bin("eventType", entry.getEventType().name()),
                new Bin("entityType", entry.getEntityType()),
                new Bin("entityId", entry.getEntityId()),
                new Bin("performedBy", entry.getPerformedBy()),
                new Bin("details", serializeDetails(entry.getDetails())),
                new Bin("createdAt", entry.getCreatedAt()));
    }

    @Override
    public List<AuditEntry> scan(Predicate<AuditEntry> filter) {
        List<AuditEntry> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_AUDIT_LOG,
                (key, record) -> {
                    try {
                        AuditEntry entry = mapRecord(record);
                        if (filter.test(entry)) {
                            synchronized (results) {
                                results.add(entry);
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read audit record: {}", e.getMessage());
                    }
                });
        return results;
    }

    private AuditEntry mapRecord(Record record) {
        return AuditEntry.builder()
                .id(record.getString("id"))
                .eventType(AuditEventType.valueOf(record.getString("eventType")))
                .entityType(record.getString("entityType"))
                .entityId(record.getString("entityId"))
                .performedBy(record.getString("performedBy"))
                .details(deserializeDetails(record.getString("details")))
                .createdAt(record.getLong("createdAt"))
                .build();
    }

    private String serializeDetails(Map<String, Object> details) {
        try {
            return objectMapper.writeValueAsString(details != null ? details : Collections.emptyMap());
        } catch (Exception e) {
            throw new IllegalStateException("Failed to serialize audit details", e);
        }
    }

    private Map<String, Object> deserializeDetails(String json) {
        if (json == null || json.isEmpty()) return Collections.emptyMap();
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (Exception e) {
            log.error("Failed to deserialize audit details", e);
            return Collections.emptyMap();
        }
    }
}
