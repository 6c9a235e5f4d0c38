package com.bank.payout.repository.aerospike;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.payout.config.AerospikeConfig;
import com.bank.payout.model.EmergencyHaltState;
import com.bank.payout.repository.SystemControlRepository;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "payout.storage", havingValue = "aerospike", matchIfMissing = true)
public class AerospikeSystemControlRepository implements SystemControlRepository {

    private static final String HALT_KEY = "emergency_halt";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public AerospikeSystemControlRepository(AerospikeClient client,
                                            @Qualifier("aerospikeNamespace") String namespace,
                                            @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                            @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    @Override
    public EmergencyHaltState getHaltState() {
        Record record = client.get(readPolicy, new Key(namespace, AerospikeConfig.SET_SYSTEM_CONTROL, HALT_KEY));
        if (record == null) {
            return EmergencyHaltState.running();
        }
        return EmergencyHaltState.builder()
                .halted(record.getBoolean("halted"))
                .reason(record.getString("reason"))
                .changedBy(record.getString("changedBy"))
                .changedAt(record.getLong("changedAt"))
                .build();
    }

    @Override
    public void saveHaltState(EmergencyHaltState state) {
        client.put(writePolicy, new Key(namespace, AerospikeConfig.SET_SYSTEM_CONTROL, HALT_KEY),
                new Bin("halted", state.isHalted()),
                new Bin("reason", state.getReason()),
                new Bin("changedBy", state.getChangedBy()),
                new Bin("changedAt", state.getChangedAt()));
    }
}
