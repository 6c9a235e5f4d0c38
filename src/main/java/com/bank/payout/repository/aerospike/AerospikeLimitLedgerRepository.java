package com.bank.payout.repository.aerospike;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Operation;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.bank.payout.config.AerospikeConfig;
import com.bank.payout.model.LimitWindow;
import com.bank.payout.repository.LimitLedgerRepository;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "payout.storage", havingValue = "aerospike", matchIfMissing = true)
public class AerospikeLimitLedgerRepository implements LimitLedgerRepository {

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public AerospikeLimitLedgerRepository(AerospikeClient client,
                                          @Qualifier("aerospikeNamespace") String namespace,
                                          @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                          @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    @Override
    public long[] find(String merchantId, LimitWindow window, long at) {
        Key key = new Key(namespace, AerospikeConfig.SET_LIMIT_BUCKETS, window.bucketKey(merchantId, at));
        Record record = client.get(readPolicy, key, "inFlight", "executed");
        if (record == null) {
            return new long[]{0L, 0L};
        }
        return new long[]{record.getLong("inFlight"), record.getLong("executed")};
    }

    /**
     * Atomically add to both counters of the bucket, creating it on first use.
     * Key format: merchantId:D|W|M:yyyyMMdd
     */
    @Override
    public void add(String merchantId, LimitWindow window, long at, long inFlightDelta, long executedDelta) {
        Key key = new Key(namespace, AerospikeConfig.SET_LIMIT_BUCKETS, window.bucketKey(merchantId, at));
        client.operate(writePolicy, key,
                Operation.add(new Bin("inFlight", inFlightDelta)),
                Operation.add(new Bin("executed", executedDelta)),
                Operation.put(new Bin("merchantId", merchantId)),
                Operation.put(new Bin("windowStart", window.windowStartMillis(at))));
    }
}
