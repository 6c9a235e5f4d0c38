package com.bank.payout.repository.aerospike;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import com.bank.payout.config.AerospikeConfig;
import com.bank.payout.model.LeaseScope;
import com.bank.payout.repository.MerchantLeaseRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

/**
 * Leases are CREATE_ONLY records with a TTL: the server expires a lease whose owner died.
 */
@Repository
@ConditionalOnProperty(name = "payout.storage", havingValue = "aerospike", matchIfMissing = true)
public class AerospikeMerchantLeaseRepository implements MerchantLeaseRepository {

    private static final Logger log = LoggerFactory.getLogger(AerospikeMerchantLeaseRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public AerospikeMerchantLeaseRepository(AerospikeClient client,
                                            @Qualifier("aerospikeNamespace") String namespace,
                                            @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                            @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    @Override
    public boolean tryAcquire(LeaseScope scope, String merchantId, String owner, int ttlSeconds) {
        WritePolicy createOnly = new WritePolicy(writePolicy);
        createOnly.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        createOnly.expiration = ttlSeconds;
        try {
            client.put(createOnly, key(scope, merchantId),
                    new Bin("owner", owner),
                    new Bin("acquiredAt", System.currentTimeMillis()));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                return false;
            }
            throw e;
        }
    }

    @Override
    public void release(LeaseScope scope, String merchantId, String owner) {
        Key key = key(scope, merchantId);
        Record record = client.get(readPolicy, key, "owner");
        if (record == null || !owner.equals(record.getString("owner"))) {
            log.debug("Lease {}:{} no longer held by {}", scope, merchantId, owner);
            return;
        }
        WritePolicy guarded = new WritePolicy(writePolicy);
        guarded.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
        guarded.generation = record.generation;
        try {
            client.delete(guarded, key);
        } catch (AerospikeException e) {
            if (e.getResultCode() != ResultCode.GENERATION_ERROR) {
                throw e;
            }
            log.debug("Lease {}:{} changed hands before release", scope, merchantId);
        }
    }

    private Key key(LeaseScope scope, String merchantId) {
        return new Key(namespace, AerospikeConfig.SET_MERCHANT_LEASES, scope.name() + ":" + merchantId);
    }
}
