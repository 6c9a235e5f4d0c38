package com.bank.payout.repository.memory;

import com.bank.payout.model.LimitWindow;
import com.bank.payout.repository.LimitLedgerRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Repository
@ConditionalOnProperty(name = "payout.storage", havingValue = "memory")
public class InMemoryLimitLedgerRepository implements LimitLedgerRepository {

    // bucketKey -> {inFlight, executed}
    private final Map<String, long[]> buckets = new ConcurrentHashMap<>();

    @Override
    public long[] find(String merchantId, LimitWindow window, long at) {
        long[] bucket = buckets.get(window.bucketKey(merchantId, at));
        if (bucket == null) return new long[]{0L, 0L};
        synchronized (bucket) {
            return bucket.clone();
        }
    }

    @Override
    public void add(String merchantId, LimitWindow window, long at, long inFlightDelta, long executedDelta) {
        buckets.compute(window.bucketKey(merchantId, at), (key, bucket) -> {
            long[] b = bucket != null ? bucket : new long[2];
            synchronized (b) {
                b[0] += inFlightDelta;
                b[1] += executedDelta;
            }
            return b;
        });
    }
}
