package com.bank.payout.repository.memory;

import com.bank.payout.model.AuditEntry;
import com.bank.payout.repository.AuditTrailRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

@Repository
@ConditionalOnProperty(name = "payout.storage", havingValue = "memory")
public class InMemoryAuditTrailRepository implements AuditTrailRepository {

    private final Map<String, AuditEntry> entries = new ConcurrentHashMap<>();

    @Override
    public void append(AuditEntry entry) {
        if (entries.putIfAbsent(entry.getId(), entry) != null) {
            throw new IllegalStateException("Audit entry already exists: " + entry.getId());
        }
    }

    @Override
    public List<AuditEntry> scan(Predicate<AuditEntry> filter) {
        return entries.values().stream().filter(filter).toList();
    }
}
