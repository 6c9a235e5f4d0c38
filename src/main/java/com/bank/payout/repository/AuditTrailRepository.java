package com.bank.payout.repository;

import com.bank.payout.model.AuditEntry;

import java.util.List;
import java.util.function.Predicate;

/**
 * Append-only audit store. Entries are never updated or deleted.
 */
public interface AuditTrailRepository {

    /**
     * Durably write an entry. Throws if the write is not acknowledged or the id exists.
     */
    void append(AuditEntry entry);

    List<AuditEntry> scan(Predicate<AuditEntry> filter);
}
