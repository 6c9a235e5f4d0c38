package com.bank.payout.service;

import com.bank.payout.model.AuditEntry;
import com.bank.payout.model.AuditEventType;
import com.bank.payout.model.PagedResponse;
import com.bank.payout.repository.AuditTrailRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Writer;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Append-only journal of every decision and mutation.
 *
 * {@link #record} returns only once the entry is durably stored; callers treat an
 * exception from it as "the triggering transition did not happen".
 */
@Service
public class AuditTrailService {

    private static final Logger log = LoggerFactory.getLogger(AuditTrailService.class);

    static final Comparator<AuditEntry> NEWEST_FIRST = Comparator
            .comparingLong(AuditEntry::getCreatedAt)
            .thenComparing(AuditEntry::getId)
            .reversed();

    private final AuditTrailRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public AuditTrailService(AuditTrailRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public AuditEntry record(AuditEventType eventType, String entityType, String entityId,
                             String performedBy, Map<String, Object> details) {
        AuditEntry entry = AuditEntry.builder()
                .id(UUID.randomUUID().toString())
                .eventType(eventType)
                .entityType(entityType)
                .entityId(entityId)
                .performedBy(performedBy)
                .details(details != null ? new LinkedHashMap<>(details) : Map.of())
                .createdAt(clock.millis())
                .build();

        repository.append(entry);
        log.debug("Audit {} {}:{} by {}", eventType, entityType, entityId, performedBy);
        return entry;
    }

    /**
     * Filtered query, newest first. The cursor is {@code createdAt:id} of the last entry of the previous page.
     */
    public PagedResponse<AuditEntry> query(String entityType, String entityId, String performedBy,
                                           AuditEventType eventType, Long from, Long to,
                                           int limit, String before) {
        Predicate<AuditEntry> filter = e -> true;
        if (entityType != null && !entityType.isEmpty()) {
            filter = filter.and(e -> entityType.equalsIgnoreCase(e.getEntityType()));
        }
        if (entityId != null && !entityId.isEmpty()) {
            filter = filter.and(e -> entityId.equals(e.getEntityId()));
        }
        if (performedBy != null && !performedBy.isEmpty()) {
            filter = filter.and(e -> performedBy.equals(e.getPerformedBy()));
        }
        if (eventType != null) {
            filter = filter.and(e -> e.getEventType() == eventType);
        }
        if (from != null) {
            filter = filter.and(e -> e.getCreatedAt() >= from);
        }
        if (to != null) {
            filter = filter.and(e -> e.getCreatedAt() <= to);
        }
        if (before != null && !before.isEmpty()) {
            AuditEntry cursor = parseCursor(before);
            filter = filter.and(e -> NEWEST_FIRST.compare(e, cursor) > 0);
        }

        List<AuditEntry> results = new ArrayList<>(repository.scan(filter));
        results.sort(NEWEST_FIRST);

        boolean hasMore = results.size() > limit;
        List<AuditEntry> page = hasMore ? new ArrayList<>(results.subList(0, limit)) : results;
        String nextCursor = null;
        if (hasMore) {
            AuditEntry last = page.get(page.size() - 1);
            nextCursor = last.getCreatedAt() + ":" + last.getId();
        }
        return new PagedResponse<>(page, hasMore, nextCursor);
    }

    public List<AuditEntry> recent(int limit) {
        List<AuditEntry> all = new ArrayList<>(repository.scan(e -> true));
        all.sort(NEWEST_FIRST);
        return all.size() > limit ? new ArrayList<>(all.subList(0, limit)) : all;
    }

    /**
     * Writes entries in [from, to] oldest first, one JSON document per line.
     *
     * @return number of entries written
     */
    public int export(Long from, Long to, Writer writer) throws IOException {
        List<AuditEntry> entries = new ArrayList<>(repository.scan(e ->
                (from == null || e.getCreatedAt() >= from) && (to == null || e.getCreatedAt() <= to)));
        entries.sort(NEWEST_FIRST.reversed());

        for (AuditEntry entry : entries) {
            writer.write(objectMapper.writeValueAsString(entry));
            writer.write('\n');
        }
        writer.flush();
        log.info("Exported {} audit entries (from={}, to={})", entries.size(), from, to);
        return entries.size();
    }

    private AuditEntry parseCursor(String before) {
        int sep = before.indexOf(':');
        try {
            long createdAt = Long.parseLong(sep < 0 ? before : before.substring(0, sep));
            String id = sep < 0 ? "" : before.substring(sep + 1);
            return AuditEntry.builder().createdAt(createdAt).id(id).build();
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid cursor: " + before);
        }
    }
}
