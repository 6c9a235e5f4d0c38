package com.bank.payout.service;

import com.bank.payout.exception.NotFoundException;
import com.bank.payout.model.AutomationMetrics;
import com.bank.payout.model.DecisionOutcome;
import com.bank.payout.model.LimitWindow;
import com.bank.payout.model.PagedResponse;
import com.bank.payout.model.PayoutPriority;
import com.bank.payout.model.PayoutRequest;
import com.bank.payout.model.PayoutStatus;
import com.bank.payout.model.PayoutSummary;
import com.bank.payout.model.QueueStatus;
import com.bank.payout.repository.PayoutRequestRepository;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

@Service
public class PayoutQueryService {

    private static final Comparator<PayoutRequest> NEWEST_FIRST = Comparator
            .comparingLong(PayoutRequest::getCreatedAt)
            .thenComparing(PayoutRequest::getId)
            .reversed();

    private final PayoutRequestRepository repository;
    private final PayoutDispatcher dispatcher;
    private final EmergencyHaltService haltService;
    private final Clock clock;

    public PayoutQueryService(PayoutRequestRepository repository,
                              PayoutDispatcher dispatcher,
                              EmergencyHaltService haltService,
                              Clock clock) {
        this.repository = repository;
        this.dispatcher = dispatcher;
        this.haltService = haltService;
        this.clock = clock;
    }

    public PayoutRequest get(String requestId) {
        return repository.findById(requestId)
                .orElseThrow(() -> new NotFoundException("Payout request not found: " + requestId));
    }

    /**
     * Newest first. The cursor is {@code createdAt:id} of the last request of the previous page.
     */
    public PagedResponse<PayoutRequest> find(PayoutStatus status, String merchantId, DecisionOutcome decision,
                                             PayoutPriority priority, int limit, String before) {
        Predicate<PayoutRequest> filter = r -> true;
        if (status != null) {
            filter = filter.and(r -> r.getStatus() == status);
        }
        if (merchantId != null && !merchantId.isEmpty()) {
            filter = filter.and(r -> merchantId.equals(r.getMerchantId()));
        }
        if (decision != null) {
            filter = filter.and(r -> r.getAutomationDecision() == decision);
        }
        if (priority != null) {
            filter = filter.and(r -> r.getPriority() == priority);
        }
        if (before != null && !before.isEmpty()) {
            PayoutRequest cursor = parseCursor(before);
            filter = filter.and(r -> NEWEST_FIRST.compare(r, cursor) > 0);
        }

        List<PayoutRequest> matches = new ArrayList<>(repository.scan(filter));
        matches.sort(NEWEST_FIRST);

        boolean hasMore = matches.size() > limit;
        List<PayoutRequest> page = hasMore ? new ArrayList<>(matches.subList(0, limit)) : matches;
        String nextCursor = null;
        if (hasMore) {
            PayoutRequest last = page.get(page.size() - 1);
            nextCursor = last.getCreatedAt() + ":" + last.getId();
        }
        return new PagedResponse<>(page, hasMore, nextCursor);
    }

    public PayoutSummary summary() {
        List<PayoutRequest> all = repository.scan(r -> true);
        long todayStart = LimitWindow.DAY.windowStartMillis(clock.millis());

        Map<PayoutStatus, Long> byStatus = new EnumMap<>(PayoutStatus.class);
        for (PayoutStatus status : PayoutStatus.values()) {
            byStatus.put(status, 0L);
        }
        all.forEach(r -> byStatus.merge(r.getStatus(), 1L, Long::sum));

        BigDecimal dailyVolume = all.stream()
                .filter(r -> r.getStatus() == PayoutStatus.EXECUTED
                        && r.getExecutedAt() != null && r.getExecutedAt() >= todayStart)
                .map(PayoutRequest::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        return PayoutSummary.builder()
                .byStatus(byStatus)
                .manualReviewQueue(all.stream().filter(PayoutRequest::isAwaitingReview).count())
                .autoApproved(all.stream().filter(r -> r.getAutomationDecision() == DecisionOutcome.AUTO_APPROVE).count())
                .autoRejected(all.stream().filter(r -> r.getAutomationDecision() == DecisionOutcome.AUTO_REJECT).count())
                .avgProcessingTimeMs(averageProcessingTime(all))
                .dailyVolume(dailyVolume)
                .build();
    }

    /**
     * automationRate is the share of decided requests that needed no human; errorRate the
     * share of finished executions that failed. Both are percentages.
     */
    public AutomationMetrics metrics() {
        List<PayoutRequest> all = repository.scan(r -> true);
        long successful = all.stream().filter(r -> r.getStatus() == PayoutStatus.EXECUTED).count();
        long failed = all.stream().filter(r -> r.getStatus() == PayoutStatus.FAILED).count();
        long processed = successful + failed;
        long automated = all.stream().filter(r -> r.getAutomationDecision() != null
                && r.getAutomationDecision() != DecisionOutcome.MANUAL_REVIEW).count();
        long decided = all.stream().filter(r -> r.getAutomationDecision() != null).count();

        BigDecimal volume = all.stream()
                .filter(r -> r.getStatus() == PayoutStatus.EXECUTED)
                .map(PayoutRequest::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        return AutomationMetrics.builder()
                .totalProcessed(processed)
                .successful(successful)
                .failed(failed)
                .avgProcessingTimeMs(averageProcessingTime(all))
                .totalVolume(volume)
                .automationRate(percentage(automated, decided))
                .errorRate(percentage(failed, processed))
                .build();
    }

    public QueueStatus queueStatus() {
        long now = clock.millis();
        List<PayoutRequest> pending = repository.scan(r -> r.getStatus() == PayoutStatus.PENDING
                || r.getStatus() == PayoutStatus.PROCESSING);

        return QueueStatus.builder()
                .eligibleNow(pending.stream().filter(r -> r.isEligibleAt(now)).count())
                .waitingBackoff(pending.stream().filter(r -> r.getStatus() == PayoutStatus.PENDING && r.isApproved()
                        && r.getNextAttemptAt() > now).count())
                .scheduledFuture(pending.stream().filter(r -> r.getStatus() == PayoutStatus.PENDING && r.isApproved()
                        && r.getScheduledFor() > now && r.getNextAttemptAt() <= now).count())
                .processing(pending.stream().filter(r -> r.getStatus() == PayoutStatus.PROCESSING).count())
                .awaitingReview(pending.stream().filter(PayoutRequest::isAwaitingReview).count())
                .activeMerchants(dispatcher.activeMerchantCount())
                .halted(haltService.isHalted())
                .build();
    }

    private static double averageProcessingTime(List<PayoutRequest> all) {
        return Math.round(all.stream()
                .filter(r -> r.getStatus() == PayoutStatus.EXECUTED && r.getExecutedAt() != null)
                .mapToLong(r -> r.getExecutedAt() - r.getCreatedAt())
                .average()
                .orElse(0.0));
    }

    private static double percentage(long part, long whole) {
        if (whole == 0) return 0.0;
        return Math.round(part * 1000.0 / whole) / 10.0;
    }

    private static PayoutRequest parseCursor(String before) {
        int sep = before.indexOf(':');
        try {
            long createdAt = Long.parseLong(sep < 0 ? before : before.substring(0, sep));
            String id = sep < 0 ? "" : before.substring(sep + 1);
            return PayoutRequest.builder().createdAt(createdAt).id(id).build();
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid cursor: " + before);
        }
    }
}
