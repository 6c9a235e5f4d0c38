package com.bank.payout.engine;

import com.bank.payout.model.AutomationDecision;
import com.bank.payout.model.LedgerSnapshot;
import com.bank.payout.model.MerchantRiskScore;
import com.bank.payout.model.PayoutCandidate;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Classifies a payout candidate as AUTO_APPROVE, AUTO_REJECT or MANUAL_REVIEW.
 * Rules run in their declared order and the first match wins. A rule that throws
 * ends the chain with MANUAL_REVIEW.
 */
@Component
public class AutomationDecisionEngine {

    private static final Logger log = LoggerFactory.getLogger(AutomationDecisionEngine.class);

    private final List<DecisionRule> rules;
    private final Tracer tracer;

    public AutomationDecisionEngine(List<DecisionRule> rules, Tracer tracer) {
        this.rules = List.copyOf(rules);
        this.tracer = tracer;
        for (DecisionRule rule : this.rules) {
            log.info("Registered decision rule: {} -> {}", rule.name(), rule.getClass().getSimpleName());
        }
    }

    public AutomationDecision decide(PayoutCandidate candidate, MerchantRiskScore score, LedgerSnapshot ledger) {
        for (DecisionRule rule : rules) {
            Span span = tracer.nextSpan()
                    .name("decision.rule." + rule.name())
                    .tag("merchant.id", candidate.getMerchantId())
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
                Optional<AutomationDecision> decision = rule.evaluate(candidate, score, ledger);
                if (decision.isPresent()) {
                    span.tag("decision.outcome", decision.get().outcome().name());
                    log.debug("Rule {} decided {} for merchant {} amount {}: {}", rule.name(),
                            decision.get().outcome(), candidate.getMerchantId(), candidate.getAmount(),
                            decision.get().reasons());
                    return decision.get();
                }
            } catch (Exception e) {
                span.error(e);
                log.error("Decision rule {} failed for merchant {}: {}",
                        rule.name(), candidate.getMerchantId(), e.getMessage(), e);
                return AutomationDecision.review("rule " + rule.name() + " failed");
            } finally {
                span.end();
            }
        }
        return AutomationDecision.review("no automation rule matched");
    }
}
