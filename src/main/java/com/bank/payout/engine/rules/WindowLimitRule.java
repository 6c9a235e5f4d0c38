package com.bank.payout.engine.rules;

import com.bank.payout.engine.DecisionRule;
import com.bank.payout.model.AutomationDecision;
import com.bank.payout.model.DecisionOutcome;
import com.bank.payout.model.LedgerSnapshot;
import com.bank.payout.model.LimitWindow;
import com.bank.payout.model.MerchantRiskScore;
import com.bank.payout.model.PayoutCandidate;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Daily/weekly/monthly limits. Exceeding a window routes to review, never to rejection.
 */
@Component
@Order(40)
public class WindowLimitRule implements DecisionRule {

    @Override
    public String name() {
        return "window-limits";
    }

    @Override
    public Optional<AutomationDecision> evaluate(PayoutCandidate candidate, MerchantRiskScore score,
                                                 LedgerSnapshot ledger) {
        List<String> exceeded = new ArrayList<>();
        for (LimitWindow window : LimitWindow.values()) {
            if (ledger.consumed(window).add(candidate.getAmount()).compareTo(score.limitFor(window)) > 0) {
                exceeded.add("exceeds " + window.getLabel() + " limit");
            }
        }
        if (exceeded.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new AutomationDecision(DecisionOutcome.MANUAL_REVIEW, exceeded));
    }
}
