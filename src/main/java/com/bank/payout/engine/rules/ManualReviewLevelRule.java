package com.bank.payout.engine.rules;

import com.bank.payout.engine.DecisionRule;
import com.bank.payout.model.AutomationDecision;
import com.bank.payout.model.AutomationLevel;
import com.bank.payout.model.LedgerSnapshot;
import com.bank.payout.model.MerchantRiskScore;
import com.bank.payout.model.PayoutCandidate;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@Order(10)
public class ManualReviewLevelRule implements DecisionRule {

    @Override
    public String name() {
        return "manual-review-level";
    }

    @Override
    public Optional<AutomationDecision> evaluate(PayoutCandidate candidate, MerchantRiskScore score,
                                                 LedgerSnapshot ledger) {
        if (!score.isActive()) {
            return Optional.of(AutomationDecision.review("merchant risk score is inactive"));
        }
        if (score.getAutomationLevel() == AutomationLevel.MANUAL_REVIEW) {
            return Optional.of(AutomationDecision.review("merchant automation level is MANUAL_REVIEW"));
        }
        return Optional.empty();
    }
}
