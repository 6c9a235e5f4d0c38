package com.bank.payout.engine.rules;

import com.bank.payout.engine.DecisionRule;
import com.bank.payout.model.AutomationDecision;
import com.bank.payout.model.LedgerSnapshot;
import com.bank.payout.model.MerchantRiskScore;
import com.bank.payout.model.PayoutCandidate;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@Order(30)
public class ApprovalThresholdRule implements DecisionRule {

    @Override
    public String name() {
        return "approval-threshold";
    }

    @Override
    public Optional<AutomationDecision> evaluate(PayoutCandidate candidate, MerchantRiskScore score,
                                                 LedgerSnapshot ledger) {
        if (candidate.getAmount().compareTo(score.getRequiresApprovalAbove()) > 0) {
            return Optional.of(AutomationDecision.review("exceeds approval threshold"));
        }
        return Optional.empty();
    }
}
