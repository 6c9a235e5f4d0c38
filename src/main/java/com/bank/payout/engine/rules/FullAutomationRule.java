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
@Order(50)
public class FullAutomationRule implements DecisionRule {

    @Override
    public String name() {
        return "full-automation";
    }

    @Override
    public Optional<AutomationDecision> evaluate(PayoutCandidate candidate, MerchantRiskScore score,
                                                 LedgerSnapshot ledger) {
        if (score.getAutomationLevel() == AutomationLevel.FULL) {
            return Optional.of(AutomationDecision.approve("full automation within limits"));
        }
        return Optional.empty();
    }
}
