package com.bank.payout.engine.rules;

import com.bank.payout.config.AutomationConfig;
import com.bank.payout.engine.DecisionRule;
import com.bank.payout.model.AutomationDecision;
import com.bank.payout.model.AutomationLevel;
import com.bank.payout.model.LedgerSnapshot;
import com.bank.payout.model.MerchantRiskScore;
import com.bank.payout.model.PayoutCandidate;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;

@Component
@Order(60)
public class PartialAutomationRule implements DecisionRule {

    private final AutomationConfig config;

    public PartialAutomationRule(AutomationConfig config) {
        this.config = config;
    }

    @Override
    public String name() {
        return "partial-automation";
    }

    @Override
    public Optional<AutomationDecision> evaluate(PayoutCandidate candidate, MerchantRiskScore score,
                                                 LedgerSnapshot ledger) {
        if (score.getAutomationLevel() != AutomationLevel.PARTIAL) {
            return Optional.empty();
        }
        BigDecimal ceiling = score.getSingleTransactionLimit()
                .multiply(BigDecimal.valueOf(config.getPartialAutoApproveFraction()));
        if (candidate.getAmount().compareTo(ceiling) <= 0) {
            return Optional.of(AutomationDecision.approve("partial automation within auto-approve fraction"));
        }
        return Optional.of(AutomationDecision.review("exceeds partial automation fraction"));
    }
}
