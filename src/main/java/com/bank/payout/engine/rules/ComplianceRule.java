package com.bank.payout.engine.rules;

import com.bank.payout.config.AutomationConfig;
import com.bank.payout.engine.DecisionRule;
import com.bank.payout.model.AutomationDecision;
import com.bank.payout.model.LedgerSnapshot;
import com.bank.payout.model.MerchantRiskScore;
import com.bank.payout.model.PayoutCandidate;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * The only source of AUTO_REJECT: explicit compliance signals, never the risk score.
 */
@Component
@Order(0)
public class ComplianceRule implements DecisionRule {

    private final AutomationConfig config;

    public ComplianceRule(AutomationConfig config) {
        this.config = config;
    }

    @Override
    public String name() {
        return "compliance";
    }

    @Override
    public Optional<AutomationDecision> evaluate(PayoutCandidate candidate, MerchantRiskScore score,
                                                 LedgerSnapshot ledger) {
        if (config.isDenylisted(candidate.getDestinationWallet())) {
            return Optional.of(AutomationDecision.reject("destination wallet is denylisted"));
        }
        if (score.isPayoutsHalted()) {
            return Optional.of(AutomationDecision.reject("merchant payouts are halted"));
        }
        return Optional.empty();
    }
}
