package com.bank.payout.engine;

import com.bank.payout.model.AutomationDecision;
import com.bank.payout.model.LedgerSnapshot;
import com.bank.payout.model.MerchantRiskScore;
import com.bank.payout.model.PayoutCandidate;

import java.util.Optional;

/**
 * One step of the ordered decision chain. Implementations are Spring components ordered
 * with {@link org.springframework.core.annotation.Order}; the first rule that returns a
 * decision wins.
 *
 * <p>Rules must be pure functions of their arguments.
 */
public interface DecisionRule {

    String name();

    Optional<AutomationDecision> evaluate(PayoutCandidate candidate, MerchantRiskScore score, LedgerSnapshot ledger);
}
