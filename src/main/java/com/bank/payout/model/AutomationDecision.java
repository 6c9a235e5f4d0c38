package com.bank.payout.model;

import java.util.List;

public record AutomationDecision(DecisionOutcome outcome, List<String> reasons) {

    public AutomationDecision {
        reasons = List.copyOf(reasons);
    }

    public static AutomationDecision approve(String reason) {
        return new AutomationDecision(DecisionOutcome.AUTO_APPROVE, List.of(reason));
    }

    public static AutomationDecision reject(String reason) {
        return new AutomationDecision(DecisionOutcome.AUTO_REJECT, List.of(reason));
    }

    public static AutomationDecision review(String reason) {
        return new AutomationDecision(DecisionOutcome.MANUAL_REVIEW, List.of(reason));
    }
}
