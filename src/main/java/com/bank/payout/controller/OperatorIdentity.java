package com.bank.payout.controller;

import com.bank.payout.exception.MissingOperatorException;

/**
 * Operator identity of mutating calls. The header is authenticated by the fronting API gateway.
 */
final class OperatorIdentity {

    static final String HEADER = "X-Operator-Id";

    private OperatorIdentity() {}

    static String require(String operatorId) {
        if (operatorId == null || operatorId.isBlank()) {
            throw new MissingOperatorException(HEADER + " header is required");
        }
        return operatorId.trim();
    }
}
