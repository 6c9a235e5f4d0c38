package com.bank.payout.gateway;

import com.bank.payout.model.TreasuryTransferRequest;
import com.bank.payout.model.TreasuryTransferResult;

/**
 * External treasury that custodies funds and executes approved transfers under its own
 * multi-signature approval, global ceilings and emergency halt.
 *
 * <p>Transfers are deduplicated by idempotency key on the treasury side, so a retry of
 * an attempt whose outcome was lost never moves funds twice.
 */
public interface TreasuryGateway {

    /**
     * @throws com.bank.payout.exception.TransientGatewayException retryable failure
     * @throws com.bank.payout.exception.PermanentGatewayException  the transfer will never succeed as submitted
     * @throws com.bank.payout.exception.TreasuryHaltedException    treasury is halted; hold the request
     */
    TreasuryTransferResult execute(TreasuryTransferRequest request);
}
