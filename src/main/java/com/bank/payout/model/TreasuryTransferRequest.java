package com.bank.payout.model;

import java.math.BigDecimal;

public record TreasuryTransferRequest(String merchantId,
                                      BigDecimal amount,
                                      String currency,
                                      String destinationWallet,
                                      DestinationNetwork destinationNetwork,
                                      String idempotencyKey) {

    public static TreasuryTransferRequest from(PayoutRequest request) {
        return new TreasuryTransferRequest(request.getMerchantId(), request.getAmount(),
                request.getCurrency(), request.getDestinationWallet(),
                request.getDestinationNetwork(), request.getIdempotencyKey());
    }
}
