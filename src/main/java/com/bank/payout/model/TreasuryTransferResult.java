package com.bank.payout.model;

public record TreasuryTransferResult(String treasuryTransactionId, String transactionHash) {}
