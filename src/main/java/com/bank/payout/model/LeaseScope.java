package com.bank.payout.model;

/**
 * Independent per-merchant mutexes. LEDGER guards check-then-reserve,
 * DISPATCH serializes execution of a merchant's queue.
 */
public enum LeaseScope {
    LEDGER,
    DISPATCH
}
