package com.bank.payout.model;

/**
 * Outcome of a payout submission. {@code duplicate} is true when the idempotency key was
 * already bound and the existing request is returned unchanged.
 */
public record AdmissionResult(PayoutRequest request, boolean duplicate) {}
