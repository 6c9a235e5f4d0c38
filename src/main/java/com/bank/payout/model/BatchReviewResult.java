package com.bank.payout.model;

import java.util.List;

/**
 * Outcome of a batch review. Each id succeeds or fails on its own.
 */
public record BatchReviewResult(int requested, int succeeded, int failed, List<Item> results) {

    public record Item(String payoutId, boolean success, PayoutStatus status, String error) {

        public static Item succeeded(PayoutRequest request) {
            return new Item(request.getId(), true, request.getStatus(), null);
        }

        public static Item failed(String payoutId, String error) {
            return new Item(payoutId, false, null, error);
        }
    }
}
