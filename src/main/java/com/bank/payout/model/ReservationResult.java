package com.bank.payout.model;

public record ReservationResult(boolean reserved, LimitWindow exceededWindow) {

    public static ReservationResult ok() {
        return new ReservationResult(true, null);
    }

    public static ReservationResult exceeded(LimitWindow window) {
        return new ReservationResult(false, window);
    }
}
