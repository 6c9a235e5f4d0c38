package com.bank.payout.service;

import com.bank.payout.exception.ValidationException;
import com.bank.payout.model.LedgerSnapshot;
import com.bank.payout.model.LimitWindow;
import com.bank.payout.model.LimitWindowConsumption;
import com.bank.payout.model.MerchantRiskScore;
import com.bank.payout.model.ReservationResult;
import com.bank.payout.repository.LimitLedgerRepository;
import com.bank.payout.support.MinorUnits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-merchant consumption of the daily, weekly and monthly limits.
 *
 * <p>{@link #reserve} is a check-then-add and must run under the merchant's LEDGER lease.
 * Commit and release are plain atomic adds and need no lease. They always target the buckets
 * of the reservation time, so an amount is accounted in the windows it was admitted into.</p>
 */
@Service
public class LimitLedgerService {

    private static final Logger log = LoggerFactory.getLogger(LimitLedgerService.class);

    private final LimitLedgerRepository repository;

    public LimitLedgerService(LimitLedgerRepository repository) {
        this.repository = repository;
    }

    public LedgerSnapshot snapshot(String merchantId, long at) {
        Map<LimitWindow, BigDecimal> consumed = new EnumMap<>(LimitWindow.class);
        for (LimitWindow window : LimitWindow.values()) {
            consumed.put(window, consumption(merchantId, window, at).total());
        }
        return new LedgerSnapshot(merchantId, at, consumed);
    }

    public LimitWindowConsumption consumption(String merchantId, LimitWindow window, long at) {
        long[] counters = repository.find(merchantId, window, at);
        return new LimitWindowConsumption(merchantId, window, window.windowStartMillis(at),
                MinorUnits.fromMinor(counters[0]), MinorUnits.fromMinor(counters[1]));
    }

    /**
     * Adds {@code amount} to the in-flight counter of every window, but only if it fits all of them.
     * Caller holds the merchant's LEDGER lease.
     */
    public ReservationResult reserve(String merchantId, BigDecimal amount, MerchantRiskScore limits, long at) {
        long minor = toLedgerUnits(amount);
        for (LimitWindow window : LimitWindow.values()) {
            BigDecimal limit = limits.limitFor(window);
            if (limit == null) continue;
            long[] counters = repository.find(merchantId, window, at);
            if (!fitsLimit(counters, minor, limit)) {
                log.info("Reservation refused for merchant={}: amount={} exceeds {} limit {}",
                        merchantId, amount, window.getLabel(), limit);
                return ReservationResult.exceeded(window);
            }
        }
        addInFlight(merchantId, minor, at);
        log.debug("Reserved {} for merchant={}", amount, merchantId);
        return ReservationResult.ok();
    }

    /**
     * Adds {@code amount} to the in-flight counters without checking limits.
     */
    public void forceReserve(String merchantId, BigDecimal amount, long at) {
        addInFlight(merchantId, toLedgerUnits(amount), at);
        log.info("Force-reserved {} for merchant={} beyond limits", amount, merchantId);
    }

    /**
     * Moves a reservation from in-flight to executed.
     */
    public void commit(String merchantId, BigDecimal amount, long reservedAt) {
        long minor = MinorUnits.toMinor(amount);
        for (LimitWindow window : LimitWindow.values()) {
            repository.add(merchantId, window, reservedAt, -minor, minor);
        }
    }

    public void release(String merchantId, BigDecimal amount, long reservedAt) {
        long minor = MinorUnits.toMinor(amount);
        for (LimitWindow window : LimitWindow.values()) {
            repository.add(merchantId, window, reservedAt, -minor, 0);
        }
        log.debug("Released {} for merchant={}", amount, merchantId);
    }

    private static long toLedgerUnits(BigDecimal amount) {
        if (!MinorUnits.fits(amount)) {
            throw new ValidationException("amount " + amount.toPlainString() + " is outside the ledger range of "
                    + MinorUnits.MAX_AMOUNT.toPlainString() + " with at most " + MinorUnits.SCALE + " decimal places");
        }
        return MinorUnits.toMinor(amount);
    }

    private static boolean fitsLimit(long[] counters, long minor, BigDecimal limit) {
        if (!MinorUnits.fits(limit)) {
            return false;
        }
        try {
            return Math.addExact(Math.addExact(counters[0], counters[1]), minor) <= MinorUnits.toMinor(limit);
        } catch (ArithmeticException e) {
            log.warn("Ledger sum overflow against limit {}, refusing reservation", limit);
            return false;
        }
    }

    private void addInFlight(String merchantId, long minor, long at) {
        for (LimitWindow window : LimitWindow.values()) {
            repository.add(merchantId, window, at, minor, 0);
        }
    }
}
