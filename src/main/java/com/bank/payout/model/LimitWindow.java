package com.bank.payout.model;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAdjusters;

/**
 * Calendar-aligned spending windows, evaluated in UTC.
 * DAY starts at midnight, WEEK on ISO Monday, MONTH on the 1st.
 */
public enum LimitWindow {
    DAY("D", "daily"),
    WEEK("W", "weekly"),
    MONTH("M", "monthly");

    private static final DateTimeFormatter BUCKET_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final String code;
    private final String label;

    LimitWindow(String code, String label) {
        this.code = code;
        this.label = label;
    }

    public String getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }

    public LocalDate windowStart(long epochMillis) {
        LocalDate date = Instant.ofEpochMilli(epochMillis).atZone(ZoneOffset.UTC).toLocalDate();
        return switch (this) {
            case DAY -> date;
            case WEEK -> date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case MONTH -> date.withDayOfMonth(1);
        };
    }

    public long windowStartMillis(long epochMillis) {
        return windowStart(epochMillis).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
    }

    /**
     * Bucket key format: merchantId:code:yyyyMMdd of the window start.
     */
    public String bucketKey(String merchantId, long epochMillis) {
        return merchantId + ":" + code + ":" + windowStart(epochMillis).format(BUCKET_FORMAT);
    }
}
