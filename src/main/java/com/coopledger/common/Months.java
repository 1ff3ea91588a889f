package com.coopledger.common;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Effective months are stored as the first day of the month.
 */
public final class Months {

    private static final DateTimeFormatter LABEL = DateTimeFormatter.ofPattern("MMMM yyyy", Locale.ENGLISH);

    private Months() {
    }

    public static LocalDate firstDay(LocalDate date) {
        return date.withDayOfMonth(1);
    }

    public static LocalDate firstDay(YearMonth month) {
        return month.atDay(1);
    }

    /**
     * The given day of the month, clamped to the month's length.
     */
    public static LocalDate dayOf(YearMonth month, int day) {
        return month.atDay(Math.min(Math.max(day, 1), month.lengthOfMonth()));
    }

    public static String label(LocalDate effectiveMonth) {
        return effectiveMonth.format(LABEL);
    }
}
