package com.aesentinel.core.model;

import java.time.LocalDate;
import java.time.temporal.IsoFields;
import java.util.Objects;

/**
 * Calendar-quarter arithmetic on {@link LocalDate} values.
 *
 * <p>
 * A quarter is identified by its first day (1 January, 1 April, 1 July or
 * 1 October).
 * </p>
 *
 * @since 1.0.0
 */
public final class Quarters {

    private Quarters() {
        // utility class: not instantiable
    }

    /**
     * @param date any date; must not be {@code null}
     * @return the first day of the quarter containing {@code date}
     */
    public static LocalDate startOf(LocalDate date) {
        Objects.requireNonNull(date, "date must not be null");
        int startMonth = (date.getMonthValue() - 1) / 3 * 3 + 1;
        return LocalDate.of(date.getYear(), startMonth, 1);
    }

    /**
     * @param date any date; must not be {@code null}
     * @return {@code true} if {@code date} is the first day of a quarter
     */
    public static boolean isQuarterStart(LocalDate date) {
        return startOf(date).equals(date);
    }

    /**
     * @param quarterStart the first day of a quarter
     * @return the first day of the following quarter
     */
    public static LocalDate next(LocalDate quarterStart) {
        return plus(quarterStart, 1);
    }

    /**
     * @param quarterStart the first day of a quarter
     * @param quarters     number of quarters to add (may be negative)
     * @return the first day of the resulting quarter
     */
    public static LocalDate plus(LocalDate quarterStart, long quarters) {
        return startOf(quarterStart).plus(quarters, IsoFields.QUARTER_YEARS);
    }

    /**
     * @param date any date
     * @return quarter of year, 1 to 4
     */
    public static int quarterOfYear(LocalDate date) {
        return date.get(IsoFields.QUARTER_OF_YEAR);
    }
}
