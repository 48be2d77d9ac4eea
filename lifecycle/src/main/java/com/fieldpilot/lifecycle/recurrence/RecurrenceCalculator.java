package com.fieldpilot.lifecycle.recurrence;

import com.fieldpilot.lifecycle.model.RecurrenceFrequency;
import com.fieldpilot.lifecycle.model.RecurringSeries;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;

/**
 * Pure date arithmetic for recurring series.
 *
 * Occurrence {@code k} is computed from the aligned first occurrence, never
 * from occurrence {@code k-1}. That keeps the dates identical no matter which
 * day the generator runs, and stops month-end clamping from drifting: a
 * series on the 31st lands on Feb 28/29 and returns to the 31st in March.
 */
public final class RecurrenceCalculator {

    private RecurrenceCalculator() {}

    /**
     * Occurrences falling inside [{@code from}, {@code to}], bounded by the
     * series start and end dates, at most {@code limit} of them.
     */
    public static List<LocalDate> occurrences(RecurringSeries series, LocalDate from, LocalDate to, int limit) {
        List<LocalDate> dates = new ArrayList<>();
        LocalDate upper = series.getEndDate() != null && series.getEndDate().isBefore(to) ? series.getEndDate() : to;
        LocalDate lower = from.isBefore(series.getStartDate()) ? series.getStartDate() : from;
        if (upper.isBefore(lower) || limit <= 0) {
            return dates;
        }

        for (long k = firstCandidateIndex(series, lower); ; k++) {
            LocalDate date = occurrence(series, k);
            if (date.isAfter(upper)) {
                break;
            }
            if (!date.isBefore(lower)) {
                dates.add(date);
                if (dates.size() >= limit) {
                    break;
                }
            }
        }
        return dates;
    }

    /** The {@code index}-th occurrence (0-based) of the series. */
    public static LocalDate occurrence(RecurringSeries series, long index) {
        int interval = series.getIntervalCount();
        return switch (series.getFrequency()) {
            case DAILY  -> firstDayBased(series).plusDays(index * interval);
            case WEEKLY -> firstDayBased(series).plusWeeks(index * interval);
            case MONTHLY, QUARTERLY, YEARLY -> {
                YearMonth month = firstMonth(series).plusMonths(index * interval * series.getFrequency().months());
                yield clampedDay(month, desiredDay(series));
            }
        };
    }

    // ------------------------------------------------------------------
    // Alignment
    // ------------------------------------------------------------------

    private static LocalDate firstDayBased(RecurringSeries series) {
        LocalDate start = series.getStartDate();
        if (series.getFrequency() == RecurrenceFrequency.WEEKLY && series.getDayOfWeek() != null) {
            return start.with(TemporalAdjusters.nextOrSame(series.getDayOfWeek()));
        }
        return start;
    }

    private static YearMonth firstMonth(RecurringSeries series) {
        LocalDate start = series.getStartDate();
        YearMonth month = YearMonth.from(start);
        return clampedDay(month, desiredDay(series)).isBefore(start) ? month.plusMonths(1) : month;
    }

    private static int desiredDay(RecurringSeries series) {
        return series.getDayOfMonth() != null ? series.getDayOfMonth() : series.getStartDate().getDayOfMonth();
    }

    private static LocalDate clampedDay(YearMonth month, int day) {
        return month.atDay(Math.min(day, month.lengthOfMonth()));
    }

    /** An index at or before the first occurrence on/after {@code lower}, so old series skip their past. */
    private static long firstCandidateIndex(RecurringSeries series, LocalDate lower) {
        long step;
        long elapsed;
        switch (series.getFrequency()) {
            case DAILY -> {
                step    = series.getIntervalCount();
                elapsed = ChronoUnit.DAYS.between(firstDayBased(series), lower);
            }
            case WEEKLY -> {
                step    = 7L * series.getIntervalCount();
                elapsed = ChronoUnit.DAYS.between(firstDayBased(series), lower);
            }
            default -> {
                step    = (long) series.getIntervalCount() * series.getFrequency().months();
                elapsed = ChronoUnit.MONTHS.between(firstMonth(series), YearMonth.from(lower)) - step;
            }
        }
        return Math.max(0, elapsed / step);
    }
}
