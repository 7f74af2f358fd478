package com.geoinsight.mcp.model;

import com.geoinsight.mcp.exception.InvalidArgumentException;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.regex.Pattern;

/**
 * Inclusive date range normalized from a year, year-month or full-date period.
 * Either bound may be null, meaning unbounded on that side.
 */
@Data
@AllArgsConstructor
public class PeriodRange {

    private static final Pattern YEAR = Pattern.compile("\\d{4}");
    private static final Pattern YEAR_MONTH = Pattern.compile("\\d{4}-\\d{2}");
    private static final Pattern FULL_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");

    private final LocalDate from;
    private final LocalDate to;

    public static PeriodRange unbounded() {
        return new PeriodRange(null, null);
    }

    /**
     * A single period: 2024 → [2024-01-01, 2024-12-31], 2024-03 → [2024-03-01, 2024-03-31],
     * 2024-03-15 → [2024-03-15, 2024-03-15].
     */
    public static PeriodRange of(String period) {
        if (period == null || period.isBlank()) {
            throw new InvalidArgumentException("period is required (YYYY, YYYY-MM or YYYY-MM-DD)");
        }
        return new PeriodRange(start(period), end(period));
    }

    /**
     * A from/to pair. Missing bounds stay open; reversed bounds are swapped.
     */
    public static PeriodRange between(String periodFrom, String periodTo) {
        LocalDate from = isBlank(periodFrom) ? null : start(periodFrom);
        LocalDate to = isBlank(periodTo) ? null : end(periodTo);
        if (from != null && to != null && from.isAfter(to)) {
            LocalDate swap = from;
            from = to;
            to = swap;
        }
        return new PeriodRange(from, to);
    }

    public boolean contains(LocalDate date) {
        if (date == null) {
            return false;
        }
        return (from == null || !date.isBefore(from)) && (to == null || !date.isAfter(to));
    }

    private static LocalDate start(String period) {
        String value = period.trim();
        try {
            if (YEAR.matcher(value).matches()) {
                return LocalDate.of(Integer.parseInt(value), 1, 1);
            }
            if (YEAR_MONTH.matcher(value).matches()) {
                return YearMonth.parse(value).atDay(1);
            }
            if (FULL_DATE.matcher(value).matches()) {
                return LocalDate.parse(value);
            }
        } catch (DateTimeException e) {
            throw new InvalidArgumentException("period is not a valid date: '" + period + "'");
        }
        throw new InvalidArgumentException("period must be YYYY, YYYY-MM, or YYYY-MM-DD (got '" + period + "')");
    }

    private static LocalDate end(String period) {
        String value = period.trim();
        LocalDate start = start(value);
        if (YEAR.matcher(value).matches()) {
            return LocalDate.of(start.getYear(), 12, 31);
        }
        if (YEAR_MONTH.matcher(value).matches()) {
            return YearMonth.from(start).atEndOfMonth();
        }
        return start;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
