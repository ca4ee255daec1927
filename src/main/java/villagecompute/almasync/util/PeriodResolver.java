/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.util;

import villagecompute.almasync.data.models.PeriodType;
import villagecompute.almasync.data.models.RunFor;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Resolves the DHIS2 period identifiers a sync pass targets.
 *
 * <p>
 * <b>Canonical formats:</b>
 * <ul>
 * <li>day: {@code yyyyMMdd} (20240315)</li>
 * <li>week: ISO week-based year, {@code W}, two-digit week (2024W11)</li>
 * <li>month: {@code yyyyMM} (202403)</li>
 * <li>quarter: {@code yyyy}, {@code Q}, quarter number (2024Q1)</li>
 * <li>year: {@code yyyy} (2024)</li>
 * </ul>
 */
public final class PeriodResolver {

    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final DateTimeFormatter MONTH_FORMAT = DateTimeFormatter.ofPattern("yyyyMM");
    private static final Pattern ISO_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    private static final Pattern ISO_MONTH = Pattern.compile("\\d{4}-\\d{2}");

    private PeriodResolver() {
        // Utility class, no instantiation
    }

    /**
     * Resolves the periods to process.
     *
     * @param periodType
     *            period granularity
     * @param runFor
     *            current or previous period, used only when no explicit periods are given
     * @param explicitPeriods
     *            explicit periods; ISO dates and months are converted to the canonical format, anything else is kept
     *            verbatim
     * @param today
     *            reference date
     * @return explicit periods formatted per type, or exactly one computed period
     */
    public static List<String> resolve(PeriodType periodType, RunFor runFor, List<String> explicitPeriods,
            LocalDate today) {
        if (explicitPeriods != null && !explicitPeriods.isEmpty()) {
            List<String> formatted = new ArrayList<>();
            for (String period : explicitPeriods) {
                if (period != null && !period.isBlank()) {
                    formatted.add(normalize(periodType, period.trim()));
                }
            }
            if (!formatted.isEmpty()) {
                return formatted;
            }
        }
        int offset = runFor != null ? runFor.getOffset() : 0;
        return List.of(format(periodType, shift(periodType, today, offset)));
    }

    /**
     * Formats a date as the period of the given type that contains it.
     */
    public static String format(PeriodType periodType, LocalDate date) {
        return switch (periodType) {
            case DAY -> date.format(DAY_FORMAT);
            case WEEK -> String.format("%dW%02d", date.get(IsoFields.WEEK_BASED_YEAR),
                    date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
            case MONTH -> date.format(MONTH_FORMAT);
            case QUARTER -> date.getYear() + "Q" + date.get(IsoFields.QUARTER_OF_YEAR);
            case YEAR -> String.valueOf(date.getYear());
        };
    }

    /**
     * Shifts a date by whole periods.
     */
    public static LocalDate shift(PeriodType periodType, LocalDate date, int periods) {
        return switch (periodType) {
            case DAY -> date.plusDays(periods);
            case WEEK -> date.plusWeeks(periods);
            case MONTH -> date.plusMonths(periods);
            case QUARTER -> date.plusMonths(3L * periods);
            case YEAR -> date.plusYears(periods);
        };
    }

    static String normalize(PeriodType periodType, String period) {
        try {
            if (ISO_DATE.matcher(period).matches()) {
                return format(periodType, LocalDate.parse(period));
            }
            if (ISO_MONTH.matcher(period).matches()) {
                return format(periodType, YearMonth.parse(period).atDay(1));
            }
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid period: " + period, e);
        }
        return period;
    }
}
