/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.util;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Cron parsing and next-fire computation.
 *
 * <p>
 * Accepts classic 5-field UNIX expressions ({@code minute hour day-of-month month day-of-week}) and 6-field expressions
 * with a leading seconds field.
 */
public final class CronSchedules {

    private static final CronParser UNIX_PARSER = new CronParser(
            CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));
    private static final CronParser SECONDS_PARSER = new CronParser(
            CronDefinitionBuilder.instanceDefinitionFor(CronType.SPRING));

    private CronSchedules() {
        // Utility class, no instantiation
    }

    /**
     * Parses and validates a cron expression.
     *
     * @param expression
     *            5- or 6-field cron expression
     * @return validated cron
     * @throws IllegalArgumentException
     *             if the expression is blank, has the wrong number of fields, or is malformed
     */
    public static Cron parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Cron expression is required");
        }
        String trimmed = expression.trim();
        int fields = trimmed.split("\\s+").length;
        if (fields == 5) {
            return UNIX_PARSER.parse(trimmed).validate();
        }
        if (fields == 6) {
            return SECONDS_PARSER.parse(trimmed).validate();
        }
        throw new IllegalArgumentException(
                "Cron expression must have 5 or 6 fields, got " + fields + ": " + expression);
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Computes the first fire time strictly after {@code from}.
     *
     * @param expression
     *            cron expression
     * @param from
     *            reference instant
     * @param zone
     *            zone the expression is evaluated in
     * @return next fire time, empty if the expression never fires again
     */
    public static Optional<Instant> nextRun(String expression, Instant from, ZoneId zone) {
        ExecutionTime executionTime = ExecutionTime.forCron(parse(expression));
        Optional<ZonedDateTime> next = executionTime.nextExecution(ZonedDateTime.ofInstant(from, zone));
        return next.map(ZonedDateTime::toInstant);
    }
}
