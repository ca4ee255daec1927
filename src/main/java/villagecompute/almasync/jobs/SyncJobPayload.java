/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.jobs;

import villagecompute.almasync.data.models.PeriodType;
import villagecompute.almasync.data.models.RunFor;
import villagecompute.almasync.data.models.Schedule;
import villagecompute.almasync.exceptions.ConfigurationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Typed payload of a {@code dhis2-alma-sync} job.
 *
 * <p>
 * Stored on the job as a flat map ({@link #toMap()}); keys that are not named fields travel in {@link #extras()} so
 * processor-specific overrides survive the round trip.
 *
 * @param scheduleId
 *            owning schedule
 * @param processor
 *            processor name
 * @param dhis2Instance
 *            source instance name
 * @param almaInstance
 *            target instance name
 * @param scorecard
 *            ALMA scorecard id
 * @param indicatorGroup
 *            DHIS2 indicator group id
 * @param periodType
 *            period granularity
 * @param runFor
 *            current or previous period
 * @param periods
 *            explicit periods (may be empty)
 * @param extras
 *            remaining keys
 */
public record SyncJobPayload(String scheduleId, String processor, String dhis2Instance, String almaInstance,
        Integer scorecard, String indicatorGroup, PeriodType periodType, RunFor runFor, List<String> periods,
        Map<String, Object> extras) {

    public static final String KEY_SCHEDULE_ID = QueuedJob.SCHEDULE_ID_KEY;
    public static final String KEY_PROCESSOR = "processor";
    public static final String KEY_DHIS2_INSTANCE = "dhis2Instance";
    public static final String KEY_ALMA_INSTANCE = "almaInstance";
    public static final String KEY_SCORECARD = "scorecard";
    public static final String KEY_INDICATOR_GROUP = "indicatorGroup";
    public static final String KEY_PERIOD_TYPE = "periodType";
    public static final String KEY_RUN_FOR = "runFor";
    public static final String KEY_PERIODS = "periods";
    /**
     * Singular alias accepted for {@link #KEY_PERIODS} in nested overrides.
     */
    public static final String KEY_PERIOD_ALIAS = "period";

    private static final Set<String> NAMED_KEYS = Set.of(KEY_SCHEDULE_ID, KEY_PROCESSOR, KEY_DHIS2_INSTANCE,
            KEY_ALMA_INSTANCE, KEY_SCORECARD, KEY_INDICATOR_GROUP, KEY_PERIOD_TYPE, KEY_RUN_FOR, KEY_PERIODS,
            KEY_PERIOD_ALIAS);

    public SyncJobPayload {
        periods = periods != null ? List.copyOf(periods) : List.of();
        extras = extras != null ? Map.copyOf(extras) : Map.of();
        if (periodType == null) {
            periodType = PeriodType.MONTH;
        }
        if (runFor == null) {
            runFor = RunFor.CURRENT;
        }
    }

    /**
     * Builds the payload for a schedule. Schedule-level sync parameters are merged with the schedule's nested
     * {@code data} overrides; nested values win.
     */
    public static SyncJobPayload fromSchedule(Schedule schedule) {
        Map<String, Object> merged = new LinkedHashMap<>();
        putIfPresent(merged, KEY_PROCESSOR, schedule.processor);
        putIfPresent(merged, KEY_DHIS2_INSTANCE, schedule.dhis2Instance);
        putIfPresent(merged, KEY_ALMA_INSTANCE, schedule.almaInstance);
        putIfPresent(merged, KEY_SCORECARD, schedule.scorecard);
        putIfPresent(merged, KEY_INDICATOR_GROUP, schedule.indicatorGroup);
        putIfPresent(merged, KEY_PERIOD_TYPE, schedule.periodType != null ? schedule.periodType.getValue() : null);
        putIfPresent(merged, KEY_RUN_FOR, schedule.runFor != null ? schedule.runFor.getValue() : null);
        if (schedule.periods != null && !schedule.periods.isEmpty()) {
            merged.put(KEY_PERIODS, new ArrayList<>(schedule.periods));
        }
        if (schedule.data != null) {
            schedule.data.forEach((key, value) -> putIfPresent(merged, key, value));
        }
        merged.put(KEY_SCHEDULE_ID, schedule.id);
        return fromMap(merged);
    }

    /**
     * Parses a flat job payload map.
     *
     * @throws ConfigurationException
     *             if a typed field holds a value that cannot be converted
     */
    public static SyncJobPayload fromMap(Map<String, Object> map) {
        if (map == null) {
            map = Map.of();
        }
        Map<String, Object> extras = new LinkedHashMap<>();
        map.forEach((key, value) -> {
            if (!NAMED_KEYS.contains(key) && value != null) {
                extras.put(key, value);
            }
        });

        Object periodsValue = map.get(KEY_PERIODS) != null ? map.get(KEY_PERIODS) : map.get(KEY_PERIOD_ALIAS);

        try {
            return new SyncJobPayload(string(map.get(KEY_SCHEDULE_ID)), string(map.get(KEY_PROCESSOR)),
                    string(map.get(KEY_DHIS2_INSTANCE)), string(map.get(KEY_ALMA_INSTANCE)),
                    integer(map.get(KEY_SCORECARD)), string(map.get(KEY_INDICATOR_GROUP)),
                    PeriodType.fromValue(string(map.get(KEY_PERIOD_TYPE))),
                    RunFor.fromValue(string(map.get(KEY_RUN_FOR))), stringList(periodsValue), extras);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid job payload: " + e.getMessage(), e);
        }
    }

    /**
     * Flat map stored on the job.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>(extras);
        putIfPresent(map, KEY_PROCESSOR, processor);
        putIfPresent(map, KEY_DHIS2_INSTANCE, dhis2Instance);
        putIfPresent(map, KEY_ALMA_INSTANCE, almaInstance);
        putIfPresent(map, KEY_SCORECARD, scorecard);
        putIfPresent(map, KEY_INDICATOR_GROUP, indicatorGroup);
        map.put(KEY_PERIOD_TYPE, periodType.getValue());
        map.put(KEY_RUN_FOR, runFor.getValue());
        map.put(KEY_PERIODS, new ArrayList<>(periods));
        putIfPresent(map, KEY_SCHEDULE_ID, scheduleId);
        return map;
    }

    /**
     * Verifies the sync binding is complete.
     *
     * @throws ConfigurationException
     *             naming the first missing field
     */
    public SyncJobPayload requireComplete() {
        if (isBlank(dhis2Instance)) {
            throw new ConfigurationException("DHIS2 instance is required");
        }
        if (isBlank(almaInstance)) {
            throw new ConfigurationException("ALMA instance is required");
        }
        if (scorecard == null) {
            throw new ConfigurationException("Scorecard is required");
        }
        if (isBlank(indicatorGroup)) {
            throw new ConfigurationException("Indicator group is required");
        }
        return this;
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String string(Object value) {
        return value != null ? String.valueOf(value) : null;
    }

    private static Integer integer(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        String text = String.valueOf(value).trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return Integer.valueOf(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("scorecard must be a number, got " + text, e);
        }
    }

    private static List<String> stringList(Object value) {
        if (value == null) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        if (value instanceof Iterable<?> items) {
            for (Object item : items) {
                if (item != null) {
                    result.add(String.valueOf(item));
                }
            }
        } else {
            for (String part : String.valueOf(value).split(",")) {
                if (!part.isBlank()) {
                    result.add(part.trim());
                }
            }
        }
        return result;
    }
}
