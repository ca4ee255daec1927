/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.api.types;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import villagecompute.almasync.data.models.PeriodType;
import villagecompute.almasync.data.models.RunFor;
import villagecompute.almasync.data.models.Schedule;

/**
 * API type for creating a schedule.
 *
 * <p>
 * Used in {@code POST /api/schedules}. The schedule is stored inactive; {@code POST /api/schedules/{id}/start} arms
 * it.
 *
 * @param name
 *            display name
 * @param type
 *            immediate, recurring or one-time
 * @param cronExpression
 *            required for recurring schedules
 * @param runImmediately
 *            recurring only: first run at activation
 * @param periods
 *            explicit periods (one-time)
 * @param processor
 *            job processor, defaults to {@code dhis2-alma-sync}
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
 * @param data
 *            nested overrides of the sync parameters
 * @param maxRetries
 *            attempts per job (default 3)
 * @param retryDelay
 *            base retry delay in seconds (default 60)
 */
public record CreateScheduleRequestType(@NotBlank @Size(
        max = 255) String name, @NotNull Schedule.Trigger type, String cronExpression, Boolean runImmediately,
        List<String> periods, String processor, String dhis2Instance, String almaInstance, Integer scorecard,
        String indicatorGroup, PeriodType periodType, RunFor runFor, Map<String, Object> data,
        @Min(1) Integer maxRetries, @Min(0) Integer retryDelay) {

    /**
     * Builds an unsaved Schedule from this request.
     */
    public Schedule toEntity() {
        Schedule schedule = new Schedule();
        schedule.name = name;
        schedule.trigger = type;
        schedule.cronExpression = cronExpression;
        schedule.runImmediately = Boolean.TRUE.equals(runImmediately);
        schedule.periods = periods != null ? new ArrayList<>(periods) : new ArrayList<>();
        if (processor != null && !processor.isBlank()) {
            schedule.processor = processor;
        }
        schedule.dhis2Instance = dhis2Instance;
        schedule.almaInstance = almaInstance;
        schedule.scorecard = scorecard;
        schedule.indicatorGroup = indicatorGroup;
        schedule.periodType = periodType;
        schedule.runFor = runFor;
        schedule.data = data != null ? new LinkedHashMap<>(data) : new LinkedHashMap<>();
        if (maxRetries != null) {
            schedule.maxRetries = maxRetries;
        }
        if (retryDelay != null) {
            schedule.retryDelay = retryDelay;
        }
        return schedule;
    }
}
