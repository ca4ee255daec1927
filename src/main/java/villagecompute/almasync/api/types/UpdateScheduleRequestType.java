/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.api.types;

import java.util.List;
import java.util.Map;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import villagecompute.almasync.data.models.PeriodType;
import villagecompute.almasync.data.models.RunFor;
import villagecompute.almasync.data.models.Schedule;
import villagecompute.almasync.data.models.ScheduleUpdate;

/**
 * API type for a partial schedule update ({@code PUT /api/schedules/{id}}). Null fields keep their current value.
 */
public record UpdateScheduleRequestType(@Size(
        min = 1,
        max = 255) String name, Schedule.Trigger type, String cronExpression, Boolean runImmediately,
        List<String> periods, String processor, String dhis2Instance, String almaInstance, Integer scorecard,
        String indicatorGroup, PeriodType periodType, RunFor runFor, Map<String, Object> data,
        @Min(1) Integer maxRetries, @Min(0) Integer retryDelay) {

    public ScheduleUpdate toUpdate() {
        return new ScheduleUpdate(name, type, cronExpression, runImmediately, periods, processor, dhis2Instance,
                almaInstance, scorecard, indicatorGroup, periodType, runFor, data, maxRetries, retryDelay);
    }
}
