/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.data.models;

import java.util.List;
import java.util.Map;

/**
 * Partial update of a schedule's definition. A null component means "keep the current value".
 *
 * <p>
 * Runtime state (status, progress, activation, job back-reference) is deliberately absent: those fields only change
 * through the scheduler's transition methods.
 *
 * @param name
 *            display name
 * @param trigger
 *            scheduling mode
 * @param cronExpression
 *            cron pattern for recurring schedules
 * @param runImmediately
 *            fire a recurring schedule once on registration
 * @param periods
 *            explicit target periods
 * @param processor
 *            processor name the job is routed to
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
 *            nested overrides merged into the job payload
 * @param maxRetries
 *            job attempt budget
 * @param retryDelay
 *            base retry delay in seconds
 */
public record ScheduleUpdate(String name, Schedule.Trigger trigger, String cronExpression, Boolean runImmediately,
        List<String> periods, String processor, String dhis2Instance, String almaInstance, Integer scorecard,
        String indicatorGroup, PeriodType periodType, RunFor runFor, Map<String, Object> data, Integer maxRetries,
        Integer retryDelay) {

    /**
     * @return true when no field is set
     */
    public boolean isEmpty() {
        return name == null && trigger == null && cronExpression == null && runImmediately == null && periods == null
                && processor == null && dhis2Instance == null && almaInstance == null && scorecard == null
                && indicatorGroup == null && periodType == null && runFor == null && data == null && maxRetries == null
                && retryDelay == null;
    }
}
