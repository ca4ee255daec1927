/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.api.types;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotNull;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import villagecompute.almasync.data.models.PeriodType;
import villagecompute.almasync.data.models.RunFor;
import villagecompute.almasync.data.models.Schedule;

/**
 * API type for a sync schedule: definition plus runtime state.
 *
 * <p>
 * Returned by {@code /api/schedules} endpoints and carried as {@code data} of schedule lifecycle events on
 * {@code /ws}.
 */
@Schema(
        description = "DHIS2 to ALMA sync schedule with its runtime state")
public record ScheduleType(@Schema(
        description = "Schedule identifier",
        example = "5f0c7c1e-8a3b-4f57-9d1e-2b7f3c9e6a10",
        required = true) @NotNull String id,

        @Schema(
                description = "Display name",
                example = "Nightly malaria scorecard",
                required = true) @NotNull String name,

        @Schema(
                description = "Scheduling mode",
                example = "recurring",
                required = true) @NotNull Schedule.Trigger type,

        @Schema(
                description = "Cron expression (5 fields, or 6 with seconds); recurring schedules only",
                example = "0 0 * * *",
                nullable = true) String cronExpression,

        @Schema(
                description = "Fire once at activation instead of waiting for the first cron tick",
                example = "false") boolean runImmediately,

        @Schema(
                description = "Explicit DHIS2 periods (one-time schedules)",
                example = "[\"202401\", \"202402\"]") List<String> periods,

        @Schema(
                description = "Job processor name",
                example = "dhis2-alma-sync",
                required = true) @NotNull String processor,

        @Schema(
                description = "Source DHIS2 instance name",
                example = "play",
                nullable = true) String dhis2Instance,

        @Schema(
                description = "Target ALMA instance name",
                example = "alma",
                nullable = true) String almaInstance,

        @Schema(
                description = "ALMA scorecard id",
                example = "42",
                nullable = true) Integer scorecard,

        @Schema(
                description = "DHIS2 indicator group id",
                example = "SWDeaw0RUyR",
                nullable = true) String indicatorGroup,

        @Schema(
                description = "Period granularity",
                example = "month",
                nullable = true) PeriodType periodType,

        @Schema(
                description = "Current or previous period",
                example = "previous",
                nullable = true) RunFor runFor,

        @Schema(
                description = "Nested overrides of the sync parameters; nested values win") Map<String, Object> data,

        @Schema(
                description = "Whether the schedule is armed",
                example = "true",
                required = true) @JsonProperty("isActive") @NotNull Boolean isActive,

        @Schema(
                description = "Current status",
                example = "running",
                required = true) @NotNull Schedule.Status status,

        @Schema(
                description = "Progress of the current run (0-100)",
                example = "37.5",
                required = true) double progress,

        @Schema(
                description = "Human-readable status message",
                example = "Processing... 37.5%",
                nullable = true) String message,

        @Schema(
                description = "Previous status",
                example = "completed",
                nullable = true) Schedule.Status lastStatus,

        @Schema(
                description = "Time of the last completed or failed run",
                example = "2025-03-01T00:00:00Z",
                nullable = true) Instant lastRun,

        @Schema(
                description = "Next cron fire time (recurring schedules)",
                example = "2025-03-02T00:00:00Z",
                nullable = true) Instant nextRun,

        @Schema(
                description = "Job currently representing the schedule",
                nullable = true) String currentJobId,

        @Schema(
                description = "Attempts used by the current job",
                example = "1") int retryAttempts,

        @Schema(
                description = "Maximum attempts per job",
                example = "3") int maxRetries,

        @Schema(
                description = "Base retry delay in seconds",
                example = "60") int retryDelay,

        @Schema(
                description = "Creation timestamp",
                required = true) Instant createdAt,

        @Schema(
                description = "Last modification timestamp",
                required = true) Instant updatedAt) {

    /**
     * Converts a Schedule entity to API type.
     *
     * @param schedule
     *            the entity to convert
     * @return ScheduleType for JSON response
     */
    public static ScheduleType fromEntity(Schedule schedule) {
        return new ScheduleType(schedule.id, schedule.name, schedule.trigger, schedule.cronExpression,
                schedule.runImmediately, schedule.periods != null ? new ArrayList<>(schedule.periods) : List.of(),
                schedule.processor, schedule.dhis2Instance, schedule.almaInstance, schedule.scorecard,
                schedule.indicatorGroup, schedule.periodType, schedule.runFor,
                schedule.data != null ? new LinkedHashMap<>(schedule.data) : Map.of(), schedule.active, schedule.status,
                schedule.progress, schedule.message, schedule.lastStatus, schedule.lastRun, schedule.nextRun,
                schedule.currentJobId, schedule.retryAttempts, schedule.maxRetries, schedule.retryDelay,
                schedule.createdAt, schedule.updatedAt);
    }
}
