/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.api.types;

import java.time.Instant;

import org.eclipse.microprofile.openapi.annotations.media.Schema;
import villagecompute.almasync.jobs.RepeatableJobInfo;

/**
 * Cron definition registered with the job queue.
 */
@Schema(
        description = "Repeatable (cron) job definition")
public record RepeatableJobType(@Schema(
        description = "Repeat key (the schedule id)",
        required = true) String key,

        @Schema(
                description = "Processor name",
                example = "dhis2-alma-sync") String name,

        @Schema(
                description = "Cron pattern",
                example = "0 0 * * *") String pattern,

        @Schema(
                description = "Next fire time",
                nullable = true) Instant nextRunAt,

        @Schema(
                description = "Last fire time",
                nullable = true) Instant lastRunAt) {

    public static RepeatableJobType fromInfo(RepeatableJobInfo info) {
        return new RepeatableJobType(info.key(), info.name(), info.pattern(), info.nextRunAt(), info.lastRunAt());
    }
}
