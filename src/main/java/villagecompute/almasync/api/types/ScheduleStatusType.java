/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.api.types;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Schedule together with the job that currently represents it.
 *
 * @param schedule
 *            schedule record
 * @param job
 *            current job, null when the runtime holds none
 */
@Schema(
        description = "Schedule record with the state of its current job")
public record ScheduleStatusType(@Schema(
        required = true) ScheduleType schedule,

        @Schema(
                nullable = true) JobStatusType job) {
}
