/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.almasync.api.types;

import java.time.Instant;

import org.eclipse.microprofile.openapi.annotations.media.Schema;
import villagecompute.almasync.jobs.JobState;
import villagecompute.almasync.jobs.QueuedJob;

/**
 * API type for a job instance in the queue.
 */
@Schema(
        description = "Job instance held by the job queue")
public record JobStatusType(@Schema(
        description = "Job id (schedule id, or repeat:<key>:<millis> for cron instances)",
        required = true) String id,

        @Schema(
                description = "Processor name",
                example = "dhis2-alma-sync") String name,

        @Schema(
                description = "Schedule the job belongs to",
                nullable = true) String scheduleId,

        @Schema(
                description = "Queue state",
                example = "active",
                required = true) JobState state,

        @Schema(
                description = "Progress reported by the processor (0-100)",
                example = "12.5") double progress,

        @Schema(
                description = "Attempts used so far",
                example = "1") int attemptsMade,

        @Schema(
                description = "Maximum attempts",
                example = "3") int maxAttempts,

        @Schema(
                description = "Owning repeatable definition",
                nullable = true) String repeatKey,

        @Schema(
                description = "Start of the current or last attempt",
                nullable = true) Instant processedOn,

        @Schema(
                description = "Time the job completed or failed for good",
                nullable = true) Instant finishedOn,

        @Schema(
                description = "Error message of the last failed attempt",
                nullable = true) String failedReason,

        @Schema(
                description = "Enqueue time") Instant createdAt) {

    public static JobStatusType fromJob(QueuedJob job) {
        return new JobStatusType(job.id(), job.name(), job.scheduleId(), job.state(), job.progress(),
                job.attemptsMade(), job.maxAttempts(), job.repeatKey(), job.processedOn(), job.finishedOn(),
                job.failedReason(), job.createdAt());
    }
}
